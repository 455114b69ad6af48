package com.example.videoenhance.ai.core;

/**
 * Timeout, rate limit or 5xx from an AI service.
 */
public class TransientServiceException extends ServiceCallException {

    public TransientServiceException(String provider, String message) {
        super(provider, message);
    }

    public TransientServiceException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
