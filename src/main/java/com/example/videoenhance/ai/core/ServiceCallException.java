package com.example.videoenhance.ai.core;

/**
 * An external AI service call failed. Not retried unless it is one of the
 * retryable subclasses.
 */
public class ServiceCallException extends VideoEnhancementException {

    private final String provider;

    public ServiceCallException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public ServiceCallException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isRetryable() {
        return false;
    }
}
