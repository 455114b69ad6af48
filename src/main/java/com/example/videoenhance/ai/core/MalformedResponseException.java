package com.example.videoenhance.ai.core;

/**
 * The service answered but the payload could not be coerced into the internal
 * shape. Retried like a transient failure.
 */
public class MalformedResponseException extends ServiceCallException {

    public MalformedResponseException(String provider, String message) {
        super(provider, message);
    }

    public MalformedResponseException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
