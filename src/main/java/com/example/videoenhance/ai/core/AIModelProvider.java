package com.example.videoenhance.ai.core;

/**
 * Common surface of every external AI provider.
 */
public interface AIModelProvider {

    /**
     * Get the capability this provider offers
     */
    AIModelType getModelType();

    /**
     * Get the name/identifier of this provider, used in logs and degradation notices
     */
    String getProviderName();

    /**
     * Check if this provider is configured well enough to be called
     */
    boolean isAvailable();
}
