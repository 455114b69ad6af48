package com.example.videoenhance.ai.core;

/**
 * Base type for every failure raised by the enhancement pipeline.
 */
public class VideoEnhancementException extends RuntimeException {

    public VideoEnhancementException(String message) {
        super(message);
    }

    public VideoEnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
