package com.example.videoenhance.pipeline;

import com.example.videoenhance.ai.core.VideoEnhancementException;

/**
 * The input is outside what the pipeline accepts (too long, too large, unreadable).
 */
public class InputRejectedException extends VideoEnhancementException {

    public InputRejectedException(String message) {
        super(message);
    }
}
