package com.example.videoenhance.ai.core;

/**
 * Enum defining the external AI capabilities the pipeline consumes
 */
public enum AIModelType {
    /**
     * Instruction-driven whole-frame editing
     */
    IMAGE_ENHANCEMENT,

    /**
     * Scores an edited frame and lists remaining issues
     */
    CRITIQUE,

    /**
     * Edits only the masked region of a frame
     */
    MASK_EDIT
}
