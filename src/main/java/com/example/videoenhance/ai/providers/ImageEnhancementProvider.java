package com.example.videoenhance.ai.providers;

import com.example.videoenhance.ai.core.AIModelProvider;
import com.example.videoenhance.model.Frame;

/**
 * Instruction-driven editing of a whole frame.
 */
public interface ImageEnhancementProvider extends AIModelProvider {

    /**
     * Edit a frame according to a natural-language instruction.
     * The returned frame keeps the input's sequence index and timestamp.
     *
     * @throws com.example.videoenhance.ai.core.ServiceCallException on any service failure
     */
    EditedImage enhance(Frame frame, String instruction);
}
