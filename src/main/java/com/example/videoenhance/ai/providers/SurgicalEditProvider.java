package com.example.videoenhance.ai.providers;

import com.example.videoenhance.ai.core.AIModelProvider;
import com.example.videoenhance.model.Frame;

/**
 * Mask-constrained editing: only pixels inside the named region may change.
 */
public interface SurgicalEditProvider extends AIModelProvider {

    /**
     * @param region one of the region names understood by the mask generator; unknown names edit the whole frame
     */
    Frame edit(Frame frame, String region, String instruction);
}
