package com.example.videoenhance.ai.providers;

import com.example.videoenhance.ai.core.AIModelProvider;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.Frame;

/**
 * Scores an edited frame and lists what still needs fixing.
 */
public interface CritiqueProvider extends AIModelProvider {

    /**
     * @throws com.example.videoenhance.ai.core.MalformedResponseException if the answer cannot be read as a critique
     * @throws com.example.videoenhance.ai.core.ServiceCallException on any other service failure
     */
    Critique critique(Frame frame);
}
