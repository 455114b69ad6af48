package com.example.videoenhance.ai.providers;

import com.example.videoenhance.model.Frame;

/**
 * Output of an enhancement call: the edited frame and whatever text the model
 * returned alongside it describing the changes.
 */
public record EditedImage(Frame frame, String description) {
}
