package com.example.videoenhance.ai.lut;

import com.example.videoenhance.model.Frame;

import java.io.IOException;

/**
 * Loads a frame by its global sequence index.
 */
@FunctionalInterface
public interface FrameSource {

    Frame load(int index) throws IOException;
}
