package com.example.videoenhance.ai.lut;

import com.example.videoenhance.model.Frame;

import java.io.IOException;

/**
 * Receives output frames. Implementations place each frame by {@link Frame#getIndex()},
 * so write order does not matter.
 */
@FunctionalInterface
public interface FrameSink {

    void write(Frame frame) throws IOException;
}
