package com.example.videoenhance.model;

import java.nio.file.Path;

/**
 * An extracted frame on disk. Pixels are loaded on demand through
 * {@link com.example.videoenhance.media.FrameCodec}.
 */
public record FrameFile(int index, double timestampSeconds, Path path) {
}
