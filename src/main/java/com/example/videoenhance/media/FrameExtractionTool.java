package com.example.videoenhance.media;

import java.nio.file.Path;
import java.util.List;

/**
 * Splits a video into numbered still frames and joins frames back into a video.
 */
public interface FrameExtractionTool {

    /**
     * Writes {@code frame_000001.png}, {@code frame_000002.png}, ... into {@code outputDir}.
     *
     * @param fps extraction rate, or null to keep every source frame
     * @return the written frame files in sequence order
     */
    List<Path> extractFrames(Path input, Double fps, Path outputDir);

    /**
     * Encodes the numbered frames in {@code framesDir} at {@code fps}. With {@code copyAudio},
     * the audio stream of {@code originalInput} is copied bit-for-bit when it has one.
     */
    Path reassemble(Path framesDir, Path originalInput, double fps, boolean copyAudio, Path output);
}
