package com.example.videoenhance.media;

import org.springframework.stereotype.Component;

/**
 * Chooses how many frames per second to extract. Shorter clips keep more of
 * their frames; longer ones are thinned so the number of frames to enhance
 * stays bounded.
 */
@Component
public class ExtractionRatePolicy {

    static final double SHORT_CLIP_MAX_FPS = 30;

    /**
     * @param durationSeconds source duration
     * @param sourceFps       source frame rate, or 0 when unknown
     * @param requestedFps    explicit rate from the run config, or null for automatic
     */
    public double choose(double durationSeconds, double sourceFps, Double requestedFps) {
        if (requestedFps != null && requestedFps > 0) {
            return sourceFps > 0 ? Math.min(requestedFps, sourceFps) : requestedFps;
        }
        if (durationSeconds <= 30) {
            return capAtSource(SHORT_CLIP_MAX_FPS, sourceFps);
        }
        if (durationSeconds <= 60) {
            return capAtSource(15, sourceFps);
        }
        if (durationSeconds <= 120) {
            return capAtSource(10, sourceFps);
        }
        return capAtSource(5, sourceFps);
    }

    // Extraction never samples faster than the source, which would only duplicate frames.
    private static double capAtSource(double rate, double sourceFps) {
        return sourceFps > 0 ? Math.min(sourceFps, rate) : rate;
    }
}
