package com.example.videoenhance.pipeline;

import com.example.videoenhance.media.ExtractionRatePolicy;
import org.springframework.stereotype.Component;

/**
 * Rough processing-time estimate shown to callers before they start a run.
 */
@Component
public class EnhancementEstimator {

    static final double FRAMES_PER_GROUP = 30;
    static final double SECONDS_PER_GROUP = 15;
    static final double OVERHEAD_SECONDS = 15;  // extraction + reassembly

    private final ExtractionRatePolicy ratePolicy;

    public EnhancementEstimator(ExtractionRatePolicy ratePolicy) {
        this.ratePolicy = ratePolicy;
    }

    public double estimateSeconds(double durationSeconds, double sourceFps) {
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative: " + durationSeconds);
        }
        double totalFrames = durationSeconds * ratePolicy.choose(durationSeconds, sourceFps, null);
        double groups = Math.max(1, totalFrames / FRAMES_PER_GROUP);
        return groups * SECONDS_PER_GROUP + OVERHEAD_SECONDS;
    }
}
