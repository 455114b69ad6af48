package com.example.videoenhance.ai.histogram;

import java.util.Arrays;

/**
 * Normalized joint RGB histogram with {@code bins} bins per channel, flattened
 * as {@code r*bins*bins + g*bins + b}. Bin values sum to 1.0 for a non-empty frame.
 */
public final class ColorHistogram {

    private final int binsPerChannel;
    private final double[] bins;

    ColorHistogram(int binsPerChannel, double[] bins) {
        this.binsPerChannel = binsPerChannel;
        this.bins = bins;
    }

    public int getBinsPerChannel() {
        return binsPerChannel;
    }

    public int size() {
        return bins.length;
    }

    public double get(int flatIndex) {
        return bins[flatIndex];
    }

    public double get(int rBin, int gBin, int bBin) {
        return bins[(rBin * binsPerChannel + gBin) * binsPerChannel + bBin];
    }

    public double sum() {
        double total = 0;
        for (double v : bins) {
            total += v;
        }
        return total;
    }

    boolean sameBins(ColorHistogram other) {
        return Arrays.equals(bins, other.bins);
    }
}
