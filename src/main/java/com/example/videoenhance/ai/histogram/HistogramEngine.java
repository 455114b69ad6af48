package com.example.videoenhance.ai.histogram;

import com.example.videoenhance.model.Frame;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Color histograms and histogram similarity used to decide which consecutive
 * frames look alike. Both operations are pure.
 */
@Service
public class HistogramEngine {

    public static final int DEFAULT_BINS = 32;

    private final int binsPerChannel;

    public HistogramEngine() {
        this(DEFAULT_BINS);
    }

    @Autowired
    public HistogramEngine(@Value("${enhancement.histogram.bins:32}") int binsPerChannel) {
        if (binsPerChannel < 2 || binsPerChannel > 256) {
            throw new IllegalArgumentException("Histogram bins must be within [2, 256]: " + binsPerChannel);
        }
        this.binsPerChannel = binsPerChannel;
    }

    public int getBinsPerChannel() {
        return binsPerChannel;
    }

    /**
     * Computes the normalized joint RGB histogram of a frame. A channel value
     * {@code v} falls into bin {@code floor(v * bins / 256)}.
     */
    public ColorHistogram compute(Frame frame) {
        int b = binsPerChannel;
        double[] bins = new double[b * b * b];
        int pixelCount = frame.getPixelCount();

        for (int i = 0; i < pixelCount; i++) {
            int rgb = frame.getRgb(i);
            int rBin = ((rgb >> 16) & 0xFF) * b / 256;
            int gBin = ((rgb >> 8) & 0xFF) * b / 256;
            int bBin = (rgb & 0xFF) * b / 256;
            bins[(rBin * b + gBin) * b + bBin]++;
        }

        double total = pixelCount;
        for (int i = 0; i < bins.length; i++) {
            bins[i] /= total;
        }
        return new ColorHistogram(b, bins);
    }

    /**
     * Pearson correlation between two flattened histograms, in [-1, 1].
     * 1.0 means identical distributions, 0 uncorrelated, negative inverse.
     * Equivalent to OpenCV's HISTCMP_CORREL.
     */
    public double similarity(ColorHistogram h1, ColorHistogram h2) {
        if (h1.size() != h2.size()) {
            throw new IllegalArgumentException(
                "Histograms have different resolutions: " + h1.getBinsPerChannel() + " vs " + h2.getBinsPerChannel());
        }
        if (h1 == h2 || h1.sameBins(h2)) {
            return 1.0;
        }

        int n = h1.size();
        double mean1 = 0;
        double mean2 = 0;
        for (int i = 0; i < n; i++) {
            mean1 += h1.get(i);
            mean2 += h2.get(i);
        }
        mean1 /= n;
        mean2 /= n;

        double numerator = 0;
        double denom1 = 0;
        double denom2 = 0;
        for (int i = 0; i < n; i++) {
            double d1 = h1.get(i) - mean1;
            double d2 = h2.get(i) - mean2;
            numerator += d1 * d2;
            denom1 += d1 * d1;
            denom2 += d2 * d2;
        }

        // A flat histogram has no variance; it correlates with nothing but an identical one.
        if (denom1 == 0 || denom2 == 0) {
            return 0.0;
        }

        double correlation = numerator / Math.sqrt(denom1 * denom2);
        return Math.max(-1.0, Math.min(1.0, correlation));
    }

    public double similarity(Frame f1, Frame f2) {
        return similarity(compute(f1), compute(f2));
    }
}
