package com.example.videoenhance.ai.grouping;

import com.example.videoenhance.ai.histogram.ColorHistogram;
import com.example.videoenhance.ai.histogram.HistogramEngine;
import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.FrameGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Partitions a frame sequence into contiguous groups of visually similar frames.
 * A new group starts whenever the histogram correlation with the previous frame
 * drops below the threshold.
 */
@Service
public class FrameGrouper {

    private static final Logger log = LoggerFactory.getLogger(FrameGrouper.class);

    /**
     * 0.95+ splits on minor lighting or camera movement; 0.85 and below merges real cuts
     * between scenes with similar palettes.
     */
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.92;

    private final HistogramEngine histogramEngine;
    private final RepresentativeSelector representativeSelector;

    @Autowired
    public FrameGrouper(HistogramEngine histogramEngine, RepresentativeSelector representativeSelector) {
        this.histogramEngine = histogramEngine;
        this.representativeSelector = representativeSelector;
    }

    public List<FrameGroup> group(List<Frame> frames, double threshold) {
        return group(frames.size(), i -> histogramEngine.compute(frames.get(i)), threshold);
    }

    public List<FrameGroup> group(List<Frame> frames) {
        return group(frames, DEFAULT_SIMILARITY_THRESHOLD);
    }

    /**
     * Streaming form: histograms are requested in index order and only the previous
     * one is retained, so callers can decode frames from disk one at a time.
     *
     * @param frameCount  number of frames in the sequence
     * @param histogramAt histogram of the frame at a given index
     * @param threshold   minimum correlation for two consecutive frames to share a group
     */
    public List<FrameGroup> group(int frameCount, IntFunction<ColorHistogram> histogramAt, double threshold) {
        List<FrameGroup> groups = new ArrayList<>();
        if (frameCount <= 0) {
            return groups;
        }

        if (threshold <= 0 || threshold > 1) {
            log.warn("Similarity threshold {} outside (0, 1], using default {}", threshold, DEFAULT_SIMILARITY_THRESHOLD);
            threshold = DEFAULT_SIMILARITY_THRESHOLD;
        }

        log.info("Grouping {} frames by color histogram similarity (threshold={})", frameCount, threshold);

        ColorHistogram previous = histogramAt.apply(0);
        int currentStart = 0;

        for (int i = 1; i < frameCount; i++) {
            ColorHistogram current = histogramAt.apply(i);
            double correlation = histogramEngine.similarity(previous, current);

            if (correlation < threshold) {
                log.debug("Scene change at frame {} (correlation={})", i, String.format("%.4f", correlation));
                groups.add(newGroup(groups.size(), currentStart, i));
                currentStart = i;
            }
            previous = current;
        }
        groups.add(newGroup(groups.size(), currentStart, frameCount));

        log.info("Frame grouping complete: {} groups over {} frames (avg {} frames/group)",
                 groups.size(), frameCount, String.format("%.1f", (double) frameCount / groups.size()));
        if (log.isDebugEnabled()) {
            groups.forEach(g -> log.debug("{}", g));
        }
        return groups;
    }

    private FrameGroup newGroup(int groupIndex, int start, int end) {
        return new FrameGroup(groupIndex, start, end, representativeSelector.select(start, end));
    }
}
