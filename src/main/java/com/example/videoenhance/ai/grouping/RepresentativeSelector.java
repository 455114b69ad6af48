package com.example.videoenhance.ai.grouping;

import org.springframework.stereotype.Component;

/**
 * Picks the frame sent to the enhancement service for a group: the temporal
 * midpoint, which stays clear of transition frames at either boundary.
 */
@Component
public class RepresentativeSelector {

    /**
     * @param start first frame index of the group (inclusive)
     * @param end   last frame index of the group (exclusive)
     * @return {@code start + (end - start) / 2}
     */
    public int select(int start, int end) {
        if (end <= start) {
            throw new IllegalArgumentException(String.format("Empty group [%d, %d)", start, end));
        }
        return start + (end - start) / 2;
    }
}
