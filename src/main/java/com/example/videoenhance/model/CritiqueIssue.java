package com.example.videoenhance.model;

/**
 * One remaining problem reported by the critique service.
 *
 * @param description what is wrong, phrased as an edit instruction where the provider gives one
 * @param region      named image region the issue is confined to ("global" when not localized)
 * @param surgical    true when the issue should be fixed by a mask-based edit of {@code region}
 */
public record CritiqueIssue(String description, String region, boolean surgical) {

    public static final String GLOBAL_REGION = "global";

    public static CritiqueIssue global(String description) {
        return new CritiqueIssue(description, GLOBAL_REGION, false);
    }

    public static CritiqueIssue surgical(String description, String region) {
        return new CritiqueIssue(description, region, true);
    }
}
