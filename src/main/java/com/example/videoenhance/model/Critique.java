package com.example.videoenhance.model;

import java.util.List;

/**
 * Structured critique of an edited frame. Built only by the critique adapter
 * at the service boundary, so the score is always within [0, 10] and the
 * issue list is never null.
 */
public final class Critique {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    private final double score;
    private final List<CritiqueIssue> issues;
    private final String assessment;

    public Critique(double score, List<CritiqueIssue> issues, String assessment) {
        this.score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
        this.issues = issues == null ? List.of() : List.copyOf(issues);
        this.assessment = assessment;
    }

    public Critique(double score, List<CritiqueIssue> issues) {
        this(score, issues, null);
    }

    public double getScore() {
        return score;
    }

    public List<CritiqueIssue> getIssues() {
        return issues;
    }

    public String getAssessment() {
        return assessment;
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public boolean hasSurgicalIssues() {
        return issues.stream().anyMatch(CritiqueIssue::surgical);
    }

    public List<CritiqueIssue> surgicalIssues() {
        return issues.stream().filter(CritiqueIssue::surgical).toList();
    }

    @Override
    public String toString() {
        return String.format("Critique{score=%.1f, issues=%d}", score, issues.size());
    }
}
