package com.example.videoenhance.pipeline;

/**
 * Settings for one enhancement run. Start from
 * {@link com.example.videoenhance.config.EnhancementProperties#toConfig()} and
 * override per request.
 */
public class EnhancementConfig {

    public static final double DEFAULT_MAX_DURATION_SECONDS = 120;
    public static final double DEFAULT_GROUP_SIMILARITY_THRESHOLD = 0.92;
    public static final int DEFAULT_MAX_ITERATIONS_PER_GROUP = 3;
    public static final double DEFAULT_QUALITY_SCORE_TARGET = 8.5;
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final long DEFAULT_WALL_CLOCK_BUDGET_SECONDS = 900;
    public static final int DEFAULT_LUT_SIZE = 32;
    public static final long DEFAULT_MAX_INPUT_BYTES = 2L * 1024 * 1024 * 1024;

    private double maxDurationSeconds = DEFAULT_MAX_DURATION_SECONDS;
    private Double extractionFrameRate;  // null = pick by duration
    private double groupSimilarityThreshold = DEFAULT_GROUP_SIMILARITY_THRESHOLD;
    private int maxIterationsPerGroup = DEFAULT_MAX_ITERATIONS_PER_GROUP;
    private double qualityScoreTarget = DEFAULT_QUALITY_SCORE_TARGET;
    private int concurrency = DEFAULT_CONCURRENCY;
    private long wallClockBudgetSeconds = DEFAULT_WALL_CLOCK_BUDGET_SECONDS;
    private int lutSize = DEFAULT_LUT_SIZE;
    private long maxInputBytes = DEFAULT_MAX_INPUT_BYTES;
    private String userFeedback;

    /**
     * @throws IllegalArgumentException naming the first invalid field
     */
    public void validate() {
        if (maxDurationSeconds <= 0) {
            throw new IllegalArgumentException("maxDurationSeconds must be positive: " + maxDurationSeconds);
        }
        if (extractionFrameRate != null && !(extractionFrameRate > 0)) {
            throw new IllegalArgumentException("extractionFrameRate must be positive: " + extractionFrameRate);
        }
        if (!(groupSimilarityThreshold > 0 && groupSimilarityThreshold <= 1)) {
            throw new IllegalArgumentException("groupSimilarityThreshold must be within (0, 1]: " + groupSimilarityThreshold);
        }
        if (maxIterationsPerGroup < 1) {
            throw new IllegalArgumentException("maxIterationsPerGroup must be at least 1: " + maxIterationsPerGroup);
        }
        if (qualityScoreTarget < 0 || qualityScoreTarget > 10) {
            throw new IllegalArgumentException("qualityScoreTarget must be within [0, 10]: " + qualityScoreTarget);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        if (wallClockBudgetSeconds < 0) {
            throw new IllegalArgumentException("wallClockBudgetSeconds must not be negative: " + wallClockBudgetSeconds);
        }
        if (lutSize < 2 || lutSize > 256) {
            throw new IllegalArgumentException("lutSize must be within [2, 256]: " + lutSize);
        }
        if (maxInputBytes <= 0) {
            throw new IllegalArgumentException("maxInputBytes must be positive: " + maxInputBytes);
        }
    }

    public double getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    public void setMaxDurationSeconds(double maxDurationSeconds) {
        this.maxDurationSeconds = maxDurationSeconds;
    }

    public Double getExtractionFrameRate() {
        return extractionFrameRate;
    }

    public void setExtractionFrameRate(Double extractionFrameRate) {
        this.extractionFrameRate = extractionFrameRate;
    }

    public double getGroupSimilarityThreshold() {
        return groupSimilarityThreshold;
    }

    public void setGroupSimilarityThreshold(double groupSimilarityThreshold) {
        this.groupSimilarityThreshold = groupSimilarityThreshold;
    }

    public int getMaxIterationsPerGroup() {
        return maxIterationsPerGroup;
    }

    public void setMaxIterationsPerGroup(int maxIterationsPerGroup) {
        this.maxIterationsPerGroup = maxIterationsPerGroup;
    }

    public double getQualityScoreTarget() {
        return qualityScoreTarget;
    }

    public void setQualityScoreTarget(double qualityScoreTarget) {
        this.qualityScoreTarget = qualityScoreTarget;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public long getWallClockBudgetSeconds() {
        return wallClockBudgetSeconds;
    }

    public void setWallClockBudgetSeconds(long wallClockBudgetSeconds) {
        this.wallClockBudgetSeconds = wallClockBudgetSeconds;
    }

    public int getLutSize() {
        return lutSize;
    }

    public void setLutSize(int lutSize) {
        this.lutSize = lutSize;
    }

    public long getMaxInputBytes() {
        return maxInputBytes;
    }

    public void setMaxInputBytes(long maxInputBytes) {
        this.maxInputBytes = maxInputBytes;
    }

    public String getUserFeedback() {
        return userFeedback;
    }

    public void setUserFeedback(String userFeedback) {
        this.userFeedback = userFeedback;
    }

    @Override
    public String toString() {
        return String.format("EnhancementConfig{maxDuration=%.0fs, fps=%s, threshold=%.2f, maxIterations=%d, "
                           + "target=%.1f, concurrency=%d, budget=%ds, lutSize=%d}",
                           maxDurationSeconds, extractionFrameRate == null ? "auto" : extractionFrameRate,
                           groupSimilarityThreshold, maxIterationsPerGroup, qualityScoreTarget, concurrency,
                           wallClockBudgetSeconds, lutSize);
    }
}
