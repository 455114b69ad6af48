package com.example.videoenhance.config;

import com.example.videoenhance.pipeline.EnhancementConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Defaults for enhancement runs and shared AI-call settings, bound from
 * {@code enhancement.*}. Per-run values can be overridden per request.
 */
@Configuration
@ConfigurationProperties(prefix = "enhancement")
public class EnhancementProperties {

    /**
     * Run defaults
     */
    private double maxDurationSeconds = EnhancementConfig.DEFAULT_MAX_DURATION_SECONDS;
    private Double extractionFrameRate;
    private double groupSimilarityThreshold = EnhancementConfig.DEFAULT_GROUP_SIMILARITY_THRESHOLD;
    private int maxIterationsPerGroup = EnhancementConfig.DEFAULT_MAX_ITERATIONS_PER_GROUP;
    private double qualityScoreTarget = EnhancementConfig.DEFAULT_QUALITY_SCORE_TARGET;
    private int concurrency = EnhancementConfig.DEFAULT_CONCURRENCY;
    private long wallClockBudgetSeconds = EnhancementConfig.DEFAULT_WALL_CLOCK_BUDGET_SECONDS;
    private int lutSize = EnhancementConfig.DEFAULT_LUT_SIZE;
    private long maxInputBytes = EnhancementConfig.DEFAULT_MAX_INPUT_BYTES;

    /**
     * Scratch space for extracted and enhanced frames; system temp dir when empty
     */
    private String workDir;

    private Ai ai = new Ai();

    public EnhancementConfig toConfig() {
        EnhancementConfig config = new EnhancementConfig();
        config.setMaxDurationSeconds(maxDurationSeconds);
        config.setExtractionFrameRate(extractionFrameRate);
        config.setGroupSimilarityThreshold(groupSimilarityThreshold);
        config.setMaxIterationsPerGroup(maxIterationsPerGroup);
        config.setQualityScoreTarget(qualityScoreTarget);
        config.setConcurrency(concurrency);
        config.setWallClockBudgetSeconds(wallClockBudgetSeconds);
        config.setLutSize(lutSize);
        config.setMaxInputBytes(maxInputBytes);
        return config;
    }

    // Getters and setters
    public double getMaxDurationSeconds() { return maxDurationSeconds; }
    public void setMaxDurationSeconds(double maxDurationSeconds) { this.maxDurationSeconds = maxDurationSeconds; }

    public Double getExtractionFrameRate() { return extractionFrameRate; }
    public void setExtractionFrameRate(Double extractionFrameRate) { this.extractionFrameRate = extractionFrameRate; }

    public double getGroupSimilarityThreshold() { return groupSimilarityThreshold; }
    public void setGroupSimilarityThreshold(double groupSimilarityThreshold) { this.groupSimilarityThreshold = groupSimilarityThreshold; }

    public int getMaxIterationsPerGroup() { return maxIterationsPerGroup; }
    public void setMaxIterationsPerGroup(int maxIterationsPerGroup) { this.maxIterationsPerGroup = maxIterationsPerGroup; }

    public double getQualityScoreTarget() { return qualityScoreTarget; }
    public void setQualityScoreTarget(double qualityScoreTarget) { this.qualityScoreTarget = qualityScoreTarget; }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public long getWallClockBudgetSeconds() { return wallClockBudgetSeconds; }
    public void setWallClockBudgetSeconds(long wallClockBudgetSeconds) { this.wallClockBudgetSeconds = wallClockBudgetSeconds; }

    public int getLutSize() { return lutSize; }
    public void setLutSize(int lutSize) { this.lutSize = lutSize; }

    public long getMaxInputBytes() { return maxInputBytes; }
    public void setMaxInputBytes(long maxInputBytes) { this.maxInputBytes = maxInputBytes; }

    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }

    public Ai getAi() { return ai; }
    public void setAi(Ai ai) { this.ai = ai; }

    /**
     * Limits shared by every outbound AI call
     */
    public static class Ai {
        private int maxConcurrentCalls = 5;
        private long retryBackoffMs = 2000;
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 120000;

        public int getMaxConcurrentCalls() { return maxConcurrentCalls; }
        public void setMaxConcurrentCalls(int maxConcurrentCalls) { this.maxConcurrentCalls = maxConcurrentCalls; }

        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }

        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public int getReadTimeoutMs() { return readTimeoutMs; }
        public void setReadTimeoutMs(int readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }
    }
}
