package com.example.videoenhance.controller.dto;

import com.example.videoenhance.pipeline.EnhancementConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

/**
 * Per-request overrides of the configured run defaults. Null fields keep the default.
 */
public class ConfigOverrides {

    @Positive
    private Double maxDurationSeconds;

    @Positive
    private Double extractionFrameRate;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private Double groupSimilarityThreshold;

    @Min(1)
    private Integer maxIterationsPerGroup;

    @DecimalMin("0")
    @DecimalMax("10")
    private Double qualityScoreTarget;

    @Min(1)
    private Integer concurrency;

    @Min(0)
    private Long wallClockBudgetSeconds;

    @Min(2)
    @Max(256)
    private Integer lutSize;

    @Positive
    private Long maxInputBytes;

    private String userFeedback;

    public EnhancementConfig applyTo(EnhancementConfig config) {
        if (maxDurationSeconds != null) config.setMaxDurationSeconds(maxDurationSeconds);
        if (extractionFrameRate != null) config.setExtractionFrameRate(extractionFrameRate);
        if (groupSimilarityThreshold != null) config.setGroupSimilarityThreshold(groupSimilarityThreshold);
        if (maxIterationsPerGroup != null) config.setMaxIterationsPerGroup(maxIterationsPerGroup);
        if (qualityScoreTarget != null) config.setQualityScoreTarget(qualityScoreTarget);
        if (concurrency != null) config.setConcurrency(concurrency);
        if (wallClockBudgetSeconds != null) config.setWallClockBudgetSeconds(wallClockBudgetSeconds);
        if (lutSize != null) config.setLutSize(lutSize);
        if (maxInputBytes != null) config.setMaxInputBytes(maxInputBytes);
        if (userFeedback != null && !userFeedback.isBlank()) config.setUserFeedback(userFeedback.trim());
        return config;
    }

    public Double getMaxDurationSeconds() { return maxDurationSeconds; }
    public void setMaxDurationSeconds(Double maxDurationSeconds) { this.maxDurationSeconds = maxDurationSeconds; }

    public Double getExtractionFrameRate() { return extractionFrameRate; }
    public void setExtractionFrameRate(Double extractionFrameRate) { this.extractionFrameRate = extractionFrameRate; }

    public Double getGroupSimilarityThreshold() { return groupSimilarityThreshold; }
    public void setGroupSimilarityThreshold(Double groupSimilarityThreshold) { this.groupSimilarityThreshold = groupSimilarityThreshold; }

    public Integer getMaxIterationsPerGroup() { return maxIterationsPerGroup; }
    public void setMaxIterationsPerGroup(Integer maxIterationsPerGroup) { this.maxIterationsPerGroup = maxIterationsPerGroup; }

    public Double getQualityScoreTarget() { return qualityScoreTarget; }
    public void setQualityScoreTarget(Double qualityScoreTarget) { this.qualityScoreTarget = qualityScoreTarget; }

    public Integer getConcurrency() { return concurrency; }
    public void setConcurrency(Integer concurrency) { this.concurrency = concurrency; }

    public Long getWallClockBudgetSeconds() { return wallClockBudgetSeconds; }
    public void setWallClockBudgetSeconds(Long wallClockBudgetSeconds) { this.wallClockBudgetSeconds = wallClockBudgetSeconds; }

    public Integer getLutSize() { return lutSize; }
    public void setLutSize(Integer lutSize) { this.lutSize = lutSize; }

    public Long getMaxInputBytes() { return maxInputBytes; }
    public void setMaxInputBytes(Long maxInputBytes) { this.maxInputBytes = maxInputBytes; }

    public String getUserFeedback() { return userFeedback; }
    public void setUserFeedback(String userFeedback) { this.userFeedback = userFeedback; }
}
