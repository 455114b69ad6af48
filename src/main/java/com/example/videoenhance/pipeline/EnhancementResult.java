package com.example.videoenhance.pipeline;

import com.example.videoenhance.model.GroupDegradationNotice;
import com.example.videoenhance.model.VideoMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one enhancement run: where the video was written, how it was
 * split and what degraded along the way.
 */
public class EnhancementResult {

    private String outputPath;
    private VideoMetadata sourceMetadata;
    private double extractionFrameRate;
    private int totalFrames;
    private int totalGroups;
    private long processingTimeMs;
    private String summary;
    private List<GroupEnhancementResult> groups = new ArrayList<>();

    public EnhancementResult() {}

    /**
     * All notices across groups, in group order.
     */
    public List<GroupDegradationNotice> getNotices() {
        List<GroupDegradationNotice> all = new ArrayList<>();
        for (GroupEnhancementResult group : groups) {
            all.addAll(group.getNotices());
        }
        return all;
    }

    public long getDegradedGroupCount() {
        return groups.stream().filter(GroupEnhancementResult::isDegraded).count();
    }

    public String getOutputPath() { return outputPath; }
    public void setOutputPath(String outputPath) { this.outputPath = outputPath; }

    public VideoMetadata getSourceMetadata() { return sourceMetadata; }
    public void setSourceMetadata(VideoMetadata sourceMetadata) { this.sourceMetadata = sourceMetadata; }

    public double getExtractionFrameRate() { return extractionFrameRate; }
    public void setExtractionFrameRate(double extractionFrameRate) { this.extractionFrameRate = extractionFrameRate; }

    public int getTotalFrames() { return totalFrames; }
    public void setTotalFrames(int totalFrames) { this.totalFrames = totalFrames; }

    public int getTotalGroups() { return totalGroups; }
    public void setTotalGroups(int totalGroups) { this.totalGroups = totalGroups; }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public List<GroupEnhancementResult> getGroups() { return groups; }
    public void setGroups(List<GroupEnhancementResult> groups) { this.groups = groups; }
}
