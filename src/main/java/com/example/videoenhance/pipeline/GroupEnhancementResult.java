package com.example.videoenhance.pipeline;

import com.example.videoenhance.model.EnhancementAttempt;
import com.example.videoenhance.model.EnhancementState;
import com.example.videoenhance.model.FrameGroup;
import com.example.videoenhance.model.GroupDegradationNotice;
import com.example.videoenhance.model.StopReason;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-group outcome reported back to the caller.
 */
public class GroupEnhancementResult {

    private int groupIndex;
    private int startIndex;
    private int endIndex;
    private int representativeIndex;
    private int iterations;
    private Double finalScore;
    private EnhancementState state;
    private StopReason stopReason;
    private String enhancementDescription;
    private List<String> improvementsApplied = new ArrayList<>();
    private List<GroupDegradationNotice> notices = new ArrayList<>();

    public GroupEnhancementResult() {}

    GroupEnhancementResult(FrameGroup group) {
        this.groupIndex = group.getGroupIndex();
        this.startIndex = group.getStartIndex();
        this.endIndex = group.getEndIndex();
        this.representativeIndex = group.getRepresentativeIndex();
    }

    static GroupEnhancementResult from(FrameGroup group, EnhancementAttempt attempt) {
        GroupEnhancementResult result = new GroupEnhancementResult(group);
        result.iterations = attempt.getIterations();
        result.finalScore = attempt.getFinalScore();
        result.state = attempt.getState();
        result.stopReason = attempt.getStopReason();
        result.enhancementDescription = attempt.getEnhancementDescription();
        result.improvementsApplied.addAll(attempt.getImprovementsApplied());
        result.notices.addAll(attempt.getNotices());
        return result;
    }

    /**
     * A group written with its original frames.
     */
    static GroupEnhancementResult unchanged(FrameGroup group, StopReason stopReason, GroupDegradationNotice notice) {
        GroupEnhancementResult result = new GroupEnhancementResult(group);
        result.state = EnhancementState.TERMINAL;
        result.stopReason = stopReason;
        result.notices.add(notice);
        return result;
    }

    public boolean isDegraded() {
        return !notices.isEmpty();
    }

    public int getFrameCount() {
        return endIndex - startIndex;
    }

    public int getGroupIndex() { return groupIndex; }
    public void setGroupIndex(int groupIndex) { this.groupIndex = groupIndex; }

    public int getStartIndex() { return startIndex; }
    public void setStartIndex(int startIndex) { this.startIndex = startIndex; }

    public int getEndIndex() { return endIndex; }
    public void setEndIndex(int endIndex) { this.endIndex = endIndex; }

    public int getRepresentativeIndex() { return representativeIndex; }
    public void setRepresentativeIndex(int representativeIndex) { this.representativeIndex = representativeIndex; }

    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }

    public Double getFinalScore() { return finalScore; }
    public void setFinalScore(Double finalScore) { this.finalScore = finalScore; }

    public EnhancementState getState() { return state; }
    public void setState(EnhancementState state) { this.state = state; }

    public StopReason getStopReason() { return stopReason; }
    public void setStopReason(StopReason stopReason) { this.stopReason = stopReason; }

    public String getEnhancementDescription() { return enhancementDescription; }
    public void setEnhancementDescription(String enhancementDescription) { this.enhancementDescription = enhancementDescription; }

    public List<String> getImprovementsApplied() { return improvementsApplied; }
    public void setImprovementsApplied(List<String> improvementsApplied) { this.improvementsApplied = improvementsApplied; }

    public List<GroupDegradationNotice> getNotices() { return notices; }
    public void setNotices(List<GroupDegradationNotice> notices) { this.notices = notices; }

    void addNotice(GroupDegradationNotice notice) {
        notices.add(notice);
    }
}
