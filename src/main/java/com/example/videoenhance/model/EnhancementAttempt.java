package com.example.videoenhance.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable record of one group's improve-and-critique loop. Owned by the single
 * worker that enhances the group; becomes read-only once a terminal state is
 * reached.
 */
public class EnhancementAttempt {

    private final int groupIndex;
    private final Frame original;
    private Frame edited;
    private Critique critique;
    private int iterations;
    private EnhancementState state = EnhancementState.ENHANCING;
    private StopReason stopReason;
    private String enhancementDescription;
    private final List<String> improvementsApplied = new ArrayList<>();
    private final List<GroupDegradationNotice> notices = new ArrayList<>();

    public EnhancementAttempt(int groupIndex, Frame original) {
        this.groupIndex = groupIndex;
        this.original = original;
    }

    public int getGroupIndex() {
        return groupIndex;
    }

    public Frame getOriginal() {
        return original;
    }

    /**
     * Latest accepted edit, or null when no enhancement call has succeeded.
     */
    public Frame getEdited() {
        return edited;
    }

    public boolean hasEdit() {
        return edited != null;
    }

    /**
     * Best frame available right now: the latest edit, falling back to the original.
     */
    public Frame getBestFrame() {
        return edited != null ? edited : original;
    }

    public Critique getCritique() {
        return critique;
    }

    public int getIterations() {
        return iterations;
    }

    public EnhancementState getState() {
        return state;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public String getEnhancementDescription() {
        return enhancementDescription;
    }

    public List<String> getImprovementsApplied() {
        return Collections.unmodifiableList(improvementsApplied);
    }

    public List<GroupDegradationNotice> getNotices() {
        return Collections.unmodifiableList(notices);
    }

    public Double getFinalScore() {
        return critique != null ? critique.getScore() : null;
    }

    public void acceptEdit(Frame newEdit) {
        requireOpen();
        this.edited = newEdit;
    }

    public void recordCritique(Critique newCritique) {
        requireOpen();
        this.critique = newCritique;
    }

    /**
     * Moves into an editing state (ENHANCING, SURGICAL_EDIT or GLOBAL_RETRY) and counts the iteration.
     */
    public void beginEditing(EnhancementState editingState) {
        requireOpen();
        if (editingState != EnhancementState.ENHANCING
                && editingState != EnhancementState.SURGICAL_EDIT
                && editingState != EnhancementState.GLOBAL_RETRY) {
            throw new IllegalArgumentException("Not an editing state: " + editingState);
        }
        this.state = editingState;
        this.iterations++;
    }

    public void beginAnalyzing() {
        requireOpen();
        this.state = EnhancementState.ANALYZING;
    }

    public void finish(EnhancementState terminalState, StopReason reason) {
        if (!terminalState.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminalState);
        }
        requireOpen();
        this.state = terminalState;
        this.stopReason = reason;
    }

    public void setEnhancementDescription(String enhancementDescription) {
        this.enhancementDescription = enhancementDescription;
    }

    public void addImprovement(String improvement) {
        improvementsApplied.add(improvement);
    }

    public void addNotice(DegradationReason reason, String detail) {
        notices.add(new GroupDegradationNotice(groupIndex, reason, detail));
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    private void requireOpen() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Enhancement attempt for group " + groupIndex + " is already " + state);
        }
    }

    @Override
    public String toString() {
        return String.format("EnhancementAttempt{group=%d, state=%s, iterations=%d, stop=%s, critique=%s}",
                           groupIndex, state, iterations, stopReason, critique);
    }
}
