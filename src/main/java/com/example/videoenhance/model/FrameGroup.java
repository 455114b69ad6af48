package com.example.videoenhance.model;

/**
 * A contiguous run of visually equivalent frames, as the half-open index
 * range [start, end) over the extracted frame sequence, plus the index of
 * the frame chosen to represent the group.
 */
public class FrameGroup {
    private final int groupIndex;
    private final int startIndex;
    private final int endIndex;
    private final int representativeIndex;

    public FrameGroup(int groupIndex, int startIndex, int endIndex, int representativeIndex) {
        if (startIndex < 0 || endIndex <= startIndex) {
            throw new IllegalArgumentException(
                String.format("Invalid group range [%d, %d)", startIndex, endIndex));
        }
        if (representativeIndex < startIndex || representativeIndex >= endIndex) {
            throw new IllegalArgumentException(
                String.format("Representative %d outside [%d, %d)", representativeIndex, startIndex, endIndex));
        }
        this.groupIndex = groupIndex;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.representativeIndex = representativeIndex;
    }

    public int getGroupIndex() {
        return groupIndex;
    }

    public int getStartIndex() {
        return startIndex;
    }

    /**
     * Exclusive upper bound.
     */
    public int getEndIndex() {
        return endIndex;
    }

    public int getRepresentativeIndex() {
        return representativeIndex;
    }

    public int getFrameCount() {
        return endIndex - startIndex;
    }

    public boolean contains(int frameIndex) {
        return frameIndex >= startIndex && frameIndex < endIndex;
    }

    @Override
    public String toString() {
        return String.format("FrameGroup{group=%d, [%d, %d) (%d frames), representative=%d}",
                           groupIndex, startIndex, endIndex, getFrameCount(), representativeIndex);
    }
}
