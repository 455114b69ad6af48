package com.example.videoenhance.model;

public record GroupDegradationNotice(int groupIndex, DegradationReason reason, String detail) {

    @Override
    public String toString() {
        return String.format("Group %d degraded (%s): %s", groupIndex, reason, detail);
    }
}
