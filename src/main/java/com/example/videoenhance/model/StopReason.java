package com.example.videoenhance.model;

public enum StopReason {
    SCORE_TARGET_REACHED,
    NO_ISSUES,
    ITERATION_CAP,
    DEADLINE,
    SERVICE_FAILURE,
    CRITIQUE_UNPARSEABLE
}
