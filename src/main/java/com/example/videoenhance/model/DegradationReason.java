package com.example.videoenhance.model;

/**
 * Why a group's output is lower quality than a fully enhanced result.
 */
public enum DegradationReason {
    ENHANCEMENT_FAILED,
    CRITIQUE_FAILED,
    CRITIQUE_UNPARSEABLE,
    SURGICAL_EDIT_FAILED,
    GLOBAL_RETRY_FAILED,
    GEOMETRY_MISMATCH,
    DEADLINE_EXCEEDED,
    GROUP_FAILED
}
