package com.example.videoenhance.model;

/**
 * States of the per-group improve-and-critique loop.
 */
public enum EnhancementState {
    ENHANCING,
    ANALYZING,
    SURGICAL_EDIT,
    GLOBAL_RETRY,
    SATISFIED,
    TERMINAL;

    public boolean isTerminal() {
        return this == SATISFIED || this == TERMINAL;
    }
}
