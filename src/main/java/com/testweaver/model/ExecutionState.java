package com.testweaver.model;

/**
 * Lifecycle of one scenario run: {@code IDLE -> NAVIGATING -> RUNNING -> COMPLETED | ABORTED}.
 */
public enum ExecutionState {
    IDLE,
    NAVIGATING,
    RUNNING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
