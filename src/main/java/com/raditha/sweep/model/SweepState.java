package com.raditha.sweep.model;

/**
 * Lifecycle of one sweep run.
 */
public enum SweepState {
    IDLE,
    EXPANDING,
    DISPATCHING,
    COLLECTING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
