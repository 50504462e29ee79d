package com.raditha.sweep.model;

/**
 * Why a variation did not succeed.
 */
public enum FailureKind {
    NONE,
    /** The engine ran and exited with a non-zero status. */
    NONZERO_EXIT,
    /** The engine exceeded the per-task timeout and was killed. */
    TIMEOUT,
    /** The engine binary could not be started. */
    LAUNCH,
    /** The model variant could not be produced. */
    MATERIALIZATION,
    /** The worker was interrupted before the engine finished. */
    INTERRUPTED,
    /** Anything else that went wrong inside the worker, such as unreadable engine output. */
    INTERNAL_ERROR
}
