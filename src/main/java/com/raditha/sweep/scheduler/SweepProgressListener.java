package com.raditha.sweep.scheduler;

/**
 * Receives progress after each collected variation.
 */
@FunctionalInterface
public interface SweepProgressListener {

    SweepProgressListener NONE = (completed, total) -> {
    };

    /**
     * @param completed variations collected so far
     * @param total     variations in the sweep
     */
    void onProgress(int completed, int total);
}
