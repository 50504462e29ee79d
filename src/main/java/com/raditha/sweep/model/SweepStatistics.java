package com.raditha.sweep.model;

import java.util.Collection;

/**
 * Summary counters of a sweep.
 *
 * @param totalVariations number of assignments the spec expanded to
 * @param successfulRuns  results with {@code success == true}
 * @param failedRuns      collected results with {@code success == false}
 * @param timedOutRuns    failed results caused by the per-task timeout
 * @param seedUsed        engine seed, 0 for the engine default
 * @param threadsUsed     worker pool size
 */
public record SweepStatistics(
        int totalVariations,
        int successfulRuns,
        int failedRuns,
        int timedOutRuns,
        long seedUsed,
        int threadsUsed) {

    /**
     * Count the collected results of a run.
     */
    public static SweepStatistics of(int totalVariations, Collection<EngineResult> results,
            long seed, int threads) {
        int ok = 0;
        int failed = 0;
        int timedOut = 0;
        for (EngineResult result : results) {
            if (result.success()) {
                ok++;
            } else {
                failed++;
                if (result.timedOut()) {
                    timedOut++;
                }
            }
        }
        return new SweepStatistics(totalVariations, ok, failed, timedOut, seed, threads);
    }
}
