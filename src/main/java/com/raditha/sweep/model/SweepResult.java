package com.raditha.sweep.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate outcome of one sweep run. Replaced wholesale by the next run.
 *
 * @param state      terminal state the run ended in
 * @param results    results keyed {@code variation_<id>}, in ascending id order
 * @param statistics summary counters
 */
public record SweepResult(SweepState state, Map<String, EngineResult> results, SweepStatistics statistics) {

    private static final String KEY_PREFIX = "variation_";

    public SweepResult {
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(statistics, "statistics cannot be null");
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Assemble a result from the collected engine results in any order.
     */
    public static SweepResult of(SweepState state, Collection<EngineResult> collected, int totalVariations,
            long seed, int threads) {
        Map<String, EngineResult> ordered = new LinkedHashMap<>();
        collected.stream()
                .sorted(Comparator.comparingInt(EngineResult::variationId))
                .forEach(r -> ordered.put(keyOf(r.variationId()), r));
        return new SweepResult(state, ordered,
                SweepStatistics.of(totalVariations, collected, seed, threads));
    }

    /**
     * A completed run with nothing to do.
     */
    public static SweepResult empty(long seed, int threads) {
        return new SweepResult(SweepState.COMPLETED, Map.of(), new SweepStatistics(0, 0, 0, 0, seed, threads));
    }

    /**
     * Stable, human-diffable key of a variation.
     */
    public static String keyOf(int variationId) {
        return KEY_PREFIX + variationId;
    }

    /**
     * Result of one variation, or null when it was never collected.
     */
    public EngineResult result(int variationId) {
        return results.get(keyOf(variationId));
    }

    public int size() {
        return results.size();
    }
}
