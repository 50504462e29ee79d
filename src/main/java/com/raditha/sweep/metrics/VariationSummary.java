package com.raditha.sweep.metrics;

import java.util.List;

/**
 * Flat summary of one variation for export.
 *
 * @param variationId    variation id
 * @param label          assignment label such as {@code T1=20, T2=5}
 * @param success        whether the engine exited with status 0
 * @param exitCode       engine exit status, null when it never finished
 * @param failureKind    failure kind name, {@code NONE} on success
 * @param satisfiedCount formulas reported satisfied
 * @param formulaCount   formulas reported
 * @param verdicts       {@code number:VERDICT} per formula
 */
public record VariationSummary(
        int variationId,
        String label,
        boolean success,
        Integer exitCode,
        String failureKind,
        int satisfiedCount,
        int formulaCount,
        List<String> verdicts) {
}
