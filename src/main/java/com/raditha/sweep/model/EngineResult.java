package com.raditha.sweep.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one variation. Every task produces one, whatever happened to it.
 *
 * @param variationId correlation key of the task
 * @param assignment  the assignment the variant realized
 * @param success     true when the engine ran and exited with status 0
 * @param exitCode    engine exit status, null when the engine never finished
 * @param stderr      captured standard error, empty when none
 * @param error       diagnostic for failed runs, null on success
 * @param failureKind why the run failed, {@link FailureKind#NONE} on success
 * @param formulas    verdicts in the order the engine reported them
 * @param dataPoints  one trace map per formula, trace name to samples
 */
public record EngineResult(
        int variationId,
        Assignment assignment,
        boolean success,
        Integer exitCode,
        String stderr,
        String error,
        FailureKind failureKind,
        List<FormulaResult> formulas,
        List<Map<String, List<Sample>>> dataPoints) {

    public EngineResult {
        Objects.requireNonNull(assignment, "assignment cannot be null");
        Objects.requireNonNull(failureKind, "failureKind cannot be null");
        stderr = stderr == null ? "" : stderr;
        formulas = formulas == null ? List.of() : List.copyOf(formulas);
        dataPoints = freeze(dataPoints);
    }

    /**
     * Result of an engine run that terminated on its own.
     */
    public static EngineResult finished(int variationId, Assignment assignment, int exitCode, String stderr,
            List<FormulaResult> formulas, List<Map<String, List<Sample>>> dataPoints) {
        boolean ok = exitCode == 0;
        return new EngineResult(variationId, assignment, ok, exitCode, stderr,
                ok ? null : "Engine exited with status " + exitCode,
                ok ? FailureKind.NONE : FailureKind.NONZERO_EXIT,
                formulas, dataPoints);
    }

    /**
     * Result of a variation that never produced engine output.
     */
    public static EngineResult failed(int variationId, Assignment assignment, FailureKind kind, String error) {
        if (kind == FailureKind.NONE) {
            throw new IllegalArgumentException("A failed result needs a failure kind");
        }
        return new EngineResult(variationId, assignment, false, null, "", error, kind, List.of(), List.of());
    }

    /**
     * Number of formulas reported as satisfied.
     */
    public int satisfiedCount() {
        return (int) formulas.stream()
                .filter(f -> f.satisfaction() == Satisfaction.SATISFIED)
                .count();
    }

    public boolean timedOut() {
        return failureKind == FailureKind.TIMEOUT;
    }

    private static List<Map<String, List<Sample>>> freeze(List<Map<String, List<Sample>>> dataPoints) {
        if (dataPoints == null) {
            return List.of();
        }
        List<Map<String, List<Sample>>> copy = new ArrayList<>(dataPoints.size());
        for (Map<String, List<Sample>> traces : dataPoints) {
            Map<String, List<Sample>> traceCopy = new LinkedHashMap<>();
            traces.forEach((name, samples) -> traceCopy.put(name, List.copyOf(samples)));
            copy.add(Collections.unmodifiableMap(traceCopy));
        }
        return Collections.unmodifiableList(copy);
    }
}
