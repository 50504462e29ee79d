package com.raditha.sweep.model;

import java.util.Objects;

/**
 * Satisfaction verdict for one query formula.
 *
 * @param number       formula number as printed by the engine
 * @param satisfaction the verdict
 */
public record FormulaResult(String number, Satisfaction satisfaction) {
    public FormulaResult {
        Objects.requireNonNull(number, "number cannot be null");
        Objects.requireNonNull(satisfaction, "satisfaction cannot be null");
    }

    /**
     * Same formula with a new verdict.
     */
    public FormulaResult withSatisfaction(Satisfaction verdict) {
        return new FormulaResult(number, verdict);
    }
}
