package com.raditha.sweep.engine;

import com.raditha.sweep.model.FormulaResult;
import com.raditha.sweep.model.Sample;

import java.util.List;
import java.util.Map;

/**
 * Structured view of engine stdout.
 *
 * @param formulas   verdicts in report order
 * @param dataPoints one trace map per formula, aligned with {@code formulas}
 */
public record ParsedOutput(List<FormulaResult> formulas, List<Map<String, List<Sample>>> dataPoints) {
}
