package com.raditha.sweep.analysis;

import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.Sample;
import com.raditha.sweep.model.SweepResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the outcome of a sweep by the value of one swept variable.
 */
public class ResultAggregator {

    /**
     * Last sample value of every trace of one formula, grouped by the value the
     * successful variations bound to {@code section.variable}.
     * <p>
     * Variations that failed, did not report the formula or do not bind the
     * variable are skipped, as are non-numeric samples. Groups are ordered
     * numerically when every group value is a number, lexically otherwise.
     *
     * @param formulaIndex zero-based position of the formula in the engine output
     */
    public Map<String, List<Double>> finalValuesBy(SweepResult result, String section, String variable,
            int formulaIndex) {
        if (formulaIndex < 0) {
            throw new IllegalArgumentException("Formula index must not be negative: " + formulaIndex);
        }
        Map<String, List<Double>> groups = new LinkedHashMap<>();
        for (EngineResult r : result.results().values()) {
            String key = r.assignment().valueOf(section, variable);
            if (!r.success() || key == null || formulaIndex >= r.dataPoints().size()) {
                continue;
            }
            List<Double> values = groups.computeIfAbsent(key, k -> new ArrayList<>());
            for (List<Sample> trace : r.dataPoints().get(formulaIndex).values()) {
                if (trace.isEmpty()) {
                    continue;
                }
                Double last = trace.get(trace.size() - 1).numericValue();
                if (last != null) {
                    values.add(last);
                }
            }
        }
        return sorted(groups);
    }

    /**
     * Statistics per group, in the order of {@link #finalValuesBy}.
     */
    public Map<String, GroupStatistics> statisticsBy(SweepResult result, String section, String variable,
            int formulaIndex) {
        Map<String, GroupStatistics> stats = new LinkedHashMap<>();
        finalValuesBy(result, section, variable, formulaIndex)
                .forEach((key, values) -> stats.put(key, GroupStatistics.of(values)));
        return stats;
    }

    private static Map<String, List<Double>> sorted(Map<String, List<Double>> groups) {
        boolean numeric = groups.keySet().stream().allMatch(ResultAggregator::isNumber);
        Comparator<String> order = numeric
                ? Comparator.<String>comparingDouble(k -> Double.parseDouble(k.trim())).thenComparing(Comparator.naturalOrder())
                : Comparator.naturalOrder();
        List<String> keys = new ArrayList<>(groups.keySet());
        keys.sort(order);
        Map<String, List<Double>> sorted = new LinkedHashMap<>();
        for (String key : keys) {
            sorted.put(key, groups.get(key));
        }
        return sorted;
    }

    private static boolean isNumber(String text) {
        try {
            Double.parseDouble(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
