package com.raditha.sweep.analysis;

import java.util.List;

/**
 * Descriptive statistics of the final trace values collected for one group.
 *
 * @param count number of values
 * @param min   smallest value, NaN when empty
 * @param max   largest value, NaN when empty
 * @param mean  arithmetic mean, NaN when empty
 */
public record GroupStatistics(int count, double min, double max, double mean) {

    public static GroupStatistics of(List<Double> values) {
        if (values.isEmpty()) {
            return new GroupStatistics(0, Double.NaN, Double.NaN, Double.NaN);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        return new GroupStatistics(values.size(), min, max, sum / values.size());
    }
}
