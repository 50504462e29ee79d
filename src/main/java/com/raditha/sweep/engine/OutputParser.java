package com.raditha.sweep.engine;

import com.raditha.sweep.model.FormulaResult;
import com.raditha.sweep.model.Sample;
import com.raditha.sweep.model.Satisfaction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line scanner for engine stdout.
 * <p>
 * Tracks the formula currently being reported. {@code Verifying formula N}
 * opens a formula; satisfaction markers close its verdict; lines of the form
 * {@code [name]: (t, v) (t, v) ...} attach a trace to the open formula.
 * Anything else, including garbled lines, is skipped. Parsing never fails.
 */
public class OutputParser {

    private static final Pattern VERIFYING = Pattern.compile("Verifying formula (\\d+)");
    private static final Pattern PAIR = Pattern.compile("\\(([^,]+),\\s*([^)]+)\\)");

    private static final String SATISFIED = "-- formula is satisfied";
    private static final String NOT_SATISFIED = "-- formula is not satisfied";

    /**
     * Parse a complete stdout capture.
     */
    public ParsedOutput parse(String stdout) {
        List<FormulaResult> formulas = new ArrayList<>();
        List<Map<String, List<Sample>>> dataPoints = new ArrayList<>();
        int current = -1;

        for (String raw : stdout.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("[")) {
                if (current >= 0) {
                    parseTrace(line, dataPoints.get(current));
                }
                continue;
            }

            Matcher verifying = VERIFYING.matcher(line);
            if (verifying.find()) {
                current++;
                formulas.add(new FormulaResult(verifying.group(1), Satisfaction.UNKNOWN));
                dataPoints.add(new LinkedHashMap<>());
                continue;
            }

            if (current >= 0) {
                String lower = line.toLowerCase(Locale.ROOT);
                if (lower.contains(NOT_SATISFIED)) {
                    formulas.set(current, formulas.get(current).withSatisfaction(Satisfaction.NOT_SATISFIED));
                } else if (lower.contains(SATISFIED)) {
                    formulas.set(current, formulas.get(current).withSatisfaction(Satisfaction.SATISFIED));
                }
            }
        }
        return new ParsedOutput(formulas, dataPoints);
    }

    /**
     * Parse one trace line into {@code traces}; lines without a colon or without
     * any pair add nothing.
     */
    static void parseTrace(String line, Map<String, List<Sample>> traces) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return;
        }
        String name = line.substring(0, colon).strip();
        List<Sample> samples = new ArrayList<>();
        Matcher pair = PAIR.matcher(line.substring(colon + 1));
        while (pair.find()) {
            samples.add(Sample.parse(pair.group(1), pair.group(2)));
        }
        if (!samples.isEmpty()) {
            traces.put(name, samples);
        }
    }
}
