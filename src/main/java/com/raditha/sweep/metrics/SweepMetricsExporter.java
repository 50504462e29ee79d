package com.raditha.sweep.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.SweepResult;
import com.raditha.sweep.model.SweepStatistics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports per-variation sweep metrics to CSV and JSON for spreadsheets and
 * dashboards.
 */
public class SweepMetricsExporter {

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Sweep-level summary with one entry per collected variation.
     */
    public record SweepMetrics(
            String state,
            SweepStatistics statistics,
            List<VariationSummary> variations) {
    }

    /**
     * Build the metrics of a sweep, variations in id order.
     */
    public SweepMetrics buildMetrics(SweepResult result) {
        List<VariationSummary> variations = result.results().values().stream()
                .map(this::summarize)
                .toList();
        return new SweepMetrics(result.state().name(), result.statistics(), variations);
    }

    private VariationSummary summarize(EngineResult result) {
        List<String> verdicts = result.formulas().stream()
                .map(f -> f.number() + ":" + f.satisfaction().name())
                .toList();
        return new VariationSummary(
                result.variationId(),
                result.assignment().label(),
                result.success(),
                result.exitCode(),
                result.failureKind().name(),
                result.satisfiedCount(),
                result.formulas().size(),
                verdicts);
    }

    /**
     * Export metrics to CSV: a summary block followed by one row per variation.
     */
    public void exportToCsv(SweepMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        SweepStatistics stats = metrics.statistics();

        csv.append("# Sweep Summary\n");
        csv.append("state,total_variations,successful,failed,timed_out,seed,threads\n");
        csv.append(String.format("%s,%d,%d,%d,%d,%d,%d\n",
                metrics.state(),
                stats.totalVariations(),
                stats.successfulRuns(),
                stats.failedRuns(),
                stats.timedOutRuns(),
                stats.seedUsed(),
                stats.threadsUsed()));

        csv.append("\n");

        csv.append("# Per-Variation Metrics\n");
        csv.append("variation,assignment,success,exit_code,failure_kind,satisfied,formulas,verdicts\n");

        for (VariationSummary v : metrics.variations()) {
            String verdicts = v.verdicts().isEmpty() ? "NONE" : String.join(";", v.verdicts());
            csv.append(String.format("%d,%s,%s,%s,%s,%d,%d,%s\n",
                    v.variationId(),
                    quote(v.label()),
                    v.success(),
                    v.exitCode() == null ? "" : v.exitCode().toString(),
                    v.failureKind(),
                    v.satisfiedCount(),
                    v.formulaCount(),
                    verdicts));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON.
     */
    public void exportToJson(SweepMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    private static String quote(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}
