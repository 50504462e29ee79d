package com.raditha.sweep.store;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.FailureKind;
import com.raditha.sweep.model.FormulaResult;
import com.raditha.sweep.model.Sample;
import com.raditha.sweep.model.SweepResult;
import com.raditha.sweep.model.SweepState;
import com.raditha.sweep.model.SweepStatistics;
import com.raditha.sweep.model.VariableBinding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves and loads sweep results as JSON.
 * <p>
 * Results go through small DTOs so the file layout does not follow every change
 * of the in-memory model. The output carries no timestamps: two runs with equal
 * results produce identical files.
 */
public class ResultStore {

    public static final String FILE_NAME = "results.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_LONG_FOR_INTS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ResultStore() {
    }

    @JsonPropertyOrder({"state", "statistics", "results"})
    public record StoredSweep(
            SweepState state,
            SweepStatistics statistics,
            Map<String, StoredVariation> results) {
    }

    @JsonPropertyOrder({"variationId", "assignment", "success", "exitCode", "failureKind", "error", "stderr",
            "formulas", "dataPoints"})
    public record StoredVariation(
            int variationId,
            List<VariableBinding> assignment,
            boolean success,
            Integer exitCode,
            FailureKind failureKind,
            String error,
            String stderr,
            List<FormulaResult> formulas,
            List<Map<String, List<Sample>>> dataPoints) {
    }

    /**
     * Write {@value #FILE_NAME} into a directory, creating it when needed.
     *
     * @return the written file
     */
    public static Path save(SweepResult result, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(FILE_NAME);
        write(result, file);
        return file;
    }

    public static void write(SweepResult result, Path file) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toDto(result));
    }

    /**
     * Load a file written by {@link #write}.
     *
     * @throws IOException when the file is missing or is not a stored sweep
     */
    public static SweepResult read(Path file) throws IOException {
        return fromDto(mapper.readValue(file.toFile(), StoredSweep.class));
    }

    /**
     * Pretty printed JSON of a result.
     */
    public static String toJson(SweepResult result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDto(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sweep result", e);
        }
    }

    static StoredSweep toDto(SweepResult result) {
        Map<String, StoredVariation> variations = new LinkedHashMap<>();
        result.results().forEach((key, r) -> variations.put(key, new StoredVariation(
                r.variationId(),
                r.assignment().bindings(),
                r.success(),
                r.exitCode(),
                r.failureKind(),
                r.error(),
                r.stderr(),
                r.formulas(),
                r.dataPoints())));
        return new StoredSweep(result.state(), result.statistics(), variations);
    }

    static SweepResult fromDto(StoredSweep dto) throws IOException {
        if (dto.state() == null || dto.statistics() == null) {
            throw new IOException("Not a stored sweep: state and statistics are required");
        }
        Map<String, EngineResult> results = new LinkedHashMap<>();
        if (dto.results() != null) {
            for (Map.Entry<String, StoredVariation> entry : dto.results().entrySet()) {
                StoredVariation v = entry.getValue();
                results.put(entry.getKey(), new EngineResult(
                        v.variationId(),
                        new Assignment(v.assignment() == null ? List.of() : v.assignment()),
                        v.success(),
                        v.exitCode(),
                        v.stderr(),
                        v.error(),
                        v.failureKind() == null ? FailureKind.NONE : v.failureKind(),
                        v.formulas(),
                        v.dataPoints()));
            }
        }
        return new SweepResult(dto.state(), results, dto.statistics());
    }
}
