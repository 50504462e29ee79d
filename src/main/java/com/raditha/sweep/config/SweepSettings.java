package com.raditha.sweep.config;

import com.raditha.sweep.expansion.InvalidVariableDescriptorException;
import com.raditha.sweep.expansion.ValueDescriptorParser;
import com.raditha.sweep.model.ValueDescriptor;
import com.raditha.sweep.model.VariableSpec;
import com.raditha.sweep.variant.MissingVariablePolicy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Experiment definition loaded from a YAML file.
 * <p>
 * Example:
 * <pre>
 * model: superdense.xml
 * queries: slot.q
 * threads: 8
 * seed: 428094
 * timeout_seconds: 600
 * output: results/
 * vars:
 *   project:
 *     TIMESLOT: range(5, 75, 5)
 *     Bitstuffing: [0, 1, 2]
 *     T1: '86'
 *   system:
 *     sender: 'SenderShifting(qbit, X0, Z0)'
 * </pre>
 * Scalars are literals unless written as {@code range(...)} or {@code list(...)};
 * sequences are value lists; a mapping with {@code start}, {@code end} and an
 * optional {@code step} is a range. Relative paths resolve against the YAML
 * file's directory. Configuration priority: CLI arguments &gt; YAML &gt; defaults.
 *
 * @param model     model file, null when not configured
 * @param queries   query file, null when not configured
 * @param output    directory for result files, null when not configured
 * @param config    run configuration
 * @param variables swept variables
 */
public record SweepSettings(Path model, Path queries, Path output, SweepConfig config, VariableSpec variables) {

    public static SweepSettings defaults() {
        return new SweepSettings(null, null, null, SweepConfig.defaults(), VariableSpec.empty());
    }

    /**
     * Load an experiment file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the YAML is malformed or holds invalid values
     */
    public static SweepSettings load(Path file) throws IOException {
        Object raw;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            raw = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML in " + file + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            return defaults();
        }
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Experiment file must contain a mapping: " + file);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) raw;
        Path baseDir = file.toAbsolutePath().getParent();
        return fromMap(map, baseDir);
    }

    /**
     * Build settings from an already parsed YAML mapping.
     */
    public static SweepSettings fromMap(Map<String, Object> map, Path baseDir) {
        SweepConfig defaults = SweepConfig.defaults();

        String engine = getString(map, "engine", defaults.engineBinary());
        long seed = getLong(map, "seed", defaults.seed());
        int threads = (int) getLong(map, "threads", defaults.threads());
        Duration timeout = getTimeout(map);
        Path workDir = getPath(map, "work_dir", baseDir);
        MissingVariablePolicy policy = getBoolean(map, "strict_variables", false)
                ? MissingVariablePolicy.FAIL
                : MissingVariablePolicy.fromString(getString(map, "missing_variables", "ignore"));

        SweepConfig config = new SweepConfig(
                engine,
                seed,
                threads,
                timeout,
                workDir != null ? workDir : defaults.workDirectory(),
                policy);

        return new SweepSettings(
                getPath(map, "model", baseDir),
                getPath(map, "queries", baseDir),
                getPath(map, "output", baseDir),
                config,
                parseVariables(map.get("vars")));
    }

    /**
     * Convert the {@code vars} mapping into a spec.
     *
     * @throws InvalidVariableDescriptorException for values that are not descriptors
     */
    public static VariableSpec parseVariables(Object raw) {
        if (raw == null) {
            return VariableSpec.empty();
        }
        if (!(raw instanceof Map<?, ?> sections)) {
            throw new InvalidVariableDescriptorException("'vars' must map sections to variables");
        }
        VariableSpec.Builder builder = VariableSpec.builder();
        for (Map.Entry<?, ?> section : sections.entrySet()) {
            String sectionName = String.valueOf(section.getKey());
            if (!(section.getValue() instanceof Map<?, ?> variables)) {
                throw new InvalidVariableDescriptorException(
                        "Section '" + sectionName + "' must map variable names to values");
            }
            for (Map.Entry<?, ?> variable : variables.entrySet()) {
                String name = String.valueOf(variable.getKey());
                builder.put(sectionName, name, toDescriptor(sectionName, name, variable.getValue()));
            }
        }
        return builder.build();
    }

    private static ValueDescriptor toDescriptor(String section, String variable, Object value) {
        if (value == null) {
            throw new InvalidVariableDescriptorException(section, variable, "value is missing");
        }
        if (value instanceof String text) {
            return ValueDescriptorParser.parseLiteral(text);
        }
        if (value instanceof List<?> list) {
            List<String> values = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item == null || item instanceof Map || item instanceof List) {
                    throw new InvalidVariableDescriptorException(section, variable,
                            "list entries must be scalars, got " + item);
                }
                values.add(String.valueOf(item));
            }
            return new ValueDescriptor.ValueList(values);
        }
        if (value instanceof Map<?, ?> range) {
            Object start = range.get("start");
            Object end = range.get("end");
            Object step = range.get("step");
            if (!(start instanceof Number) || !(end instanceof Number) || (step != null && !(step instanceof Number))) {
                throw new InvalidVariableDescriptorException(section, variable,
                        "a range needs integer 'start' and 'end' and an optional integer 'step'");
            }
            return new ValueDescriptor.IntRange(
                    ((Number) start).longValue(),
                    ((Number) end).longValue(),
                    step == null ? 1 : ((Number) step).longValue());
        }
        return new ValueDescriptor.Literal(String.valueOf(value));
    }

    private static Duration getTimeout(Map<String, Object> map) {
        Object value = map.get("timeout_seconds");
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("timeout_seconds must be a number, got: " + value);
        }
        return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
    }

    private static Path getPath(Map<String, Object> map, String key, Path baseDir) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        Path path = Path.of(value.toString());
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException(key + " must be an integer, got: " + value);
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
