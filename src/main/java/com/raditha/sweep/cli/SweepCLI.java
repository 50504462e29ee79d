package com.raditha.sweep.cli;

import com.raditha.sweep.analysis.GroupStatistics;
import com.raditha.sweep.analysis.ResultAggregator;
import com.raditha.sweep.config.SweepConfig;
import com.raditha.sweep.config.SweepSettings;
import com.raditha.sweep.expansion.AssignmentExpander;
import com.raditha.sweep.expansion.ValueDescriptorParser;
import com.raditha.sweep.metrics.SweepMetricsExporter;
import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.FormulaResult;
import com.raditha.sweep.model.ModelDocument;
import com.raditha.sweep.model.Sample;
import com.raditha.sweep.model.SweepResult;
import com.raditha.sweep.model.SweepState;
import com.raditha.sweep.model.SweepStatistics;
import com.raditha.sweep.model.ValueDescriptor;
import com.raditha.sweep.model.VariableSpec;
import com.raditha.sweep.scheduler.SweepCancellation;
import com.raditha.sweep.scheduler.SweepRequest;
import com.raditha.sweep.scheduler.SweepScheduler;
import com.raditha.sweep.store.ResultStore;
import com.raditha.sweep.variant.MissingVariablePolicy;
import com.raditha.sweep.variant.ParameterScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line interface for the parameter sweep runner.
 * <p>
 * Usage:
 * java -jar sweep-runner.jar --model model.xml --queries model.q --var project.T1=range(10,30,10)
 * <p>
 * Configuration priority: CLI arguments > experiment YAML > defaults
 */
@Command(name = "sweep", mixinStandardHelpOptions = true, version = "Sweep Runner v1.0.0",
        description = "Runs a verification engine over every combination of model parameters")
@SuppressWarnings("java:S106")
public class SweepCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(SweepCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERRUPTED = 4;

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    /**
     * Cancelled by the shutdown hook.
     */
    final SweepCancellation cancellation = new SweepCancellation();

    @Option(names = "--config", description = "Experiment YAML file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--model", description = "Model XML file", paramLabel = "<path>")
    private Path modelPath;

    @Option(names = "--queries", description = "Query file passed to the engine", paramLabel = "<path>")
    private Path queriesPath;

    @Option(names = "--engine", description = "Engine executable (default: verifyta)", paramLabel = "<binary>")
    private String engine;

    @Option(names = "--threads", description = "Parallel engine runs (default: 1)", paramLabel = "<n>")
    private Integer threads;

    @Option(names = "--seed", description = "Engine seed, 0 for the engine default", paramLabel = "<n>")
    private Long seed;

    @Option(names = "--timeout", description = "Per-variation timeout in seconds", paramLabel = "<seconds>")
    private Long timeoutSeconds;

    @Option(names = "--work-dir", description = "Directory for transient engine files", paramLabel = "<path>")
    private Path workDir;

    @Option(names = "--output", description = "Directory for results.json and exported metrics", paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--var", description = "Swept variable as section.name=descriptor, e.g. project.T1=range(10,30,10)",
            paramLabel = "<binding>")
    private List<String> vars = new ArrayList<>();

    @Option(names = "--strict-variables", description = "Fail a variation when a swept variable is not assigned in its section")
    private boolean strictVariables = false;

    @Option(names = "--list-params", description = "List the @param defaults of the model and exit")
    private boolean listParams = false;

    @Option(names = "--with-defaults", description = "Sweep the model's @param defaults overridden by the given variables")
    private boolean withDefaults = false;

    @Option(names = "--dry-run", description = "Print the expanded assignments without running the engine")
    private boolean dryRun = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--group-by", description = "Group final trace values by a variable, as section.name",
            paramLabel = "<variable>")
    private String groupBy;

    @Option(names = "--formula", description = "Zero-based formula index used by --group-by (default: 0)",
            paramLabel = "<n>")
    private int formulaIndex = 0;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        SweepSettings settings = configFile != null ? SweepSettings.load(configFile) : SweepSettings.defaults();
        Path model = modelPath != null ? modelPath : settings.model();
        Path queries = queriesPath != null ? queriesPath : settings.queries();
        Path output = outputPath != null ? outputPath : settings.output();
        SweepConfig config = applyOverrides(settings.config());
        VariableSpec declared = settings.variables().overlay(parseVarOptions(vars));

        if (model == null) {
            throw new IllegalArgumentException("No model given: use --model or 'model' in the experiment file");
        }
        ModelDocument document = ModelDocument.load(model);

        if (listParams) {
            printParameters(new ParameterScanner().scan(document));
            return EXIT_OK;
        }

        VariableSpec variables = withDefaults
                ? new ParameterScanner().scan(document).overlay(declared)
                : declared;

        if (dryRun) {
            printAssignments(new AssignmentExpander().expand(variables));
            return EXIT_OK;
        }

        if (queries == null) {
            throw new IllegalArgumentException("No query file given: use --queries or 'queries' in the experiment file");
        }
        if (!Files.isRegularFile(queries)) {
            throw new IllegalArgumentException("Query file not found: " + queries);
        }

        // Ctrl-C cancels the sweep; the hook holds the JVM until the results are written.
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = installShutdownHook(finished);
        try {
            SweepResult result = new SweepScheduler(config).run(new SweepRequest(variables, document, queries),
                    (completed, total) -> System.err.printf("Progress: %d/%d%n", completed, total),
                    cancellation);
            writeOutputs(result, output);
            return result.state() == SweepState.CANCELLED ? EXIT_INTERRUPTED : EXIT_OK;
        } finally {
            finished.countDown();
            removeShutdownHook(hook);
        }
    }

    private void writeOutputs(SweepResult result, Path output) throws IOException {
        if (jsonOutput) {
            System.out.println(ResultStore.toJson(result));
        } else {
            printTextReport(result);
        }

        if (output != null) {
            Path saved = ResultStore.save(result, output);
            System.err.println("Results saved to: " + saved.toAbsolutePath());
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(result, output != null ? output : Path.of("."));
        }

        if (groupBy != null) {
            printGroups(result);
        }
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping of this tool.
     */
    static CommandLine createCommandLine() {
        return createCommandLine(new SweepCLI());
    }

    static CommandLine createCommandLine(SweepCLI command) {
        CommandLine cmd = new CommandLine(command);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return EXIT_INTERRUPTED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threads != null && threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }
        if (timeoutSeconds != null && timeoutSeconds < 1) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutSeconds);
        }
        if (formulaIndex < 0) {
            throw new IllegalArgumentException("Formula index must not be negative, got: " + formulaIndex);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            exportFormat = format;
        }

        if (groupBy != null) {
            splitQualifiedName(groupBy);
        }

        if (listParams && dryRun) {
            throw new IllegalArgumentException("Cannot use both --list-params and --dry-run");
        }

        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (modelPath != null && !Files.isRegularFile(modelPath)) {
            throw new IllegalArgumentException("Model file not found: " + modelPath);
        }
        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private SweepConfig applyOverrides(SweepConfig config) {
        SweepConfig result = config;
        if (engine != null) {
            result = result.withEngineBinary(engine);
        }
        if (threads != null) {
            result = result.withThreads(threads);
        }
        if (seed != null) {
            result = result.withSeed(seed);
        }
        if (timeoutSeconds != null) {
            result = result.withTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (workDir != null) {
            result = result.withWorkDirectory(workDir);
        }
        if (strictVariables) {
            result = result.withMissingVariablePolicy(MissingVariablePolicy.FAIL);
        }
        return result;
    }

    /**
     * Parse repeated {@code section.name=descriptor} options. Descriptors use the
     * textual forms, so {@code 1,2,3} sweeps three values.
     */
    static VariableSpec parseVarOptions(List<String> options) {
        VariableSpec.Builder builder = VariableSpec.builder();
        for (String option : options) {
            int eq = option.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Expected section.name=descriptor, got: " + option);
            }
            String[] name = splitQualifiedName(option.substring(0, eq));
            ValueDescriptor descriptor = ValueDescriptorParser.parse(option.substring(eq + 1));
            builder.put(name[0], name[1], descriptor);
        }
        return builder.build();
    }

    private static String[] splitQualifiedName(String qualified) {
        int dot = qualified.indexOf('.');
        if (dot <= 0 || dot == qualified.length() - 1) {
            throw new IllegalArgumentException("Expected section.name, got: " + qualified);
        }
        return new String[] { qualified.substring(0, dot).trim(), qualified.substring(dot + 1).trim() };
    }

    private Thread installShutdownHook(CountDownLatch finished) {
        Thread hook = new Thread(() -> {
            cancellation.cancel();
            try {
                finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sweep-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM shutting down; shutdown hook left in place");
        }
    }

    private static void printParameters(VariableSpec parameters) {
        if (parameters.isEmpty()) {
            System.out.println("No @param declarations found");
            return;
        }
        parameters.sections().forEach((section, variables) -> {
            System.out.println("[" + section + "]");
            variables.forEach((name, value) -> System.out.printf("  %s = %s%n", name, value));
        });
    }

    private static void printAssignments(List<Assignment> assignments) {
        System.out.printf("%d variation(s)%n", assignments.size());
        for (int i = 0; i < assignments.size(); i++) {
            System.out.printf("  %s: %s%n", SweepResult.keyOf(i), assignments.get(i).label());
        }
    }

    static void printTextReport(SweepResult result) {
        SweepStatistics stats = result.statistics();

        System.out.println("=".repeat(80));
        System.out.println("PARAMETER SWEEP REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("State: %s%n", result.state());
        System.out.printf("Total variations: %d%n", stats.totalVariations());
        System.out.printf("Successful runs: %d%n", stats.successfulRuns());
        System.out.printf("Failed runs: %d%n", stats.failedRuns());
        System.out.printf("Timed out: %d%n", stats.timedOutRuns());
        System.out.printf("Seed: %s%n", stats.seedUsed() == 0 ? "engine default" : Long.toString(stats.seedUsed()));
        System.out.printf("Threads: %d%n", stats.threadsUsed());
        System.out.println();

        for (Map.Entry<String, EngineResult> entry : result.results().entrySet()) {
            EngineResult r = entry.getValue();
            System.out.println("-".repeat(80));
            System.out.printf("%s: %s%n", entry.getKey(), r.assignment().label());

            if (!r.success()) {
                System.out.printf("  ✗ %s: %s%n", r.failureKind(), r.error());
                if (!r.stderr().isBlank()) {
                    System.out.println("  stderr: " + r.stderr().strip());
                }
                continue;
            }

            System.out.printf("  ✓ %d of %d formula(s) satisfied%n", r.satisfiedCount(), r.formulas().size());
            for (int i = 0; i < r.formulas().size(); i++) {
                FormulaResult formula = r.formulas().get(i);
                System.out.printf("  Formula %s: %s%n", formula.number(), formula.satisfaction());
                if (i < r.dataPoints().size()) {
                    for (Map.Entry<String, List<Sample>> trace : r.dataPoints().get(i).entrySet()) {
                        List<Sample> samples = trace.getValue();
                        System.out.printf("    %s: %d sample(s), last %s%n", trace.getKey(), samples.size(),
                                samples.isEmpty() ? "-" : samples.get(samples.size() - 1));
                    }
                }
            }
        }
        System.out.println();
    }

    private void printGroups(SweepResult result) {
        String[] name = splitQualifiedName(groupBy);
        Map<String, GroupStatistics> groups = new ResultAggregator()
                .statisticsBy(result, name[0], name[1], formulaIndex);

        System.out.println();
        System.out.printf("Final values of formula #%d grouped by %s%n", formulaIndex, groupBy);
        if (groups.isEmpty()) {
            System.out.println("  (no successful variation binds this variable)");
            return;
        }
        System.out.printf("  %-20s %6s %12s %12s %12s%n", name[1], "count", "min", "max", "mean");
        groups.forEach((value, stats) -> System.out.printf("  %-20s %6d %12.4f %12.4f %12.4f%n",
                value, stats.count(), stats.min(), stats.max(), stats.mean()));
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(SweepResult result, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        SweepMetricsExporter exporter = new SweepMetricsExporter();
        SweepMetricsExporter.SweepMetrics metrics = exporter.buildMetrics(result);

        if ("csv".equals(exportFormat) || "both".equals(exportFormat)) {
            Path csvPath = outputDir.resolve("sweep-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.err.println("✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(exportFormat) || "both".equals(exportFormat)) {
            Path jsonPath = outputDir.resolve("sweep-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.err.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
