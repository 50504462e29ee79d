package com.raditha.sweep.engine;

import com.raditha.sweep.model.VariantTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the engine as a child process: {@code <engine> [--seed N] <model> <queries>}.
 * <p>
 * The variant is written to a file private to the task, named after its
 * variation id, and stdout/stderr are redirected to private files as well so
 * that no reader threads are needed. All three files are deleted once the
 * process has terminated, whatever the outcome.
 */
public class ProcessEngineInvoker implements EngineInvoker {

    private static final Logger logger = LoggerFactory.getLogger(ProcessEngineInvoker.class);

    private static final long KILL_GRACE_SECONDS = 5;

    private final String engineBinary;
    private final Path workDirectory;

    /**
     * @param engineBinary  engine executable, resolved through PATH when not absolute
     * @param workDirectory directory for the per-task files; created when missing
     */
    public ProcessEngineInvoker(String engineBinary, Path workDirectory) {
        if (engineBinary == null || engineBinary.isBlank()) {
            throw new IllegalArgumentException("engineBinary cannot be blank");
        }
        this.engineBinary = engineBinary;
        this.workDirectory = workDirectory;
    }

    @Override
    public RawEngineOutput invoke(VariantTask task, Path queryFile, long seed, Duration timeout)
            throws EngineInvocationException, InterruptedException {
        List<Path> transientFiles = new ArrayList<>(3);
        try {
            String prefix = "variant_" + task.variationId() + "_";
            Path model;
            Path stdout;
            Path stderr;
            try {
                Files.createDirectories(workDirectory);
                model = track(transientFiles, Files.createTempFile(workDirectory, prefix, ".xml"));
                stdout = track(transientFiles, Files.createTempFile(workDirectory, prefix, ".out"));
                stderr = track(transientFiles, Files.createTempFile(workDirectory, prefix, ".err"));
                Files.writeString(model, task.modelText(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new EngineLaunchException("Cannot prepare files for variation "
                        + task.variationId() + ": " + e.getMessage(), e);
            }

            List<String> command = buildCommand(model, queryFile, seed);
            logger.debug("Variation {}: {}", task.variationId(), command);

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());

            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new EngineLaunchException("Cannot start engine '" + engineBinary + "': " + e.getMessage(), e);
            }

            try {
                if (timeout == null) {
                    process.waitFor();
                } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    kill(process);
                    throw new EngineTimeoutException(timeout);
                }
            } catch (InterruptedException e) {
                kill(process);
                throw e;
            }

            try {
                return new RawEngineOutput(
                        Files.readString(stdout, StandardCharsets.UTF_8),
                        Files.readString(stderr, StandardCharsets.UTF_8),
                        process.exitValue());
            } catch (IOException e) {
                throw new EngineInvocationException("Cannot read engine output of variation "
                        + task.variationId() + ": " + e.getMessage(), e);
            }
        } finally {
            transientFiles.forEach(ProcessEngineInvoker::delete);
        }
    }

    /**
     * Command line for one run; {@code --seed} is only passed for a non-zero seed.
     */
    public List<String> buildCommand(Path model, Path queryFile, long seed) {
        List<String> command = new ArrayList<>();
        command.add(engineBinary);
        if (seed != 0) {
            command.add("--seed");
            command.add(Long.toString(seed));
        }
        command.add(model.toString());
        command.add(queryFile.toString());
        return command;
    }

    public String getEngineBinary() {
        return engineBinary;
    }

    public Path getWorkDirectory() {
        return workDirectory;
    }

    private static Path track(List<Path> files, Path file) {
        files.add(file);
        return file;
    }

    /**
     * Kill the process and its descendants, then give it a moment to exit.
     * Must be called with the interrupt flag clear.
     */
    private static void kill(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        if (!process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS)) {
            logger.warn("Engine process {} did not exit after being killed", process.pid());
        }
    }

    private static void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete transient file {}: {}", file, e.getMessage());
        }
    }
}
