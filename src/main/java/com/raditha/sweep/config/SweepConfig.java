package com.raditha.sweep.config;

import com.raditha.sweep.variant.MissingVariablePolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings of a sweep run, passed explicitly to the scheduler.
 *
 * @param engineBinary          verification engine executable
 * @param seed                  engine seed; 0 leaves seeding to the engine
 * @param threads               worker pool size, raised to 1 when lower
 * @param timeout               per-task timeout, null for none
 * @param workDirectory         directory for per-task transient files
 * @param missingVariablePolicy what to do when a swept variable has no assignment statement
 */
public record SweepConfig(
        String engineBinary,
        long seed,
        int threads,
        Duration timeout,
        Path workDirectory,
        MissingVariablePolicy missingVariablePolicy) {

    public static final String DEFAULT_ENGINE = "verifyta";

    /**
     * Validate configuration.
     */
    public SweepConfig {
        if (engineBinary == null || engineBinary.isBlank()) {
            throw new IllegalArgumentException("engineBinary cannot be blank");
        }
        threads = Math.max(1, threads);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        Objects.requireNonNull(workDirectory, "workDirectory cannot be null");
        if (missingVariablePolicy == null) {
            missingVariablePolicy = MissingVariablePolicy.IGNORE;
        }
    }

    /**
     * Engine {@value #DEFAULT_ENGINE}, engine-chosen seed, one worker, no timeout,
     * transient files under the system temp directory.
     */
    public static SweepConfig defaults() {
        return new SweepConfig(
                DEFAULT_ENGINE,
                0,
                1,
                null,
                Path.of(System.getProperty("java.io.tmpdir"), "sweep-runner"),
                MissingVariablePolicy.IGNORE);
    }

    public SweepConfig withSeed(long newSeed) {
        return new SweepConfig(engineBinary, newSeed, threads, timeout, workDirectory, missingVariablePolicy);
    }

    public SweepConfig withThreads(int newThreads) {
        return new SweepConfig(engineBinary, seed, newThreads, timeout, workDirectory, missingVariablePolicy);
    }

    public SweepConfig withTimeout(Duration newTimeout) {
        return new SweepConfig(engineBinary, seed, threads, newTimeout, workDirectory, missingVariablePolicy);
    }

    public SweepConfig withEngineBinary(String newEngineBinary) {
        return new SweepConfig(newEngineBinary, seed, threads, timeout, workDirectory, missingVariablePolicy);
    }

    public SweepConfig withWorkDirectory(Path newWorkDirectory) {
        return new SweepConfig(engineBinary, seed, threads, timeout, newWorkDirectory, missingVariablePolicy);
    }

    public SweepConfig withMissingVariablePolicy(MissingVariablePolicy policy) {
        return new SweepConfig(engineBinary, seed, threads, timeout, workDirectory, policy);
    }
}
