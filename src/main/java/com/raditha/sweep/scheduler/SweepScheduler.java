package com.raditha.sweep.scheduler;

import com.raditha.sweep.config.SweepConfig;
import com.raditha.sweep.engine.EngineInvocationException;
import com.raditha.sweep.engine.EngineInvoker;
import com.raditha.sweep.engine.EngineLaunchException;
import com.raditha.sweep.engine.EngineTimeoutException;
import com.raditha.sweep.engine.OutputParser;
import com.raditha.sweep.engine.ParsedOutput;
import com.raditha.sweep.engine.ProcessEngineInvoker;
import com.raditha.sweep.engine.RawEngineOutput;
import com.raditha.sweep.expansion.AssignmentExpander;
import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.FailureKind;
import com.raditha.sweep.model.ModelDocument;
import com.raditha.sweep.model.SweepResult;
import com.raditha.sweep.model.SweepState;
import com.raditha.sweep.model.VariantTask;
import com.raditha.sweep.variant.DeclarationTextMaterializer;
import com.raditha.sweep.variant.MaterializationException;
import com.raditha.sweep.variant.VariantMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a sweep: expands the variables, fans one task per assignment out to a
 * fixed worker pool and collects the results in completion order.
 * <p>
 * A task never fails the run. Whatever happens to a variation (bad section,
 * launch failure, timeout, non-zero exit) ends up as an {@link EngineResult}
 * with {@code success == false}. Only an invalid variable specification or a
 * pool that cannot be created aborts the run.
 * <p>
 * On cancellation no further task starts, running engine processes are killed,
 * the scheduler waits for every worker to release its transient files, and the
 * results collected up to that point are returned.
 */
public class SweepScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SweepScheduler.class);

    private static final long POLL_MILLIS = 100;
    private static final long TERMINATION_WAIT_SECONDS = 10;

    private final SweepConfig config;
    private final AssignmentExpander expander;
    private final VariantMaterializer materializer;
    private final EngineInvoker invoker;
    private final OutputParser parser;

    private volatile SweepState state = SweepState.IDLE;

    /**
     * Scheduler running the configured engine binary as a subprocess.
     */
    public SweepScheduler(SweepConfig config) {
        this(config,
                new AssignmentExpander(),
                new DeclarationTextMaterializer(config.missingVariablePolicy()),
                new ProcessEngineInvoker(config.engineBinary(), config.workDirectory()),
                new OutputParser());
    }

    public SweepScheduler(SweepConfig config, AssignmentExpander expander, VariantMaterializer materializer,
            EngineInvoker invoker, OutputParser parser) {
        this.config = config;
        this.expander = expander;
        this.materializer = materializer;
        this.invoker = invoker;
        this.parser = parser;
    }

    public SweepResult run(SweepRequest request) {
        return run(request, SweepProgressListener.NONE, new SweepCancellation());
    }

    /**
     * Run a complete sweep.
     *
     * @param request      what to sweep
     * @param listener     called from the collecting thread after each collected variation
     * @param cancellation stops the run when triggered
     * @return results of every collected variation
     * @throws com.raditha.sweep.expansion.InvalidVariableDescriptorException if the variables are invalid
     * @throws IllegalStateException if the worker pool cannot be started
     */
    public SweepResult run(SweepRequest request, SweepProgressListener listener, SweepCancellation cancellation) {
        int threads = config.threads();
        long seed = config.seed();

        state = SweepState.EXPANDING;
        List<Assignment> assignments;
        try {
            assignments = expander.expand(request.variables());
        } catch (RuntimeException e) {
            state = SweepState.FAILED;
            throw e;
        }

        if (assignments.isEmpty()) {
            logger.info("No variables to sweep; nothing to run");
            state = SweepState.COMPLETED;
            return SweepResult.empty(seed, threads);
        }

        int total = assignments.size();
        logger.info("Running {} variations on {} worker(s)", total, threads);

        ExecutorService pool;
        try {
            pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        } catch (RuntimeException e) {
            state = SweepState.FAILED;
            throw new IllegalStateException("Cannot start worker pool of size " + threads, e);
        }

        CompletionService<EngineResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<EngineResult>, Integer> submittedIds = new HashMap<>();
        Map<Integer, EngineResult> collected = new ConcurrentHashMap<>();
        boolean interrupted = false;

        try {
            state = SweepState.DISPATCHING;
            for (int id = 0; id < total && !cancellation.isCancelled(); id++) {
                final int variationId = id;
                final Assignment assignment = assignments.get(id);
                Future<EngineResult> future = completion.submit(
                        () -> runTask(variationId, assignment, request, cancellation));
                submittedIds.put(future, variationId);
            }

            state = SweepState.COLLECTING;
            int completed = 0;
            while (completed < submittedIds.size() && !cancellation.isCancelled()) {
                Future<EngineResult> future = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (future == null) {
                    continue;
                }
                int variationId = submittedIds.get(future);
                EngineResult result = unwrap(future, variationId, assignments.get(variationId));
                collected.put(variationId, result);
                completed++;
                notifyProgress(listener, completed, total);
            }
        } catch (InterruptedException e) {
            logger.warn("Sweep interrupted; cancelling remaining variations");
            cancellation.cancel();
            interrupted = true;
        } finally {
            shutdown(pool, cancellation.isCancelled());
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        SweepState outcome = cancellation.isCancelled() ? SweepState.CANCELLED : SweepState.COMPLETED;
        SweepResult result = SweepResult.of(outcome, collected.values(), total, seed, threads);
        state = outcome;
        logger.info("Sweep {}: {} collected, {} succeeded, {} failed", outcome.name().toLowerCase(),
                result.size(), result.statistics().successfulRuns(), result.statistics().failedRuns());
        return result;
    }

    /**
     * State of the current or last run.
     */
    public SweepState getState() {
        return state;
    }

    public SweepConfig getConfig() {
        return config;
    }

    /**
     * One variation: materialize, invoke, parse. Never throws.
     */
    EngineResult runTask(int variationId, Assignment assignment, SweepRequest request,
            SweepCancellation cancellation) {
        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            return EngineResult.failed(variationId, assignment, FailureKind.INTERRUPTED, "Cancelled before start");
        }

        VariantTask task;
        try {
            ModelDocument variant = materializer.materialize(request.model(), assignment);
            task = new VariantTask(variationId, assignment, variant.toXml());
        } catch (MaterializationException | RuntimeException e) {
            logger.warn("Variation {} [{}]: {}", variationId, assignment.label(), e.getMessage());
            return EngineResult.failed(variationId, assignment, FailureKind.MATERIALIZATION, e.getMessage());
        }

        try {
            RawEngineOutput output = invoker.invoke(task, request.queryFile(), config.seed(), config.timeout());
            ParsedOutput parsed = parser.parse(output.stdout());
            EngineResult result = EngineResult.finished(variationId, assignment, output.exitCode(),
                    output.stderr(), parsed.formulas(), parsed.dataPoints());
            if (!result.success()) {
                logger.warn("Variation {} [{}]: engine exited with status {}", variationId, assignment.label(),
                        output.exitCode());
            }
            return result;
        } catch (EngineTimeoutException e) {
            logger.warn("Variation {} [{}]: {}", variationId, assignment.label(), e.getMessage());
            return EngineResult.failed(variationId, assignment, FailureKind.TIMEOUT, e.getMessage());
        } catch (EngineLaunchException e) {
            logger.error("Variation {} [{}]: {}", variationId, assignment.label(), e.getMessage());
            return EngineResult.failed(variationId, assignment, FailureKind.LAUNCH, e.getMessage());
        } catch (EngineInvocationException | RuntimeException e) {
            logger.error("Variation {} [{}] failed", variationId, assignment.label(), e);
            return EngineResult.failed(variationId, assignment, FailureKind.INTERNAL_ERROR, String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EngineResult.failed(variationId, assignment, FailureKind.INTERRUPTED, "Interrupted while running");
        }
    }

    private static EngineResult unwrap(Future<EngineResult> future, int variationId, Assignment assignment)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Variation {} worker failed", variationId, cause);
            return EngineResult.failed(variationId, assignment, FailureKind.INTERNAL_ERROR, String.valueOf(cause.getMessage()));
        }
    }

    private static void notifyProgress(SweepProgressListener listener, int completed, int total) {
        try {
            listener.onProgress(completed, total);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed at {}/{}", completed, total, e);
        }
    }

    /**
     * Stop the pool. When abandoning, queued tasks are dropped and running ones
     * interrupted; either way this returns only once every worker has finished,
     * so no transient file outlives the run.
     */
    private static void shutdown(ExecutorService pool, boolean abandon) {
        if (abandon) {
            pool.shutdownNow();
        } else {
            pool.shutdown();
        }
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    break;
                }
                logger.warn("Still waiting for workers to release their engine processes");
            } catch (InterruptedException e) {
                pool.shutdownNow();
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "sweep-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
