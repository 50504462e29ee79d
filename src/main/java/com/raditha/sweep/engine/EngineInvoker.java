package com.raditha.sweep.engine;

import com.raditha.sweep.model.VariantTask;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs the verification engine once for a model variant.
 */
public interface EngineInvoker {

    /**
     * Run the engine on a variant and wait for it.
     *
     * @param task      the variant to verify
     * @param queryFile query file, forwarded unmodified
     * @param seed      engine seed; 0 leaves seeding to the engine
     * @param timeout   upper bound on the run, or null for none
     * @return the captured output of a process that terminated on its own
     * @throws EngineTimeoutException if the timeout elapsed first
     * @throws EngineLaunchException  if the engine could not be started
     * @throws InterruptedException   if the calling worker was interrupted; the process is killed
     */
    RawEngineOutput invoke(VariantTask task, Path queryFile, long seed, Duration timeout)
            throws EngineInvocationException, InterruptedException;
}
