package com.raditha.sweep.engine;

import java.time.Duration;

/**
 * The engine ran past the per-task timeout and was killed.
 */
public class EngineTimeoutException extends EngineInvocationException {

    private final Duration timeout;

    public EngineTimeoutException(Duration timeout) {
        super("Engine did not finish within " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
