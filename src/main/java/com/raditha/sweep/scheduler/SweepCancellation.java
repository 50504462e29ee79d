package com.raditha.sweep.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level cancellation signal. Safe to trigger from any thread, including a
 * progress listener.
 */
public final class SweepCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
