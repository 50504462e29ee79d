package com.raditha.sweep.engine;

/**
 * The engine did not run to completion for a task.
 */
public class EngineInvocationException extends Exception {

    public EngineInvocationException(String message) {
        super(message);
    }

    public EngineInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
