package com.raditha.sweep.engine;

/**
 * The engine process could not be started, or its working files could not be prepared.
 */
public class EngineLaunchException extends EngineInvocationException {

    public EngineLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
