package com.raditha.sweep.variant;

/**
 * A model variant could not be produced for an assignment.
 * Recorded as a failed result for that variation only.
 */
public class MaterializationException extends Exception {

    public MaterializationException(String message) {
        super(message);
    }
}
