package com.raditha.sweep.expansion;

/**
 * A range descriptor with a zero step or a bound lying on the wrong side of its start.
 */
public class InvalidRangeException extends InvalidVariableDescriptorException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String section, String variable, String message) {
        super(section, variable, message);
    }
}
