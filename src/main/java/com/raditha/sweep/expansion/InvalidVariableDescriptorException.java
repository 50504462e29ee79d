package com.raditha.sweep.expansion;

/**
 * A value descriptor that cannot be resolved to values.
 * Raised before any engine runs and fatal to the sweep.
 */
public class InvalidVariableDescriptorException extends IllegalArgumentException {

    private final String section;
    private final String variable;

    public InvalidVariableDescriptorException(String message) {
        this(null, null, message);
    }

    public InvalidVariableDescriptorException(String section, String variable, String message) {
        super(section == null ? message : section + "." + variable + ": " + message);
        this.section = section;
        this.variable = variable;
    }

    /**
     * Section of the offending variable, null when not known at the point of failure.
     */
    public String getSection() {
        return section;
    }

    public String getVariable() {
        return variable;
    }
}
