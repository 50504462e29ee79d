package com.raditha.sweep.variant;

/**
 * A variable has no {@code name = value;} statement in its section.
 * Only raised under {@link MissingVariablePolicy#FAIL}.
 */
public class UnknownVariableException extends MaterializationException {

    private final String section;
    private final String variable;

    public UnknownVariableException(String section, String variable) {
        super("No assignment to '" + variable + "' in section '" + section + "'");
        this.section = section;
        this.variable = variable;
    }

    public String getSection() {
        return section;
    }

    public String getVariable() {
        return variable;
    }
}
