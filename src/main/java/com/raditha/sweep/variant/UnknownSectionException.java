package com.raditha.sweep.variant;

/**
 * An assignment names a section with no declaration container in the model.
 */
public class UnknownSectionException extends MaterializationException {

    private final String section;

    public UnknownSectionException(String section) {
        super("Model has no declaration section '" + section + "'");
        this.section = section;
    }

    public String getSection() {
        return section;
    }
}
