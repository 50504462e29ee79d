package com.raditha.sweep.model;

import java.util.Objects;

/**
 * One variable set to one concrete value.
 *
 * @param section  declaration section owning the variable ({@code project}, {@code system} or a template name)
 * @param variable variable identifier
 * @param value    value substituted into the model
 */
public record VariableBinding(String section, String variable, String value) {
    public VariableBinding {
        Objects.requireNonNull(section, "section cannot be null");
        Objects.requireNonNull(variable, "variable cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String toString() {
        return section + "." + variable + "=" + value;
    }
}
