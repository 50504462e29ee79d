package com.raditha.sweep.variant;

/**
 * What to do when a swept variable has no assignment statement in its section.
 */
public enum MissingVariablePolicy {
    /**
     * Leave the declaration text unchanged and carry on.
     */
    IGNORE,

    /**
     * Fail the variation with {@link UnknownVariableException}.
     */
    FAIL;

    /**
     * Convert a string value to a policy.
     *
     * @param value case-insensitive name
     * @throws IllegalArgumentException if the value is not a valid policy
     */
    public static MissingVariablePolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("MissingVariablePolicy value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "ignore" -> IGNORE;
            case "fail" -> FAIL;
            default -> throw new IllegalArgumentException(
                    "Invalid missing variable policy: " + value + ". Must be: ignore or fail");
        };
    }
}
