package com.raditha.sweep.model;

import java.util.Objects;

/**
 * One (time, value) point of a trace.
 * <p>
 * Components are {@link Long} for integral text, {@link Double} for text with a
 * decimal point, or the raw {@link String}s when the pair could not be coerced.
 *
 * @param time  sample time
 * @param value sample value
 */
public record Sample(Object time, Object value) {

    public Sample {
        Objects.requireNonNull(time, "time cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    /**
     * Coerce a textual pair. Both components must be numeric for coercion to
     * apply; otherwise the strings are kept verbatim, surrounding spaces included.
     */
    public static Sample parse(String time, String value) {
        try {
            return new Sample(toNumber(time.trim()), toNumber(value.trim()));
        } catch (NumberFormatException e) {
            return new Sample(time, value);
        }
    }

    private static Number toNumber(String text) {
        if (text.contains(".")) {
            return Double.parseDouble(text);
        }
        return Long.parseLong(text);
    }

    /**
     * The value as a double, or null when it is not numeric.
     */
    public Double numericValue() {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    @Override
    public String toString() {
        return "(" + time + ", " + value + ")";
    }
}
