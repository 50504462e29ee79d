package com.raditha.sweep.model;

import java.util.List;
import java.util.Objects;

/**
 * Describes the values one sweep variable takes.
 * Resolved to a concrete ordered list of values by the assignment expander.
 */
public sealed interface ValueDescriptor
        permits ValueDescriptor.Literal, ValueDescriptor.ValueList, ValueDescriptor.IntRange,
        ValueDescriptor.FreeText {

    /**
     * A single scalar value, used verbatim even when it contains commas.
     *
     * @param value the literal value
     */
    record Literal(String value) implements ValueDescriptor {
        public Literal {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * An explicit ordered list of values.
     *
     * @param values the values, in sweep order
     */
    record ValueList(List<String> values) implements ValueDescriptor {
        public ValueList {
            values = List.copyOf(values);
        }

        @Override
        public String toString() {
            return "list(" + String.join(", ", values) + ")";
        }
    }

    /**
     * Integer arithmetic progression, end exclusive.
     *
     * @param start first value
     * @param end   exclusive bound
     * @param step  increment, never zero for a valid range
     */
    record IntRange(long start, long end, long step) implements ValueDescriptor {

        /**
         * Range with the default step of 1.
         */
        public IntRange(long start, long end) {
            this(start, end, 1);
        }

        @Override
        public String toString() {
            return step == 1
                    ? String.format("range(%d, %d)", start, end)
                    : String.format("range(%d, %d, %d)", start, end, step);
        }
    }

    /**
     * Plain comma separated text, kept for inputs that predate the typed forms.
     *
     * @param text the raw text
     */
    record FreeText(String text) implements ValueDescriptor {
        public FreeText {
            Objects.requireNonNull(text, "text cannot be null");
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
