package com.raditha.sweep.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative variable specification: section name to variable name to value descriptor.
 * <p>
 * Iteration order is insertion order, which fixes the order of the expanded
 * assignments and therefore the variation ids.
 */
public final class VariableSpec {

    private final Map<String, Map<String, ValueDescriptor>> sections;

    private VariableSpec(Map<String, Map<String, ValueDescriptor>> sections) {
        Map<String, Map<String, ValueDescriptor>> copy = new LinkedHashMap<>();
        sections.forEach((section, vars) -> copy.put(section,
                Collections.unmodifiableMap(new LinkedHashMap<>(vars))));
        this.sections = Collections.unmodifiableMap(copy);
    }

    public static VariableSpec empty() {
        return new VariableSpec(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sections in iteration order, each with its variables in iteration order.
     */
    public Map<String, Map<String, ValueDescriptor>> sections() {
        return sections;
    }

    /**
     * True when no section declares any variable.
     */
    public boolean isEmpty() {
        return sections.values().stream().allMatch(Map::isEmpty);
    }

    public int variableCount() {
        return sections.values().stream().mapToInt(Map::size).sum();
    }

    public ValueDescriptor get(String section, String variable) {
        Map<String, ValueDescriptor> vars = sections.get(section);
        return vars == null ? null : vars.get(variable);
    }

    /**
     * Lay {@code overrides} on top of this spec.
     * Variables present in both keep this spec's position but take the override's
     * descriptor; variables and sections only present in the overrides are appended.
     *
     * @param overrides user supplied values
     * @return the merged spec
     */
    public VariableSpec overlay(VariableSpec overrides) {
        Builder builder = builder();
        sections.forEach((section, vars) -> vars.forEach((name, descriptor) -> {
            ValueDescriptor override = overrides.get(section, name);
            builder.put(section, name, override != null ? override : descriptor);
        }));
        overrides.sections.forEach((section, vars) -> vars.forEach((name, descriptor) -> {
            if (get(section, name) == null) {
                builder.put(section, name, descriptor);
            }
        }));
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableSpec other)) {
            return false;
        }
        return sections.equals(other.sections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sections);
    }

    @Override
    public String toString() {
        return sections.toString();
    }

    /**
     * Builder keeping insertion order. Putting a variable twice replaces its
     * descriptor in place.
     */
    public static final class Builder {
        private final Map<String, Map<String, ValueDescriptor>> sections = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String section, String variable, ValueDescriptor descriptor) {
            Objects.requireNonNull(section, "section cannot be null");
            Objects.requireNonNull(variable, "variable cannot be null");
            Objects.requireNonNull(descriptor, "descriptor cannot be null");
            sections.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(variable, descriptor);
            return this;
        }

        public Builder literal(String section, String variable, String value) {
            return put(section, variable, new ValueDescriptor.Literal(value));
        }

        public VariableSpec build() {
            return new VariableSpec(sections);
        }
    }
}
