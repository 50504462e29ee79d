package com.raditha.sweep.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One point of the sweep: exactly one value per declared variable.
 *
 * @param bindings bindings in expansion order
 */
public record Assignment(List<VariableBinding> bindings) {

    public Assignment {
        bindings = List.copyOf(bindings);
        Set<String> seen = new HashSet<>();
        for (VariableBinding binding : bindings) {
            if (!seen.add(binding.section() + "\u0000" + binding.variable())) {
                throw new IllegalArgumentException(
                        "Duplicate binding for " + binding.section() + "." + binding.variable());
            }
        }
    }

    /**
     * Value bound to a variable, or null when the assignment does not mention it.
     */
    public String valueOf(String section, String variable) {
        for (VariableBinding binding : bindings) {
            if (binding.section().equals(section) && binding.variable().equals(variable)) {
                return binding.value();
            }
        }
        return null;
    }

    /**
     * Bindings grouped by section, keeping first-appearance order.
     */
    public Map<String, List<VariableBinding>> bySection() {
        return bindings.stream().collect(Collectors.groupingBy(
                VariableBinding::section, LinkedHashMap::new, Collectors.toList()));
    }

    public int size() {
        return bindings.size();
    }

    /**
     * Human readable label such as {@code T1=20, Bitstuffing=3}.
     */
    public String label() {
        return bindings.stream()
                .map(b -> b.variable() + "=" + b.value())
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return label();
    }
}
