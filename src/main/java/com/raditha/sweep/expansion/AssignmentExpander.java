package com.raditha.sweep.expansion;

import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.ValueDescriptor;
import com.raditha.sweep.model.VariableBinding;
import com.raditha.sweep.model.VariableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Expands a {@link VariableSpec} into the cartesian product of its value options.
 * <p>
 * Variables are visited in spec iteration order and the last variable varies
 * fastest, so the same spec always yields the same ordered list and the same
 * variation ids.
 */
public class AssignmentExpander {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentExpander.class);

    /**
     * Expand a spec into assignments.
     *
     * @param spec the variable specification
     * @return all assignments in deterministic order; empty when the spec declares nothing
     * @throws InvalidVariableDescriptorException if a descriptor cannot be resolved
     */
    public List<Assignment> expand(VariableSpec spec) {
        if (spec.isEmpty()) {
            return List.of();
        }

        List<List<VariableBinding>> options = new ArrayList<>();
        for (Map.Entry<String, Map<String, ValueDescriptor>> section : spec.sections().entrySet()) {
            for (Map.Entry<String, ValueDescriptor> variable : section.getValue().entrySet()) {
                List<String> values = resolve(section.getKey(), variable.getKey(), variable.getValue());
                options.add(values.stream()
                        .map(v -> new VariableBinding(section.getKey(), variable.getKey(), v))
                        .toList());
            }
        }

        int total = productSize(options);
        logger.debug("Expanding {} variables into {} assignments", options.size(), total);

        List<Assignment> assignments = new ArrayList<>(total);
        int[] cursor = new int[options.size()];
        for (int n = 0; n < total; n++) {
            List<VariableBinding> bindings = new ArrayList<>(options.size());
            for (int i = 0; i < options.size(); i++) {
                bindings.add(options.get(i).get(cursor[i]));
            }
            assignments.add(new Assignment(bindings));
            advance(cursor, options);
        }
        return assignments;
    }

    /**
     * Resolve one descriptor to its ordered values.
     *
     * @throws InvalidRangeException              for a zero step or a bound on the wrong side
     * @throws InvalidVariableDescriptorException for descriptors that yield no value
     */
    public List<String> resolve(String section, String variable, ValueDescriptor descriptor) {
        if (descriptor instanceof ValueDescriptor.Literal literal) {
            return List.of(literal.value());
        }
        if (descriptor instanceof ValueDescriptor.ValueList list) {
            if (list.values().isEmpty()) {
                throw new InvalidVariableDescriptorException(section, variable, "value list is empty");
            }
            return list.values();
        }
        if (descriptor instanceof ValueDescriptor.IntRange range) {
            return resolveRange(section, variable, range);
        }
        if (descriptor instanceof ValueDescriptor.FreeText text) {
            List<String> values = new ArrayList<>();
            for (String token : text.text().split(",")) {
                String value = token.trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            if (values.isEmpty()) {
                throw new InvalidVariableDescriptorException(section, variable,
                        "no values in '" + text.text() + "'");
            }
            return values;
        }
        throw new InvalidVariableDescriptorException(section, variable,
                "unsupported descriptor " + descriptor);
    }

    private static List<String> resolveRange(String section, String variable, ValueDescriptor.IntRange range) {
        long start = range.start();
        long end = range.end();
        long step = range.step();
        if (step == 0) {
            throw new InvalidRangeException(section, variable, range + " has a zero step");
        }
        if (step > 0 && end <= start) {
            throw new InvalidRangeException(section, variable,
                    range + " is empty: end must be greater than start for a positive step");
        }
        if (step < 0 && end >= start) {
            throw new InvalidRangeException(section, variable,
                    range + " is empty: end must be less than start for a negative step");
        }

        int count = rangeSize(section, variable, range);
        List<String> values = new ArrayList<>(count);
        long v = start;
        for (int i = 0; i < count; i++) {
            values.add(Long.toString(v));
            // wraps only after the last value
            v += step;
        }
        return values;
    }

    /**
     * Number of values in a non-empty range, computed without overflow.
     *
     * @throws InvalidRangeException when the range has more values than a list can hold
     */
    static int rangeSize(String section, String variable, ValueDescriptor.IntRange range) {
        BigInteger span = BigInteger.valueOf(range.end()).subtract(BigInteger.valueOf(range.start())).abs();
        BigInteger step = BigInteger.valueOf(range.step()).abs();
        BigInteger count = span.add(step).subtract(BigInteger.ONE).divide(step);
        if (count.compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) > 0) {
            throw new InvalidRangeException(section, variable,
                    range + " has " + count + " values, more than can be enumerated");
        }
        return count.intValue();
    }

    private static int productSize(List<List<VariableBinding>> options) {
        try {
            int total = 1;
            for (List<VariableBinding> option : options) {
                total = Math.multiplyExact(total, option.size());
            }
            return total;
        } catch (ArithmeticException e) {
            throw new InvalidVariableDescriptorException("Sweep has more assignments than can be enumerated");
        }
    }

    private static void advance(int[] cursor, List<List<VariableBinding>> options) {
        for (int i = cursor.length - 1; i >= 0; i--) {
            cursor[i]++;
            if (cursor[i] < options.get(i).size()) {
                return;
            }
            cursor[i] = 0;
        }
    }
}
