package com.raditha.sweep.expansion;

import com.raditha.sweep.model.ValueDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns textual value descriptors into {@link ValueDescriptor}s.
 * <p>
 * Recognised forms: {@code range(a, b)}, {@code range(a, b, step)} and
 * {@code list(x, y, z)}. Anything else is a literal or free text, depending on
 * which entry point is used.
 */
public final class ValueDescriptorParser {

    private static final Pattern RANGE = Pattern.compile("^range\\s*\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern LIST = Pattern.compile("^list\\s*\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private ValueDescriptorParser() {
    }

    /**
     * Parse free text; plain text becomes {@link ValueDescriptor.FreeText}, split on commas later.
     *
     * @throws InvalidRangeException when the text looks like a range but is malformed
     */
    public static ValueDescriptor parse(String text) {
        ValueDescriptor structured = parseStructured(text.trim());
        return structured != null ? structured : new ValueDescriptor.FreeText(text);
    }

    /**
     * Parse a scalar coming from a typed source such as a YAML value; plain text
     * becomes a single {@link ValueDescriptor.Literal}, commas included.
     *
     * @throws InvalidRangeException when the text looks like a range but is malformed
     */
    public static ValueDescriptor parseLiteral(String text) {
        ValueDescriptor structured = parseStructured(text.trim());
        return structured != null ? structured : new ValueDescriptor.Literal(text.trim());
    }

    private static ValueDescriptor parseStructured(String text) {
        Matcher range = RANGE.matcher(text);
        if (range.matches()) {
            return parseRange(text, range.group(1));
        }
        Matcher list = LIST.matcher(text);
        if (list.matches()) {
            List<String> values = new ArrayList<>();
            for (String token : list.group(1).split(",")) {
                String value = token.trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            return new ValueDescriptor.ValueList(values);
        }
        return null;
    }

    private static ValueDescriptor.IntRange parseRange(String text, String arguments) {
        List<String> args = Arrays.stream(arguments.split(",")).map(String::trim).toList();
        if (args.size() < 2 || args.size() > 3 || !args.stream().allMatch(a -> INTEGER.matcher(a).matches())) {
            throw new InvalidRangeException("Malformed range descriptor: " + text
                    + ". Expected range(start, end) or range(start, end, step) with integers");
        }
        try {
            long start = Long.parseLong(args.get(0));
            long end = Long.parseLong(args.get(1));
            long step = args.size() == 3 ? Long.parseLong(args.get(2)) : 1;
            return new ValueDescriptor.IntRange(start, end, step);
        } catch (NumberFormatException e) {
            throw new InvalidRangeException("Range bound out of bounds: " + text);
        }
    }
}
