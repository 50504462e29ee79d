package com.raditha.sweep.variant;

import com.raditha.sweep.model.ModelDocument;
import com.raditha.sweep.model.VariableSpec;

import java.util.Map;

/**
 * Discovers the tunable parameters a model advertises.
 * <p>
 * A declaration line carrying the {@code @param} marker, such as
 * {@code const int T1 = 20; // @param}, contributes a default: the text before
 * the first {@code ;} is split at the first {@code =}, the variable name is the
 * last token on the left and the trimmed right-hand side is its value.
 */
public class ParameterScanner {

    public static final String MARKER = "@param";

    /**
     * Scan every declaration section of a model.
     *
     * @return defaults as literals; sections without parameters are left out
     */
    public VariableSpec scan(ModelDocument model) {
        VariableSpec.Builder builder = VariableSpec.builder();
        for (Map.Entry<String, String> section : model.declarations().entrySet()) {
            scanSection(section.getKey(), section.getValue(), builder);
        }
        return builder.build();
    }

    static void scanSection(String section, String text, VariableSpec.Builder builder) {
        if (text == null || text.isEmpty()) {
            return;
        }
        for (String line : text.split("\\R")) {
            if (!line.contains(MARKER)) {
                continue;
            }
            String statement = line.split(";", 2)[0];
            int eq = statement.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String[] tokens = statement.substring(0, eq).trim().split("\\s+");
            String name = tokens[tokens.length - 1];
            if (name.isEmpty()) {
                continue;
            }
            builder.literal(section, name, statement.substring(eq + 1).trim());
        }
    }
}
