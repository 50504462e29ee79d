package com.raditha.sweep.variant;

import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.ModelDocument;
import com.raditha.sweep.model.VariableBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies assignments by rewriting {@code name = value;} statements in the raw
 * declaration text of the matching section.
 * <p>
 * The identifier is matched as a whole token and the old value runs up to the
 * first {@code ;}. Every statement assigning the identifier in that section is
 * rewritten. Comparisons ({@code ==}) are left alone.
 */
public class DeclarationTextMaterializer implements VariantMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationTextMaterializer.class);

    private final MissingVariablePolicy missingVariablePolicy;

    public DeclarationTextMaterializer() {
        this(MissingVariablePolicy.IGNORE);
    }

    public DeclarationTextMaterializer(MissingVariablePolicy missingVariablePolicy) {
        this.missingVariablePolicy = missingVariablePolicy;
    }

    @Override
    public ModelDocument materialize(ModelDocument base, Assignment assignment) throws MaterializationException {
        Document dom = base.dom();

        for (Map.Entry<String, List<VariableBinding>> entry : assignment.bySection().entrySet()) {
            String section = entry.getKey();
            Element declaration = ModelDocument.declarationElement(dom, section);
            if (declaration == null) {
                throw new UnknownSectionException(section);
            }

            String text = declaration.getTextContent();
            for (VariableBinding binding : entry.getValue()) {
                Substitution substitution = substitute(text, binding.variable(), binding.value());
                if (substitution.replacements() == 0) {
                    if (missingVariablePolicy == MissingVariablePolicy.FAIL) {
                        throw new UnknownVariableException(section, binding.variable());
                    }
                    logger.debug("No assignment to {} in section {}; left unchanged", binding.variable(), section);
                }
                text = substitution.text();
            }
            declaration.setTextContent(text);
        }
        return ModelDocument.of(dom);
    }

    /**
     * Rewrite every {@code identifier = ...;} statement in {@code text}.
     *
     * @param text       declaration text
     * @param identifier variable to rewrite
     * @param value      new value
     * @return the rewritten text and the number of statements changed
     */
    public static Substitution substitute(String text, String identifier, String value) {
        Matcher matcher = assignmentPattern(identifier).matcher(text);
        String replacement = Matcher.quoteReplacement(identifier + " = " + value + ";");
        StringBuilder out = new StringBuilder(text.length() + 16);
        int count = 0;
        while (matcher.find()) {
            matcher.appendReplacement(out, replacement);
            count++;
        }
        matcher.appendTail(out);
        return new Substitution(out.toString(), count);
    }

    private static Pattern assignmentPattern(String identifier) {
        return Pattern.compile("(?<![A-Za-z0-9_$.])" + Pattern.quote(identifier) + "\\s*=(?!=)[^;]*;");
    }

    /**
     * Outcome of rewriting one identifier.
     *
     * @param text         the rewritten text
     * @param replacements number of statements rewritten, 0 when the identifier was not found
     */
    public record Substitution(String text, int replacements) {
    }
}
