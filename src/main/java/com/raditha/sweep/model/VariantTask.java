package com.raditha.sweep.model;

import java.util.Objects;

/**
 * A unit of dispatchable work.
 *
 * @param variationId index of the assignment in expansion order; the only key
 *                    correlating a submission with its result
 * @param assignment  the assignment this variant realizes
 * @param modelText   serialized model variant handed to the engine
 */
public record VariantTask(int variationId, Assignment assignment, String modelText) {
    public VariantTask {
        if (variationId < 0) {
            throw new IllegalArgumentException("variationId must be >= 0");
        }
        Objects.requireNonNull(assignment, "assignment cannot be null");
        Objects.requireNonNull(modelText, "modelText cannot be null");
    }
}
