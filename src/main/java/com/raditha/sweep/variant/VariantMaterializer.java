package com.raditha.sweep.variant;

import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.ModelDocument;

/**
 * Produces the model variant for one assignment.
 * <p>
 * Implementations must be pure and safe to call from several workers at once:
 * the base document is never modified.
 */
public interface VariantMaterializer {

    /**
     * @param base       the model being swept
     * @param assignment values to substitute
     * @return a new document with the assignment applied
     * @throws MaterializationException if the assignment cannot be applied to this model
     */
    ModelDocument materialize(ModelDocument base, Assignment assignment) throws MaterializationException;
}
