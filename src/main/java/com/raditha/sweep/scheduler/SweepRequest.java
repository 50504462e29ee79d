package com.raditha.sweep.scheduler;

import com.raditha.sweep.model.ModelDocument;
import com.raditha.sweep.model.VariableSpec;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Inputs of one sweep.
 *
 * @param variables variables to sweep
 * @param model     base model; never modified
 * @param queryFile query file handed to the engine as is
 */
public record SweepRequest(VariableSpec variables, ModelDocument model, Path queryFile) {
    public SweepRequest {
        Objects.requireNonNull(variables, "variables cannot be null");
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(queryFile, "queryFile cannot be null");
    }
}
