package com.raditha.sweep.model;

/**
 * Verdict reported by the engine for one formula.
 */
public enum Satisfaction {
    SATISFIED,
    NOT_SATISFIED,
    /**
     * The engine started the formula but printed no verdict.
     */
    UNKNOWN;

    /**
     * Tri-state view: true, false, or null when unknown.
     */
    public Boolean toBoolean() {
        return switch (this) {
            case SATISFIED -> Boolean.TRUE;
            case NOT_SATISFIED -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }
}
