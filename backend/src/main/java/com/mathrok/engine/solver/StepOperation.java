package com.mathrok.engine.solver;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StepOperation {
    PARSING,
    IDENTIFICATION,
    SUBSTITUTION,
    SIMPLIFICATION,
    ALGEBRAIC_MANIPULATION,
    CALCULATION,
    ANALYSIS,
    VERIFICATION,
    FALLBACK,
    BACKEND,
    NUMERIC_APPROXIMATION;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
