package com.mathrok.engine.solver;

import java.util.Objects;

/**
 * One immutable entry of a derivation trace.
 */
public record SolutionStep(
        String id,
        String description,
        StepOperation operation,
        String before,
        String after,
        String explanation
) {

    public SolutionStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
    }
}
