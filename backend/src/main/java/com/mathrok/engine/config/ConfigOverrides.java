package com.mathrok.engine.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Per-request options; a {@code null} field keeps the configured default.
 */
public record ConfigOverrides(
        @Min(1) @Max(100)
        Integer precision,

        Boolean exact,

        Boolean autoSimplify,

        Boolean showSteps,

        @Min(1) @Max(100_000)
        Integer maxExpressionLength,

        @Min(1) @Max(1000)
        Integer maxVariables,

        @Min(1) @Max(100_000)
        Integer maxComplexity,

        Boolean implicitMultiplication,

        Boolean useCache
) {

    public static ConfigOverrides none() {
        return new ConfigOverrides(null, null, null, null, null, null, null, null, null);
    }
}
