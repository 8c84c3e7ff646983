package com.mathrok.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.Set;

@ConfigurationProperties(prefix = "mathrok.engine")
@Validated
public record MathEngineProperties(
    @Min(1) @Max(100)
    @DefaultValue("15")
    int precision,

    @DefaultValue("true")
    boolean exact,

    @DefaultValue("true")
    boolean autoSimplify,

    @DefaultValue("true")
    boolean showSteps,

    @Min(1) @Max(100_000)
    @DefaultValue("10000")
    int maxExpressionLength,

    @Min(1) @Max(1000)
    @DefaultValue("100")
    int maxVariables,

    @Min(1) @Max(100_000)
    @DefaultValue("1000")
    int maxComplexity,

    @Positive
    @DefaultValue("20")
    int maxVariableNameLength,

    @DefaultValue("true")
    boolean implicitMultiplication,

    @DefaultValue("true")
    boolean useCache,

    @Positive
    @DefaultValue("3600")
    long cacheTtlSeconds,

    @Positive
    @DefaultValue("1000")
    int cacheMaxEntries,

    Set<String> customFunctions,

    @Valid
    @NotNull
    @DefaultValue
    Numeric numeric
) {

    public record Numeric(
        @DefaultValue("-100")
        double searchMin,

        @DefaultValue("100")
        double searchMax,

        @Min(2)
        @DefaultValue("2000")
        int samples,

        @Positive
        @DefaultValue("100")
        int maxIterations,

        @Positive
        @DefaultValue("1e-10")
        double tolerance
    ) {
    }

    public MathConfig toMathConfig() {
        return new MathConfig(
            precision,
            exact,
            autoSimplify,
            showSteps,
            maxExpressionLength,
            maxVariables,
            maxComplexity,
            maxVariableNameLength,
            implicitMultiplication,
            useCache,
            customFunctions == null ? Set.of() : customFunctions,
            new NumericSettings(
                numeric.searchMin(),
                numeric.searchMax(),
                numeric.samples(),
                numeric.maxIterations(),
                numeric.tolerance()));
    }
}
