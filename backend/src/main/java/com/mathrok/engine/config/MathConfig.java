package com.mathrok.engine.config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Effective options for one parse or solve call.
 */
public record MathConfig(
        int precision,
        boolean exact,
        boolean autoSimplify,
        boolean showSteps,
        int maxExpressionLength,
        int maxVariables,
        int maxComplexity,
        int maxVariableNameLength,
        boolean implicitMultiplication,
        boolean useCache,
        Set<String> customFunctions,
        NumericSettings numeric) {

    public MathConfig {
        customFunctions = customFunctions == null ? Set.of() : customFunctions.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        numeric = numeric == null ? NumericSettings.defaults() : numeric;
    }

    public static MathConfig defaults() {
        return new MathConfig(15, true, true, true, 10_000, 100, 1000, 20, true, true, Set.of(),
                NumericSettings.defaults());
    }

    public MathConfig withOverrides(ConfigOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new MathConfig(
                pick(overrides.precision(), precision),
                pick(overrides.exact(), exact),
                pick(overrides.autoSimplify(), autoSimplify),
                pick(overrides.showSteps(), showSteps),
                pick(overrides.maxExpressionLength(), maxExpressionLength),
                pick(overrides.maxVariables(), maxVariables),
                pick(overrides.maxComplexity(), maxComplexity),
                maxVariableNameLength,
                pick(overrides.implicitMultiplication(), implicitMultiplication),
                pick(overrides.useCache(), useCache),
                customFunctions,
                numeric);
    }

    /**
     * Stable text form of every option that can change a result, used in cache keys.
     */
    public String fingerprint() {
        return precision + "|" + exact + "|" + autoSimplify + "|" + showSteps + "|" + implicitMultiplication
                + "|" + maxExpressionLength + "|" + maxVariables + "|" + maxComplexity + "|" + maxVariableNameLength
                + "|" + customFunctions.stream().sorted().collect(Collectors.joining(","))
                + "|" + numeric;
    }

    private static <T> T pick(T override, T current) {
        return override != null ? override : current;
    }
}
