package com.mathrok.engine.config;

/**
 * Bounds for the numeric root finder used when no closed form is available.
 */
public record NumericSettings(
        double searchMin,
        double searchMax,
        int samples,
        int maxIterations,
        double tolerance) {

    public static NumericSettings defaults() {
        return new NumericSettings(-100, 100, 2000, 100, 1e-10);
    }

    public NumericSettings {
        if (!(searchMin < searchMax)) {
            throw new IllegalArgumentException("searchMin must be below searchMax");
        }
        if (samples < 2 || maxIterations < 1 || !(tolerance > 0)) {
            throw new IllegalArgumentException("samples >= 2, maxIterations >= 1 and tolerance > 0 are required");
        }
    }

    public NumericSettings withInterval(double min, double max) {
        return new NumericSettings(min, max, samples, maxIterations, tolerance);
    }
}
