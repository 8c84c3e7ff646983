package com.mathrok.engine.classify;

public enum EquationType {
    LINEAR,
    QUADRATIC,
    POLYNOMIAL,
    RATIONAL,
    RADICAL,
    EXPONENTIAL,
    LOGARITHMIC,
    TRIGONOMETRIC,
    SYSTEM,
    DIFFERENTIAL
}
