package com.mathrok.engine.classify;

/**
 * @param degree polynomial degree in {@code variable}, or {@code -1} when the equation is not a polynomial in it
 * @param reason short human readable account of the check that decided the type
 */
public record Classification(
        EquationType type,
        String variable,
        int degree,
        String reason
) {

    public static final int NOT_POLYNOMIAL = -1;

    public boolean isPolynomial() {
        return degree != NOT_POLYNOMIAL;
    }
}
