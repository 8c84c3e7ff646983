package com.mathrok.engine.solver;

import com.mathrok.engine.ast.Numbers;
import com.mathrok.engine.config.MathConfig;

/**
 * Rendering of solver numbers under the caller's precision and exactness options.
 */
final class SolutionValues {

    private static final double RESIDUAL_EPSILON = 1e-9;

    private SolutionValues() {
    }

    static String number(double value, MathConfig config) {
        return Numbers.format(value, config.precision());
    }

    /**
     * {@code numerator/denominator} as a reduced fraction when exact output is on, else as a decimal.
     */
    static String ratio(long numerator, long denominator, MathConfig config) {
        if (config.exact()) {
            return Numbers.fraction(numerator, denominator);
        }
        return number((double) numerator / denominator, config);
    }

    static boolean isExactRatio(double numerator, double denominator, MathConfig config) {
        if (!Numbers.isInteger(numerator) || !Numbers.isInteger(denominator) || denominator == 0) {
            return false;
        }
        return config.exact() || Numbers.isInteger(numerator / denominator);
    }

    /**
     * Term such as {@code 2x}, {@code -x} or {@code 0.5x}.
     */
    static String term(double coefficient, String variable, MathConfig config) {
        if (coefficient == 1) {
            return variable;
        }
        if (coefficient == -1) {
            return "-" + variable;
        }
        return number(coefficient, config) + variable;
    }

    /**
     * {@code " + 3"} or {@code " - 3"}, for appending a signed constant to a term.
     */
    static String signed(double value, MathConfig config) {
        return (value < 0 ? " - " : " + ") + number(Math.abs(value), config);
    }

    /**
     * Wraps negative numbers in parentheses for use as a factor.
     */
    static String factor(double value, MathConfig config) {
        String text = number(value, config);
        return value < 0 ? "(" + text + ")" : text;
    }

    static double cleanResidual(double residual, double scale) {
        return Math.abs(residual) < RESIDUAL_EPSILON * Math.max(1, Math.abs(scale)) ? 0 : residual;
    }
}
