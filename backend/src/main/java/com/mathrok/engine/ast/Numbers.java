package com.mathrok.engine.ast;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Number formatting shared by the printer and the step traces.
 */
public final class Numbers {

    public static final int DEFAULT_PRECISION = 15;

    private static final double INTEGER_LIMIT = 1e15;

    private Numbers() {
    }

    public static String format(double value) {
        return format(value, DEFAULT_PRECISION);
    }

    /**
     * Formats with at most {@code precision} significant digits; integral values print without a fraction part.
     */
    public static String format(double value, int precision) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "∞" : "-∞";
        }
        if (value == 0) {
            return "0";
        }
        if (isInteger(value)) {
            return Long.toString((long) value);
        }

        BigDecimal rounded = new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_EVEN));
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    public static boolean isInteger(double value) {
        return Double.isFinite(value) && Math.abs(value) < INTEGER_LIMIT && value == Math.rint(value);
    }

    /**
     * Reduced fraction text such as {@code -2/3}, or a plain integer when the denominator divides evenly.
     */
    public static String fraction(long numerator, long denominator) {
        if (denominator == 0) {
            throw new ArithmeticException("Zero denominator");
        }
        long divisor = gcd(Math.abs(numerator), Math.abs(denominator));
        long num = numerator / divisor;
        long den = denominator / divisor;
        if (den < 0) {
            num = -num;
            den = -den;
        }
        return den == 1 ? Long.toString(num) : num + "/" + den;
    }

    public static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }

    public static boolean isPerfectSquare(double value) {
        if (!isInteger(value) || value < 0) {
            return false;
        }
        long root = (long) Math.rint(Math.sqrt(value));
        return root * root == (long) value;
    }
}
