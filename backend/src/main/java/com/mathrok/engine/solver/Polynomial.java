package com.mathrok.engine.solver;

import com.mathrok.engine.ast.Numbers;

import java.util.Arrays;

/**
 * Dense real polynomial in one variable; {@code coefficients[k]} multiplies {@code variable^k}.
 */
public final class Polynomial {

    private static final double EPSILON = 1e-12;

    private final String variable;
    private final double[] coefficients;

    public Polynomial(String variable, double... coefficients) {
        this.variable = variable;
        this.coefficients = trim(coefficients);
    }

    public static Polynomial constant(String variable, double value) {
        return new Polynomial(variable, value);
    }

    public static Polynomial monomial(String variable, int power) {
        double[] coefficients = new double[power + 1];
        coefficients[power] = 1;
        return new Polynomial(variable, coefficients);
    }

    public String variable() {
        return variable;
    }

    /**
     * Highest power with a non-zero coefficient; 0 for constants, including the zero polynomial.
     */
    public int degree() {
        return coefficients.length - 1;
    }

    public double coefficient(int power) {
        return power < coefficients.length ? coefficients[power] : 0;
    }

    public boolean isConstant() {
        return coefficients.length == 1;
    }

    public Polynomial plus(Polynomial other) {
        double[] sum = new double[Math.max(coefficients.length, other.coefficients.length)];
        for (int i = 0; i < sum.length; i++) {
            sum[i] = coefficient(i) + other.coefficient(i);
        }
        return new Polynomial(variable, sum);
    }

    public Polynomial negate() {
        return scale(-1);
    }

    public Polynomial minus(Polynomial other) {
        return plus(other.negate());
    }

    public Polynomial scale(double factor) {
        double[] scaled = new double[coefficients.length];
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] = coefficients[i] * factor;
        }
        return new Polynomial(variable, scaled);
    }

    public Polynomial times(Polynomial other) {
        double[] product = new double[coefficients.length + other.coefficients.length - 1];
        for (int i = 0; i < coefficients.length; i++) {
            for (int j = 0; j < other.coefficients.length; j++) {
                product[i + j] += coefficients[i] * other.coefficients[j];
            }
        }
        return new Polynomial(variable, product);
    }

    public Polynomial pow(int exponent) {
        Polynomial result = constant(variable, 1);
        for (int i = 0; i < exponent; i++) {
            result = result.times(this);
        }
        return result;
    }

    public double evaluate(double x) {
        double result = 0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }

    /**
     * Text such as {@code 2x^2 - 3x + 1}, highest power first.
     */
    public String format(int precision) {
        StringBuilder text = new StringBuilder();
        for (int power = degree(); power >= 0; power--) {
            double c = coefficients[power];
            if (c == 0 && !(power == 0 && text.length() == 0)) {
                continue;
            }
            if (text.length() == 0) {
                text.append(c < 0 ? "-" : "");
            } else {
                text.append(c < 0 ? " - " : " + ");
            }
            double magnitude = Math.abs(c);
            if (power == 0 || magnitude != 1) {
                text.append(Numbers.format(magnitude, precision));
            }
            if (power >= 1) {
                text.append(variable);
            }
            if (power >= 2) {
                text.append('^').append(power);
            }
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Polynomial other)) {
            return false;
        }
        return variable.equals(other.variable) && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return format(Numbers.DEFAULT_PRECISION);
    }

    // drops leading coefficients that are zero up to rounding noise relative to the largest one
    private static double[] trim(double[] coefficients) {
        if (coefficients.length == 0) {
            return new double[] {0};
        }
        double scale = 0;
        for (double c : coefficients) {
            scale = Math.max(scale, Math.abs(c));
        }
        double threshold = EPSILON * Math.max(1, scale);

        double[] cleaned = coefficients.clone();
        for (int i = 0; i < cleaned.length; i++) {
            if (Math.abs(cleaned[i]) < threshold) {
                cleaned[i] = 0;
            }
        }
        int length = cleaned.length;
        while (length > 1 && cleaned[length - 1] == 0) {
            length--;
        }
        return Arrays.copyOf(cleaned, length);
    }
}
