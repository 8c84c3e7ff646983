package com.mathrok.engine.lexer;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builtin function and constant tables shared by the lexer, validator, classifier and evaluator.
 */
public final class MathFunctions {

    public static final Set<String> TRIGONOMETRIC = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc",
            "asin", "acos", "atan", "acot", "asec", "acsc",
            "sinh", "cosh", "tanh", "coth", "sech", "csch",
            "asinh", "acosh", "atanh", "acoth", "asech", "acsch");

    /**
     * Trigonometric functions with period 2π; the inverse and hyperbolic ones are not periodic.
     */
    public static final Set<String> CIRCULAR = Set.of("sin", "cos", "tan", "cot", "sec", "csc");

    public static final Set<String> LOGARITHMIC = Set.of("log", "ln", "log10", "log2");

    public static final Set<String> RADICAL = Set.of("sqrt", "cbrt");

    public static final Set<String> DIFFERENTIAL = Set.of("derivative", "diff");

    private static final Set<String> OTHER = Set.of(
            "exp", "abs", "floor", "ceil", "round", "sign",
            "min", "max", "gcd", "lcm",
            "factorial", "gamma", "beta", "erf", "erfc",
            "integrate", "derivative", "diff", "sum", "product", "limit",
            "solve", "simplify", "expand", "factor");

    public static final Set<String> BUILTIN = union(TRIGONOMETRIC, LOGARITHMIC, RADICAL, OTHER);

    public static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E,
            "inf", Double.POSITIVE_INFINITY,
            "infinity", Double.POSITIVE_INFINITY);

    public static final Set<String> RESERVED_WORDS = Set.of(
            "undefined", "null", "true", "false", "NaN", "Infinity");

    private MathFunctions() {
    }

    public static boolean isBuiltin(String name) {
        return BUILTIN.contains(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isConstant(String name) {
        return CONSTANTS.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isTrigonometric(String name) {
        return TRIGONOMETRIC.contains(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isCircular(String name) {
        return CIRCULAR.contains(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isLogarithmic(String name) {
        return LOGARITHMIC.contains(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isRadical(String name) {
        return RADICAL.contains(name.toLowerCase(Locale.ROOT));
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... sets) {
        Set<String> all = new HashSet<>();
        for (Set<String> set : sets) {
            all.addAll(set);
        }
        return Set.copyOf(all);
    }
}
