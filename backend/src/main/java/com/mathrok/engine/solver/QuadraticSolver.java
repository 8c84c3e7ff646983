package com.mathrok.engine.solver;

import com.mathrok.engine.ast.Numbers;
import com.mathrok.engine.config.MathConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Solves {@code a·x² + b·x + c = 0} over the reals by the discriminant.
 * With {@code a = 0} the equation is handed to the {@link LinearSolver}.
 */
public class QuadraticSolver implements EquationSolver {

    private static final Logger logger = LoggerFactory.getLogger(QuadraticSolver.class);

    private static final double DISCRIMINANT_EPSILON = 1e-12;

    private final LinearSolver linearSolver;

    public QuadraticSolver(LinearSolver linearSolver) {
        this.linearSolver = linearSolver;
    }

    @Override
    public List<Solution> solve(SolveContext context, StepTrace trace) {
        double[] coefficients = PolynomialExtractor.extractQuadratic(context.equation(), context.variable());
        return solve(coefficients[0], coefficients[1], coefficients[2], context.variable(), context.config(), trace);
    }

    public List<Solution> solve(double a, double b, double c, String variable, MathConfig config, StepTrace trace) {
        logger.debug("Solving quadratic equation a={}, b={}, c={} in {}", a, b, c, variable);
        String form = form(a, b, c, variable, config);

        trace.add("identify_quadratic", StepOperation.IDENTIFICATION,
                "Identify quadratic equation: " + form,
                form,
                "Quadratic equation in standard form",
                "This is a quadratic equation with a = " + SolutionValues.number(a, config)
                        + ", b = " + SolutionValues.number(b, config)
                        + ", c = " + SolutionValues.number(c, config));

        if (a == 0) {
            trace.add("reduce_to_linear", StepOperation.SIMPLIFICATION,
                    "Coefficient of " + variable + "^2 is 0, reducing to linear equation",
                    form,
                    SolutionValues.term(b, variable, config) + SolutionValues.signed(c, config) + " = 0",
                    "Since a = 0, this reduces to a linear equation");
            return linearSolver.solve(b, c, variable, config, trace);
        }

        double discriminant = discriminant(a, b, c);
        trace.add("calculate_discriminant", StepOperation.CALCULATION,
                "Calculate discriminant Δ = b² - 4ac",
                "Δ = " + SolutionValues.factor(b, config) + "^2 - 4" + "(" + SolutionValues.number(a, config) + ")("
                        + SolutionValues.number(c, config) + ")",
                "Δ = " + SolutionValues.number(discriminant, config),
                "The discriminant determines the nature of the roots");

        if (discriminant < 0) {
            trace.add("no_real_solutions", StepOperation.ANALYSIS,
                    "Discriminant is negative",
                    "Δ = " + SolutionValues.number(discriminant, config) + " < 0",
                    "No real solutions",
                    "Since the discriminant is negative, there are no real solutions (complex solutions exist)");
            trace.add("apply_quadratic_formula", StepOperation.CALCULATION,
                    "Apply quadratic formula: " + variable + " = (-b ± √Δ)/(2a)",
                    variable + " = (-" + SolutionValues.factor(b, config) + " ± √(" + SolutionValues.number(discriminant, config)
                            + "))/(2·" + SolutionValues.factor(a, config) + ")",
                    "No real solutions",
                    "√Δ is not a real number for Δ < 0, so the quadratic formula yields no real roots");
            return List.of();
        }

        if (discriminant == 0) {
            return repeatedRoot(a, b, variable, config, trace);
        }

        return twoRoots(a, b, discriminant, variable, config, trace);
    }

    private List<Solution> repeatedRoot(double a, double b, String variable, MathConfig config, StepTrace trace) {
        trace.add("one_repeated_root", StepOperation.ANALYSIS,
                "Discriminant is zero - one repeated root",
                "Δ = 0",
                "One repeated root",
                "Since the discriminant is zero, there is one repeated root");

        double root = -b / (2 * a);
        boolean exact = SolutionValues.isExactRatio(-b, 2 * a, config);
        String value = exact
                ? SolutionValues.ratio((long) -b, (long) (2 * a), config)
                : SolutionValues.number(root, config);

        trace.add("calculate_repeated_root", StepOperation.CALCULATION,
                "Calculate the repeated root using " + variable + " = -b/(2a)",
                variable + " = -" + SolutionValues.factor(b, config) + "/(2·" + SolutionValues.factor(a, config) + ")",
                variable + " = " + value,
                "Using the quadratic formula with Δ = 0");

        Solution solution = exact ? Solution.exact(variable, value, root) : Solution.approximate(variable, value, root);
        return List.of(solution.withMultiplicity(2));
    }

    private List<Solution> twoRoots(double a, double b, double discriminant, String variable, MathConfig config,
            StepTrace trace) {
        trace.add("two_distinct_roots", StepOperation.ANALYSIS,
                "Discriminant is positive - two distinct real roots",
                "Δ = " + SolutionValues.number(discriminant, config) + " > 0",
                "Two distinct real roots",
                "Since the discriminant is positive, there are two distinct real roots");

        double sqrt = Math.sqrt(discriminant);
        boolean perfectSquare = Numbers.isPerfectSquare(discriminant);
        Solution first = root(-b + sqrt, 2 * a, perfectSquare, variable, config);
        Solution second = root(-b - sqrt, 2 * a, perfectSquare, variable, config);

        trace.add("apply_quadratic_formula", StepOperation.CALCULATION,
                "Apply quadratic formula: " + variable + " = (-b ± √Δ)/(2a)",
                variable + " = (-" + SolutionValues.factor(b, config) + " ± √" + SolutionValues.number(discriminant, config)
                        + ")/(2·" + SolutionValues.factor(a, config) + ")",
                variable + " = " + first.value() + " or " + variable + " = " + second.value(),
                "Using the quadratic formula with Δ = " + SolutionValues.number(discriminant, config));

        return List.of(first, second);
    }

    private static Solution root(double numerator, double denominator, boolean perfectSquare, String variable,
            MathConfig config) {
        double value = numerator / denominator;
        if (perfectSquare && SolutionValues.isExactRatio(numerator, denominator, config)) {
            return Solution.exact(variable,
                    SolutionValues.ratio(Math.round(numerator), Math.round(denominator), config), value);
        }
        return Solution.approximate(variable, SolutionValues.number(value, config), value);
    }

    // integer coefficients give an exact discriminant; otherwise rounding noise near zero counts as zero
    static double discriminant(double a, double b, double c) {
        double d = b * b - 4 * a * c;
        double scale = Math.max(b * b, Math.abs(4 * a * c));
        return Math.abs(d) <= DISCRIMINANT_EPSILON * scale ? 0 : d;
    }

    private static String form(double a, double b, double c, String variable, MathConfig config) {
        String lead = a == 0 ? "0" + variable : SolutionValues.term(a, variable, config);
        return lead + "^2" + signedTerm(b, variable, config) + SolutionValues.signed(c, config) + " = 0";
    }

    private static String signedTerm(double coefficient, String variable, MathConfig config) {
        String magnitude = Math.abs(coefficient) == 1 ? "" : SolutionValues.number(Math.abs(coefficient), config);
        return (coefficient < 0 ? " - " : " + ") + magnitude + variable;
    }
}
