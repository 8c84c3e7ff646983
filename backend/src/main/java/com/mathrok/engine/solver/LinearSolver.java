package com.mathrok.engine.solver;

import com.mathrok.engine.config.MathConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Solves {@code a·x + b = 0}, including the degenerate cases {@code a = 0}.
 */
public class LinearSolver implements EquationSolver {

    private static final Logger logger = LoggerFactory.getLogger(LinearSolver.class);

    @Override
    public List<Solution> solve(SolveContext context, StepTrace trace) {
        double[] coefficients = PolynomialExtractor.extractLinear(context.equation(), context.variable());
        return solve(coefficients[0], coefficients[1], context.variable(), context.config(), trace);
    }

    public List<Solution> solve(double a, double b, String variable, MathConfig config, StepTrace trace) {
        logger.debug("Solving linear equation a={}, b={} in {}", a, b, variable);
        String form = form(a, b, variable, config);

        trace.add("identify_form", StepOperation.IDENTIFICATION,
                "Identify linear equation form: " + form,
                form,
                "Linear equation in standard form",
                "This is a linear equation with coefficient a = " + SolutionValues.number(a, config)
                        + " and constant b = " + SolutionValues.number(b, config));

        if (a == 0) {
            return degenerate(b, variable, config, form, trace);
        }

        String isolated = SolutionValues.term(a, variable, config) + " = " + SolutionValues.number(-b, config);
        trace.add("isolate_variable_term", StepOperation.ALGEBRAIC_MANIPULATION,
                (b < 0 ? "Add " : "Subtract ") + SolutionValues.number(Math.abs(b), config)
                        + (b < 0 ? " to" : " from") + " both sides",
                form,
                isolated,
                "Move the constant term to the right-hand side to isolate the variable term");

        double root = -b / a;
        boolean exact = SolutionValues.isExactRatio(-b, a, config);
        String value = exact ? SolutionValues.ratio((long) -b, (long) a, config) : SolutionValues.number(root, config);

        trace.add("solve_for_variable", StepOperation.ALGEBRAIC_MANIPULATION,
                "Divide both sides by " + SolutionValues.number(a, config),
                isolated,
                variable + " = " + value,
                "Divide both sides by " + SolutionValues.number(a, config) + " to solve for " + variable);

        double residual = SolutionValues.cleanResidual(a * root + b, b);
        trace.add("verify_solution", StepOperation.VERIFICATION,
                "Verify the solution",
                variable + " = " + value,
                SolutionValues.number(a, config) + "(" + value + ")" + SolutionValues.signed(b, config) + " = "
                        + SolutionValues.number(residual, config),
                "Substitute " + variable + " = " + value + " back into the equation to verify");

        Solution solution = exact
                ? Solution.exact(variable, value, root)
                : Solution.approximate(variable, value, root);
        return List.of(solution);
    }

    private List<Solution> degenerate(double b, String variable, MathConfig config, String form, StepTrace trace) {
        if (b == 0) {
            trace.add("infinite_solutions", StepOperation.SIMPLIFICATION,
                    "Equation simplifies to 0 = 0",
                    form,
                    "0 = 0, true for all real numbers",
                    "This equation is always true, so every value of " + variable + " is a solution");
            return List.of(new Solution(variable, "all real numbers", true, null, List.of(variable + " ∈ ℝ"), null));
        }

        String simplified = SolutionValues.number(b, config) + " = 0";
        trace.add("no_solution", StepOperation.SIMPLIFICATION,
                "Equation simplifies to " + simplified,
                form,
                simplified,
                "This equation is never true since " + SolutionValues.number(b, config)
                        + " ≠ 0, so there is no solution");
        return List.of();
    }

    private static String form(double a, double b, String variable, MathConfig config) {
        String lead = a == 0 ? "0" + variable : SolutionValues.term(a, variable, config);
        return lead + SolutionValues.signed(b, config) + " = 0";
    }
}
