package com.mathrok.engine.solver;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExpressionEvaluator;
import com.mathrok.engine.ast.ExpressionPrinter;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.Numbers;
import com.mathrok.engine.backend.BackendResult;
import com.mathrok.engine.backend.SymbolicBackendChain;
import com.mathrok.engine.classify.EquationType;
import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.exception.ComputationException;
import com.mathrok.engine.lexer.MathFunctions;
import com.mathrok.engine.solver.numeric.NumericRootFinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Handles every type without a dedicated closed-form algorithm.
 * <p>
 * Equations whose terms in the target collect into a polynomial of degree two or less go back to the
 * quadratic solver, whatever type they were classified as. Everything else is offered to the symbolic
 * backends in priority order and, when none answers, searched numerically. The numeric search covers one
 * period only when the equation is 2π-periodic in the target. An equation with no root found is a
 * {@link ComputationException}, never an empty result.
 */
public class GeneralizedSolver implements EquationSolver {

    private static final Logger logger = LoggerFactory.getLogger(GeneralizedSolver.class);

    private static final double PERIOD = 2 * Math.PI;

    private final QuadraticSolver quadraticSolver;
    private final SymbolicBackendChain backends;

    public GeneralizedSolver(QuadraticSolver quadraticSolver, SymbolicBackendChain backends) {
        this.quadraticSolver = quadraticSolver;
        this.backends = backends;
    }

    @Override
    public List<Solution> solve(SolveContext context, StepTrace trace) {
        if (context.type() != EquationType.SYSTEM && context.type() != EquationType.DIFFERENTIAL) {
            Optional<List<Solution>> reduced = solveAsLowDegree(context, trace);
            if (reduced.isPresent()) {
                return reduced.get();
            }
        }

        Optional<List<Solution>> closedForm = solveWithBackend(context, trace);
        if (closedForm.isPresent()) {
            return closedForm.get();
        }

        if (context.type() == EquationType.SYSTEM || context.type() == EquationType.DIFFERENTIAL) {
            throw new ComputationException("No symbolic backend could solve this "
                    + context.type().name().toLowerCase(Locale.ROOT) + " equation",
                    List.of("Register a symbolic backend that supports solving"));
        }

        return solveNumerically(context, trace);
    }

    private Optional<List<Solution>> solveAsLowDegree(SolveContext context, StepTrace trace) {
        Polynomial polynomial;
        try {
            polynomial = PolynomialExtractor.extract(context.equation(), context.variable());
        } catch (ComputationException e) {
            logger.debug("Not a plain polynomial in {}: {}", context.variable(), e.getMessage());
            return Optional.empty();
        }
        if (polynomial.degree() > 2) {
            return Optional.empty();
        }

        trace.add("reduce_to_quadratic", StepOperation.SIMPLIFICATION,
                "Collect terms: the polynomial has degree " + polynomial.degree(),
                ExpressionPrinter.print(context.equation()),
                polynomial.format(context.config().precision()) + " = 0",
                "After collecting like terms no power of " + context.variable()
                        + " above 2 remains, so the quadratic formula applies");
        return Optional.of(quadraticSolver.solve(polynomial.coefficient(2), polynomial.coefficient(1),
                polynomial.coefficient(0), context.variable(), context.config(), trace));
    }

    private Optional<List<Solution>> solveWithBackend(SolveContext context, StepTrace trace) {
        String equation = ExpressionPrinter.print(context.equation());
        Optional<BackendResult<List<String>>> result = backends.solve(equation, context.variable());
        if (result.isEmpty()) {
            return Optional.empty();
        }

        String variable = context.variable();
        List<Solution> solutions = result.get().value().stream()
                .map(value -> new Solution(variable, value, true, approximation(value), List.of(), null))
                .toList();

        trace.add("symbolic_backend", StepOperation.BACKEND,
                "Solve in closed form with " + result.get().backend(),
                equation,
                joined(variable, solutions),
                "The " + context.type().name().toLowerCase(Locale.ROOT) + " equation was solved by the symbolic backend "
                        + result.get().backend());
        return Optional.of(solutions);
    }

    private List<Solution> solveNumerically(SolveContext context, StepTrace trace) {
        MathConfig config = context.config();
        String variable = context.variable();
        ExprNode function = Expressions.toZeroForm(context.equation());
        boolean periodic = context.type() == EquationType.TRIGONOMETRIC && isPeriodic(function, variable);
        double min = periodic ? 0 : config.numeric().searchMin();
        double max = periodic ? PERIOD : config.numeric().searchMax();

        trace.add("numeric_fallback", StepOperation.FALLBACK,
                "No closed form available, switching to numeric root finding",
                ExpressionPrinter.print(context.equation()),
                ExpressionPrinter.print(function) + " = 0",
                backends.isEmpty()
                        ? "No symbolic backend is configured"
                        : "None of the configured symbolic backends produced a solution");

        NumericRootFinder finder = new NumericRootFinder(config.numeric());
        List<ExprNode> divisors = divisorsOf(function, variable);
        List<Double> roots = new ArrayList<>();
        for (double root : finder.findRoots(x -> evaluate(function, variable, x), min, max)) {
            if (periodic && root >= PERIOD - 1e-9) {
                continue;
            }
            if (vanishes(divisors, variable, root, config)) {
                logger.debug("Rejected {} = {}: a denominator vanishes", variable, root);
                continue;
            }
            roots.add(root);
        }

        if (roots.isEmpty()) {
            throw new ComputationException("No real solution for " + variable + " found in ["
                    + SolutionValues.number(min, config) + ", " + SolutionValues.number(max, config) + "]",
                    List.of("Widen the numeric search interval", "Check that the equation has real solutions"));
        }

        List<Solution> solutions = new ArrayList<>();
        for (double root : roots) {
            String value = SolutionValues.number(root, config);
            Solution solution = Solution.approximate(variable, value, root);
            if (periodic) {
                solution = solution.withConditions(List.of(variable + " = " + value + " + 2πn, n ∈ ℤ"));
            }
            solutions.add(solution);
        }

        trace.add("numeric_roots", StepOperation.NUMERIC_APPROXIMATION,
                "Locate sign changes on [" + SolutionValues.number(min, config) + ", "
                        + SolutionValues.number(max, config) + "] and refine with Newton-Raphson",
                ExpressionPrinter.print(function) + " = 0",
                joined(variable, solutions),
                periodic
                        ? "Roots were searched over one period; every root repeats with period 2π"
                        : "Approximate roots to a tolerance of " + config.numeric().tolerance());
        return solutions;
    }

    /**
     * True when every occurrence of the variable sits inside a 2π-periodic function whose argument is
     * {@code k·x + c} with integer {@code k}, possibly through further functions or arithmetic.
     */
    static boolean isPeriodic(ExprNode node, String variable) {
        if (!Expressions.containsVariable(node, variable)) {
            return true;
        }
        if (node instanceof FunctionNode function) {
            if (MathFunctions.isCircular(function.name())
                    && function.args().size() == 1 && hasIntegerSlope(function.args().get(0), variable)) {
                return true;
            }
            return function.args().stream().allMatch(arg -> isPeriodic(arg, variable));
        }
        if (node instanceof OperatorNode operator) {
            return operator.operands().stream().allMatch(operand -> isPeriodic(operand, variable));
        }
        if (node instanceof EquationNode equation) {
            return isPeriodic(equation.left(), variable) && isPeriodic(equation.right(), variable);
        }
        return false;
    }

    private static boolean hasIntegerSlope(ExprNode argument, String variable) {
        try {
            Polynomial polynomial = PolynomialExtractor.extract(argument, variable);
            return polynomial.degree() == 1 && Numbers.isInteger(polynomial.coefficient(1));
        } catch (ComputationException e) {
            return false;
        }
    }

    private static double evaluate(ExprNode function, String variable, double x) {
        return ExpressionEvaluator.evaluate(function, Map.of(variable, x));
    }

    private static List<ExprNode> divisorsOf(ExprNode function, String variable) {
        return Expressions.findAll(function, node -> node instanceof OperatorNode op && !op.isUnary()
                        && "/".equals(op.symbol()) && Expressions.containsVariable(op.right(), variable))
                .stream()
                .map(node -> ((OperatorNode) node).right())
                .toList();
    }

    private static boolean vanishes(List<ExprNode> divisors, String variable, double root, MathConfig config) {
        double threshold = Math.sqrt(config.numeric().tolerance());
        for (ExprNode divisor : divisors) {
            double value = evaluate(divisor, variable, root);
            if (!Double.isFinite(value) || Math.abs(value) <= threshold) {
                return true;
            }
        }
        return false;
    }

    private static Double approximation(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String joined(String variable, List<Solution> solutions) {
        return solutions.stream()
                .map(solution -> variable + " = " + solution.value())
                .collect(Collectors.joining(" or "));
    }
}
