package com.mathrok.engine.solver;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExpressionPrinter;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.classify.Classification;
import com.mathrok.engine.classify.EquationType;
import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.exception.ComputationException;
import com.mathrok.engine.exception.DegreeMismatchException;
import com.mathrok.engine.exception.MathException;
import com.mathrok.engine.simplify.Simplifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Routes a classified equation to its solver and assembles the {@link SolveResult}.
 * <p>
 * A linear solve that fails moves on to the quadratic solver, and a quadratic one to the generalized
 * polynomial path; each move is recorded as a {@code fallback} step carrying the reason.
 */
public class SolverDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SolverDispatcher.class);

    private final LinearSolver linearSolver;
    private final QuadraticSolver quadraticSolver;
    private final GeneralizedSolver generalizedSolver;
    private final DomainAnalyzer domainAnalyzer;
    private final Simplifier simplifier;

    public SolverDispatcher(LinearSolver linearSolver, QuadraticSolver quadraticSolver,
            GeneralizedSolver generalizedSolver, DomainAnalyzer domainAnalyzer, Simplifier simplifier) {
        this.linearSolver = linearSolver;
        this.quadraticSolver = quadraticSolver;
        this.generalizedSolver = generalizedSolver;
        this.domainAnalyzer = domainAnalyzer;
        this.simplifier = simplifier;
    }

    public SolveResult dispatch(ExprNode ast, Classification classification, Map<String, Double> bindings,
            MathConfig config) {
        if (ast instanceof InequalityNode) {
            throw new ComputationException("Inequalities cannot be solved for a value",
                    List.of("Replace the comparison with '=' to solve the equation"));
        }

        String variable = classification.variable();
        StepTrace trace = new StepTrace();

        trace.add("identify_type", StepOperation.ANALYSIS,
                "Classify the equation",
                ExpressionPrinter.print(ast),
                "Identified as " + classification.type() + " equation in " + variable,
                "The equation " + classification.reason());

        ExprNode equation = ast;
        if (!bindings.isEmpty()) {
            equation = Expressions.bindNumbers(equation, bindings);
            trace.add("substitute_values", StepOperation.SUBSTITUTION,
                    "Substitute the given values",
                    ExpressionPrinter.print(ast),
                    ExpressionPrinter.print(equation),
                    "Replace " + String.join(", ", bindings.keySet()) + " with the supplied numbers");
        }

        if (config.autoSimplify()) {
            ExprNode simplified = simplifier.simplify(equation);
            String before = ExpressionPrinter.print(equation);
            String after = ExpressionPrinter.print(simplified);
            if (!before.equals(after)) {
                trace.add("simplify", StepOperation.SIMPLIFICATION,
                        "Simplify the equation",
                        before,
                        after,
                        "Fold constants and remove identity operations");
            }
            equation = simplified;
        }

        SolveContext context = new SolveContext(equation, variable, classification.type(), config);
        EquationType solvedAs = classification.type();
        List<Solution> solutions;

        switch (classification.type()) {
            case LINEAR -> {
                SolveAttempt attempt = solveLinear(context, trace);
                solutions = attempt.solutions();
                solvedAs = attempt.type();
            }
            case QUADRATIC -> {
                SolveAttempt attempt = solveQuadratic(context, trace);
                solutions = attempt.solutions();
                solvedAs = attempt.type();
            }
            default -> solutions = generalizedSolver.solve(context, trace);
        }

        logger.debug("Solved {} equation in {} as {}: {} solution(s), {} step(s)", classification.type(), variable,
                solvedAs, solutions.size(), trace.size());

        SolveResult result = new SolveResult(solutions, trace.steps(), solvedAs, List.of(variable),
                domainAnalyzer.analyze(ast, variable));
        return config.showSteps() ? result : result.finalStepOnly();
    }

    private SolveAttempt solveLinear(SolveContext context, StepTrace trace) {
        try {
            return new SolveAttempt(EquationType.LINEAR, linearSolver.solve(context, trace));
        } catch (ComputationException | DegreeMismatchException e) {
            fallback(EquationType.LINEAR, EquationType.QUADRATIC, e, trace);
            return solveQuadratic(context.withType(EquationType.QUADRATIC), trace);
        }
    }

    private SolveAttempt solveQuadratic(SolveContext context, StepTrace trace) {
        try {
            return new SolveAttempt(EquationType.QUADRATIC, quadraticSolver.solve(context, trace));
        } catch (ComputationException | DegreeMismatchException e) {
            fallback(EquationType.QUADRATIC, EquationType.POLYNOMIAL, e, trace);
            SolveContext polynomial = context.withType(EquationType.POLYNOMIAL);
            return new SolveAttempt(EquationType.POLYNOMIAL, generalizedSolver.solve(polynomial, trace));
        }
    }

    private static void fallback(EquationType from, EquationType to, MathException cause, StepTrace trace) {
        logger.info("{} solver failed ({}), retrying as {}", from, cause.getMessage(), to);
        trace.add("fallback", StepOperation.FALLBACK,
                "Re-route from the " + lower(from) + " solver to the " + lower(to) + " solver",
                from.name(),
                to.name(),
                cause.getMessage());
    }

    private static String lower(EquationType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    private record SolveAttempt(EquationType type, List<Solution> solutions) {
    }
}
