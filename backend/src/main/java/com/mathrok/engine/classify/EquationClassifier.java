package com.mathrok.engine.classify;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExpressionEvaluator;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.ast.Numbers;
import com.mathrok.engine.ast.Operators;
import com.mathrok.engine.lexer.MathFunctions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Assigns an {@link EquationType} to a parsed equation by structural inspection.
 * <p>
 * Checks run in a fixed order and the first match wins: nested equation, differential operator,
 * trigonometric function, exponential, logarithm, variable divisor, radical, and finally the
 * polynomial degree of the target variable.
 */
public class EquationClassifier {

    private static final Logger logger = LoggerFactory.getLogger(EquationClassifier.class);

    static final List<String> PREFERRED_VARIABLES = List.of("x", "y", "z", "t");

    static final String DEFAULT_VARIABLE = "x";

    public Classification classify(ExprNode ast, String variable) {
        return classify(ast, variable, Set.of());
    }

    /**
     * @param variable target chosen by the caller, or {@code null} to pick one from the tree
     * @param boundVariables names the caller supplies values for; never chosen as target
     */
    public Classification classify(ExprNode ast, String variable, Set<String> boundVariables) {
        String target = selectTarget(ast, variable, boundVariables);
        Classification classification = structuralType(ast, target)
                .orElseGet(() -> byDegree(ast, target));
        logger.debug("Classified as {} in {} ({})", classification.type(), target, classification.reason());
        return classification;
    }

    public String selectTarget(ExprNode ast, String variable, Set<String> boundVariables) {
        if (variable != null && !variable.isBlank()) {
            return variable.trim();
        }

        List<String> candidates = new ArrayList<>(Expressions.variables(ast));
        candidates.removeAll(boundVariables);

        for (String preferred : PREFERRED_VARIABLES) {
            if (candidates.contains(preferred)) {
                return preferred;
            }
        }
        return candidates.isEmpty() ? DEFAULT_VARIABLE : candidates.get(0);
    }

    private Optional<Classification> structuralType(ExprNode ast, String target) {
        if (hasNestedEquation(ast)) {
            return found(EquationType.SYSTEM, target, "contains more than one equation");
        }

        Optional<FunctionNode> differential = firstFunction(ast,
                fn -> MathFunctions.DIFFERENTIAL.contains(lower(fn)) && Expressions.containsVariable(fn, target));
        if (differential.isPresent()) {
            return found(EquationType.DIFFERENTIAL, target, "applies " + differential.get().name() + " to " + target);
        }

        Optional<FunctionNode> trig = firstFunction(ast, fn -> MathFunctions.isTrigonometric(fn.name()));
        if (trig.isPresent()) {
            return found(EquationType.TRIGONOMETRIC, target, "contains trigonometric function " + trig.get().name());
        }

        if (firstFunction(ast, fn -> "exp".equals(lower(fn))).isPresent()) {
            return found(EquationType.EXPONENTIAL, target, "contains exp");
        }
        if (Expressions.anyMatch(ast, node -> isPower(node)
                && Expressions.containsVariable(((OperatorNode) node).right(), target))) {
            return found(EquationType.EXPONENTIAL, target, target + " appears in an exponent");
        }

        Optional<FunctionNode> log = firstFunction(ast, fn -> MathFunctions.isLogarithmic(fn.name()));
        if (log.isPresent()) {
            return found(EquationType.LOGARITHMIC, target, "contains logarithm " + log.get().name());
        }

        if (Expressions.anyMatch(ast, node -> node instanceof OperatorNode op && !op.isUnary()
                && "/".equals(op.symbol()) && Expressions.containsVariable(op.right(), target))) {
            return found(EquationType.RATIONAL, target, "divides by an expression in " + target);
        }

        Optional<FunctionNode> root = firstFunction(ast, fn -> MathFunctions.isRadical(fn.name()));
        if (root.isPresent()) {
            return found(EquationType.RADICAL, target, "contains radical " + root.get().name());
        }
        if (Expressions.anyMatch(ast, EquationClassifier::isFractionalPower)) {
            return found(EquationType.RADICAL, target, "contains a fractional exponent");
        }

        return Optional.empty();
    }

    private Classification byDegree(ExprNode ast, String target) {
        int degree = PolynomialDegree.of(ast, target);
        if (degree == Classification.NOT_POLYNOMIAL) {
            return new Classification(EquationType.POLYNOMIAL, target, degree,
                    "not a polynomial in " + target);
        }
        if (degree <= 1) {
            return new Classification(EquationType.LINEAR, target, degree, "degree " + degree + " in " + target);
        }
        if (degree == 2) {
            return new Classification(EquationType.QUADRATIC, target, degree, "degree 2 in " + target);
        }
        return new Classification(EquationType.POLYNOMIAL, target, degree, "degree " + degree + " in " + target);
    }

    private static boolean hasNestedEquation(ExprNode ast) {
        for (ExprNode child : ast.children()) {
            if (Expressions.anyMatch(child, node -> node instanceof EquationNode)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<FunctionNode> firstFunction(ExprNode ast,
            Predicate<FunctionNode> predicate) {
        return Expressions.findAll(ast, node -> node instanceof FunctionNode fn && predicate.test(fn)).stream()
                .map(FunctionNode.class::cast)
                .findFirst();
    }

    private static boolean isPower(ExprNode node) {
        return node instanceof OperatorNode op && !op.isUnary() && Operators.POWER.equals(op.symbol());
    }

    private static boolean isFractionalPower(ExprNode node) {
        if (!isPower(node)) {
            return false;
        }
        ExprNode exponent = ((OperatorNode) node).right();
        if (!Expressions.variables(exponent).isEmpty() || !Expressions.functions(exponent).isEmpty()) {
            return false;
        }
        double value = ExpressionEvaluator.evaluate(exponent);
        return Double.isFinite(value) && !Numbers.isInteger(value);
    }

    private static String lower(FunctionNode fn) {
        return fn.name().toLowerCase(Locale.ROOT);
    }

    private static Optional<Classification> found(EquationType type, String target, String reason) {
        return Optional.of(new Classification(type, target, Classification.NOT_POLYNOMIAL, reason));
    }
}
