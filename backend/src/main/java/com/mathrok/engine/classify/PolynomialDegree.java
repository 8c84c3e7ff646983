package com.mathrok.engine.classify;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;
import com.mathrok.engine.ast.ExprVisitor;
import com.mathrok.engine.ast.ExpressionEvaluator;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.ast.Numbers;
import com.mathrok.engine.ast.Operators;
import com.mathrok.engine.exception.ComputationException;

/**
 * Degree of a tree in one variable. Products add degrees, so {@code x*x} has degree 2.
 * Any construct that is not polynomial in the variable yields {@link Classification#NOT_POLYNOMIAL}.
 */
public class PolynomialDegree implements ExprVisitor<Integer> {

    private static final int NONE = Classification.NOT_POLYNOMIAL;

    /**
     * Degrees saturate here; every larger degree classifies the same way.
     */
    static final int MAX_TRACKED = 1 << 20;

    private final String variable;

    public PolynomialDegree(String variable) {
        this.variable = variable;
    }

    public static int of(ExprNode node, String variable) {
        return node.accept(new PolynomialDegree(variable));
    }

    @Override
    public Integer visitNumber(NumberNode node) {
        return 0;
    }

    @Override
    public Integer visitVariable(VariableNode node) {
        return node.name().equals(variable) ? 1 : 0;
    }

    @Override
    public Integer visitFunction(FunctionNode node) {
        return Expressions.containsVariable(node, variable) ? NONE : 0;
    }

    @Override
    public Integer visitOperator(OperatorNode node) {
        if (node.isUnary()) {
            if (Operators.FACTORIAL.equals(node.symbol())) {
                return Expressions.containsVariable(node, variable) ? NONE : 0;
            }
            return node.left().accept(this);
        }

        int left = node.left().accept(this);
        int right = node.right().accept(this);
        if (left == NONE || right == NONE) {
            return NONE;
        }

        return switch (node.symbol()) {
            case "+", "-" -> Math.max(left, right);
            case "*" -> saturate((long) left + right);
            case "/" -> right == 0 ? left : NONE;
            case "%" -> left == 0 && right == 0 ? 0 : NONE;
            case "^" -> power(node, left, right);
            default -> NONE;
        };
    }

    @Override
    public Integer visitEquation(EquationNode node) {
        return combine(node.left().accept(this), node.right().accept(this));
    }

    @Override
    public Integer visitInequality(InequalityNode node) {
        return combine(node.left().accept(this), node.right().accept(this));
    }

    private int power(OperatorNode node, int baseDegree, int exponentDegree) {
        if (exponentDegree != 0) {
            return NONE;
        }
        if (baseDegree == 0) {
            return 0;
        }
        if (!Expressions.variables(node.right()).isEmpty()) {
            return NONE;
        }
        double exponent;
        try {
            exponent = ExpressionEvaluator.evaluate(node.right());
        } catch (ComputationException e) {
            return NONE;
        }
        if (!Numbers.isInteger(exponent) || exponent < 0) {
            return NONE;
        }
        return saturate(baseDegree * exponent);
    }

    private static int saturate(double degree) {
        return degree > MAX_TRACKED ? MAX_TRACKED : (int) degree;
    }

    private static int combine(int left, int right) {
        return left == NONE || right == NONE ? NONE : Math.max(left, right);
    }
}
