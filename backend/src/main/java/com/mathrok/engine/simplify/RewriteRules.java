package com.mathrok.engine.simplify;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExpressionEvaluator;
import com.mathrok.engine.ast.Operators;

import java.util.List;
import java.util.Optional;

/**
 * The structural identities the simplifier knows. This is not a general algebra system:
 * every rule looks at one operator node and its direct operands.
 */
public final class RewriteRules {

    public static final RewriteRule ADDITIVE_IDENTITY = RewriteRule.of("additive-identity", node -> {
        if (!(node instanceof OperatorNode op) || op.isUnary()) {
            return Optional.empty();
        }
        if ("+".equals(op.symbol())) {
            if (isNumber(op.right(), 0)) {
                return Optional.of(op.left());
            }
            if (isNumber(op.left(), 0)) {
                return Optional.of(op.right());
            }
        }
        if ("-".equals(op.symbol()) && isNumber(op.right(), 0)) {
            return Optional.of(op.left());
        }
        return Optional.empty();
    });

    public static final RewriteRule MULTIPLICATIVE_IDENTITY = RewriteRule.of("multiplicative-identity", node -> {
        if (!(node instanceof OperatorNode op) || op.isUnary()) {
            return Optional.empty();
        }
        if ("*".equals(op.symbol())) {
            if (isNumber(op.right(), 1)) {
                return Optional.of(op.left());
            }
            if (isNumber(op.left(), 1)) {
                return Optional.of(op.right());
            }
        }
        if ("/".equals(op.symbol()) && isNumber(op.right(), 1)) {
            return Optional.of(op.left());
        }
        return Optional.empty();
    });

    public static final RewriteRule ZERO_PRODUCT = RewriteRule.of("zero-product", node -> {
        if (node instanceof OperatorNode op && !op.isUnary() && "*".equals(op.symbol())
                && (isNumber(op.left(), 0) || isNumber(op.right(), 0))) {
            return Optional.of(ExprNode.number(0));
        }
        return Optional.empty();
    });

    public static final RewriteRule POWER_IDENTITY = RewriteRule.of("power-identity", node -> {
        if (node instanceof OperatorNode op && !op.isUnary() && Operators.POWER.equals(op.symbol())) {
            if (isNumber(op.right(), 1)) {
                return Optional.of(op.left());
            }
            if (isNumber(op.right(), 0)) {
                return Optional.of(ExprNode.number(1));
            }
        }
        return Optional.empty();
    });

    public static final RewriteRule DOUBLE_NEGATION = RewriteRule.of("double-negation", node -> {
        if (node instanceof OperatorNode outer && outer.isUnary() && Operators.UNARY_MINUS.equals(outer.symbol())
                && outer.left() instanceof OperatorNode inner && inner.isUnary()
                && Operators.UNARY_MINUS.equals(inner.symbol())) {
            return Optional.of(inner.left());
        }
        return Optional.empty();
    });

    public static final RewriteRule UNARY_PLUS = RewriteRule.of("unary-plus", node -> {
        if (node instanceof OperatorNode op && op.isUnary() && Operators.UNARY_PLUS.equals(op.symbol())) {
            return Optional.of(op.left());
        }
        return Optional.empty();
    });

    /**
     * Folds an operator whose operands are all literal numbers, unless the result is not finite.
     */
    public static final RewriteRule CONSTANT_FOLDING = RewriteRule.of("constant-folding", node -> {
        if (!(node instanceof OperatorNode op)) {
            return Optional.empty();
        }
        for (ExprNode operand : op.operands()) {
            if (!(operand instanceof NumberNode)) {
                return Optional.empty();
            }
        }
        double value = ExpressionEvaluator.evaluate(op);
        if (!Double.isFinite(value)) {
            return Optional.empty();
        }
        return Optional.of(new NumberNode(value, op.span()));
    });

    private RewriteRules() {
    }

    public static List<RewriteRule> defaults() {
        return List.of(
                CONSTANT_FOLDING,
                ADDITIVE_IDENTITY,
                MULTIPLICATIVE_IDENTITY,
                ZERO_PRODUCT,
                POWER_IDENTITY,
                DOUBLE_NEGATION,
                UNARY_PLUS);
    }

    private static boolean isNumber(ExprNode node, double value) {
        return node instanceof NumberNode number && number.value() == value;
    }
}
