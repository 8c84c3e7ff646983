package com.mathrok.engine.ast;

import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;

import java.util.stream.Collectors;

/**
 * Prints a tree back to infix text, adding parentheses only where binding power requires them.
 */
public class ExpressionPrinter implements ExprVisitor<String> {

    private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    public static String print(ExprNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitNumber(NumberNode node) {
        return Numbers.format(node.value());
    }

    @Override
    public String visitVariable(VariableNode node) {
        return node.name();
    }

    @Override
    public String visitFunction(FunctionNode node) {
        return node.name() + "(" + node.args().stream()
                .map(arg -> arg.accept(this))
                .collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String visitOperator(OperatorNode node) {
        if (node.isUnary()) {
            ExprNode operand = node.left();
            if (Operators.FACTORIAL.equals(node.symbol())) {
                return wrap(operand, needsParens(operand, Operators.POSTFIX)) + "!";
            }
            boolean parens = needsParens(operand, Operators.UNARY) || isUnaryOperator(operand)
                    || isNegativeNumber(operand);
            return Operators.display(node.symbol()) + wrap(operand, parens);
        }

        String symbol = node.symbol();
        int precedence = node.precedence();
        ExprNode left = node.left();
        ExprNode right = node.right();

        boolean leftParens = needsParens(left, precedence)
                || (precedence == Operators.EXPONENT && bindsAtMost(left, Operators.EXPONENT));
        boolean rightParens = needsParens(right, precedence)
                || (isNonAssociative(symbol) && bindsAtMost(right, precedence))
                || isNegativeNumber(right);

        String leftText = wrap(left, leftParens);
        String rightText = wrap(right, rightParens);

        return switch (symbol) {
            case "+", "-", "%" -> leftText + " " + symbol + " " + rightText;
            default -> leftText + symbol + rightText;
        };
    }

    @Override
    public String visitEquation(EquationNode node) {
        return node.left().accept(this) + " = " + node.right().accept(this);
    }

    @Override
    public String visitInequality(InequalityNode node) {
        return node.left().accept(this) + " " + node.operator() + " " + node.right().accept(this);
    }

    private String wrap(ExprNode node, boolean parens) {
        String text = node.accept(this);
        return parens ? "(" + text + ")" : text;
    }

    private static boolean needsParens(ExprNode child, int parentPrecedence) {
        if (child instanceof OperatorNode operator) {
            return operator.precedence() < parentPrecedence;
        }
        if (child instanceof EquationNode || child instanceof InequalityNode) {
            return true;
        }
        return parentPrecedence >= Operators.EXPONENT && isNegativeNumber(child);
    }

    private static boolean bindsAtMost(ExprNode child, int precedence) {
        return child instanceof OperatorNode operator && operator.precedence() <= precedence;
    }

    private static boolean isNonAssociative(String symbol) {
        return "-".equals(symbol) || "/".equals(symbol) || "%".equals(symbol);
    }

    private static boolean isUnaryOperator(ExprNode node) {
        return node instanceof OperatorNode operator && operator.isUnary()
                && !Operators.FACTORIAL.equals(operator.symbol());
    }

    private static boolean isNegativeNumber(ExprNode node) {
        return node instanceof NumberNode number && number.value() < 0;
    }
}
