package com.mathrok.engine.solver;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;
import com.mathrok.engine.ast.ExprVisitor;
import com.mathrok.engine.ast.ExpressionEvaluator;
import com.mathrok.engine.ast.ExpressionPrinter;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.ast.Numbers;
import com.mathrok.engine.ast.Operators;
import com.mathrok.engine.exception.ComputationException;
import com.mathrok.engine.exception.DegreeMismatchException;

import java.util.List;

/**
 * Reads the coefficients of {@code lhs - rhs} as a polynomial in one variable.
 * <p>
 * Subtrees free of the variable are evaluated numerically, so every other name must already be bound.
 * Terms that are not polynomial in the variable (functions of it, non-integer or variable exponents,
 * division by it) raise {@link ComputationException}.
 */
public class PolynomialExtractor implements ExprVisitor<Polynomial> {

    /**
     * Above this the dense representation stops being reasonable.
     */
    public static final int MAX_DEGREE = 64;

    private final String variable;

    private PolynomialExtractor(String variable) {
        this.variable = variable;
    }

    public static Polynomial extract(ExprNode equation, String variable) {
        return Expressions.toZeroForm(equation).accept(new PolynomialExtractor(variable));
    }

    public static Polynomial extract(ExprNode equation, String variable, int maxDegree) {
        Polynomial polynomial = extract(equation, variable);
        if (polynomial.degree() > maxDegree) {
            throw new DegreeMismatchException(variable, maxDegree, polynomial.degree());
        }
        return polynomial;
    }

    /**
     * @return {@code {a, b}} of {@code a·x + b = 0}
     */
    public static double[] extractLinear(ExprNode equation, String variable) {
        Polynomial p = extract(equation, variable, 1);
        return new double[] {p.coefficient(1), p.coefficient(0)};
    }

    /**
     * @return {@code {a, b, c}} of {@code a·x² + b·x + c = 0}
     */
    public static double[] extractQuadratic(ExprNode equation, String variable) {
        Polynomial p = extract(equation, variable, 2);
        return new double[] {p.coefficient(2), p.coefficient(1), p.coefficient(0)};
    }

    @Override
    public Polynomial visitNumber(NumberNode node) {
        return Polynomial.constant(variable, node.value());
    }

    @Override
    public Polynomial visitVariable(VariableNode node) {
        if (node.name().equals(variable)) {
            return Polynomial.monomial(variable, 1);
        }
        return constant(node);
    }

    @Override
    public Polynomial visitFunction(FunctionNode node) {
        if (Expressions.containsVariable(node, variable)) {
            throw nonPolynomial(node);
        }
        return constant(node);
    }

    @Override
    public Polynomial visitOperator(OperatorNode node) {
        if (!Expressions.containsVariable(node, variable)) {
            return constant(node);
        }

        if (node.isUnary()) {
            return switch (node.symbol()) {
                case Operators.UNARY_MINUS -> node.left().accept(this).negate();
                case Operators.UNARY_PLUS -> node.left().accept(this);
                default -> throw nonPolynomial(node);
            };
        }

        return switch (node.symbol()) {
            case "+" -> node.left().accept(this).plus(node.right().accept(this));
            case "-" -> node.left().accept(this).minus(node.right().accept(this));
            case "*" -> checked(node.left().accept(this).times(node.right().accept(this)));
            case "/" -> divide(node);
            case "^" -> power(node);
            default -> throw nonPolynomial(node);
        };
    }

    @Override
    public Polynomial visitEquation(EquationNode node) {
        return node.left().accept(this).minus(node.right().accept(this));
    }

    @Override
    public Polynomial visitInequality(InequalityNode node) {
        throw new ComputationException("Inequalities have no polynomial form",
                List.of("Rewrite the relation as an equation"));
    }

    private Polynomial divide(OperatorNode node) {
        if (Expressions.containsVariable(node.right(), variable)) {
            throw nonPolynomial(node);
        }
        double divisor = evaluate(node.right());
        if (divisor == 0) {
            throw new ComputationException("Division by zero in " + ExpressionPrinter.print(node));
        }
        return node.left().accept(this).scale(1 / divisor);
    }

    private Polynomial power(OperatorNode node) {
        if (Expressions.containsVariable(node.right(), variable)) {
            throw nonPolynomial(node);
        }
        double exponent = evaluate(node.right());
        if (!Numbers.isInteger(exponent) || exponent < 0) {
            throw nonPolynomial(node);
        }
        Polynomial base = node.left().accept(this);
        if (base.degree() * exponent > MAX_DEGREE) {
            throw new ComputationException("Power " + ExpressionPrinter.print(node) + " is too large to expand");
        }
        return base.pow((int) exponent);
    }

    private Polynomial checked(Polynomial polynomial) {
        if (polynomial.degree() > MAX_DEGREE) {
            throw new ComputationException("Polynomial degree " + polynomial.degree() + " is too large to expand");
        }
        return polynomial;
    }

    private Polynomial constant(ExprNode node) {
        return Polynomial.constant(variable, evaluate(node));
    }

    private static double evaluate(ExprNode node) {
        double value = ExpressionEvaluator.evaluate(node);
        if (!Double.isFinite(value)) {
            throw new ComputationException("Term " + ExpressionPrinter.print(node) + " has no finite value");
        }
        return value;
    }

    private ComputationException nonPolynomial(ExprNode node) {
        return new ComputationException("Term " + ExpressionPrinter.print(node) + " is not polynomial in " + variable);
    }
}
