package com.mathrok.engine.ast;

import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;
import com.mathrok.engine.exception.ComputationException;
import com.mathrok.engine.lexer.MathFunctions;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Numeric evaluation of an expression tree in double precision.
 * <p>
 * Domain violations such as {@code sqrt(-1)} yield {@code NaN}; unbound variables, relations and
 * functions that need a symbolic backend raise {@link ComputationException}.
 */
public class ExpressionEvaluator implements ExprVisitor<Double> {

    private static final double[] LANCZOS = {
            0.99999999999980993, 676.5203681218851, -1259.1392167224028,
            771.32342877765313, -176.61502916214059, 12.507343278686905,
            -0.13857109526572012, 9.9843695780195716e-6, 1.5056327351493116e-7
    };

    private final Map<String, Double> bindings;

    public ExpressionEvaluator(Map<String, Double> bindings) {
        this.bindings = bindings;
    }

    public static double evaluate(ExprNode node) {
        return evaluate(node, Map.of());
    }

    public static double evaluate(ExprNode node, Map<String, Double> bindings) {
        return node.accept(new ExpressionEvaluator(bindings));
    }

    @Override
    public Double visitNumber(NumberNode node) {
        return node.value();
    }

    @Override
    public Double visitVariable(VariableNode node) {
        Double bound = bindings.get(node.name());
        if (bound != null) {
            return bound;
        }
        Double constant = MathFunctions.CONSTANTS.get(node.name().toLowerCase(Locale.ROOT));
        if (constant != null) {
            return constant;
        }
        throw new ComputationException("Variable '" + node.name() + "' has no value",
                List.of("Bind '" + node.name() + "' to a number or solve for it"));
    }

    @Override
    public Double visitFunction(FunctionNode node) {
        List<ExprNode> argNodes = node.args();
        double[] args = new double[argNodes.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = argNodes.get(i).accept(this);
        }
        return apply(node.name().toLowerCase(Locale.ROOT), args);
    }

    @Override
    public Double visitOperator(OperatorNode node) {
        if (node.isUnary()) {
            double operand = node.left().accept(this);
            return switch (node.symbol()) {
                case Operators.UNARY_MINUS -> -operand;
                case Operators.UNARY_PLUS -> operand;
                case Operators.FACTORIAL -> factorial(operand);
                default -> throw new ComputationException("Unknown unary operator: " + node.symbol());
            };
        }

        double left = node.left().accept(this);
        double right = node.right().accept(this);
        return switch (node.symbol()) {
            case "+" -> left + right;
            case "-" -> left - right;
            case "*" -> left * right;
            case "/" -> left / right;
            case "%" -> left % right;
            case "^", "**" -> Math.pow(left, right);
            default -> throw new ComputationException("Unknown operator: " + node.symbol());
        };
    }

    @Override
    public Double visitEquation(EquationNode node) {
        throw new ComputationException("An equation has no numeric value; evaluate one side or solve it");
    }

    @Override
    public Double visitInequality(InequalityNode node) {
        throw new ComputationException("An inequality has no numeric value");
    }

    private static double apply(String name, double[] args) {
        return switch (name) {
            case "sin" -> Math.sin(arg(name, args));
            case "cos" -> Math.cos(arg(name, args));
            case "tan" -> Math.tan(arg(name, args));
            case "cot" -> 1 / Math.tan(arg(name, args));
            case "sec" -> 1 / Math.cos(arg(name, args));
            case "csc" -> 1 / Math.sin(arg(name, args));
            case "asin" -> Math.asin(arg(name, args));
            case "acos" -> Math.acos(arg(name, args));
            case "atan" -> args.length == 2 ? Math.atan2(args[0], args[1]) : Math.atan(arg(name, args));
            case "acot" -> Math.atan(1 / arg(name, args));
            case "asec" -> Math.acos(1 / arg(name, args));
            case "acsc" -> Math.asin(1 / arg(name, args));
            case "sinh" -> Math.sinh(arg(name, args));
            case "cosh" -> Math.cosh(arg(name, args));
            case "tanh" -> Math.tanh(arg(name, args));
            case "coth" -> 1 / Math.tanh(arg(name, args));
            case "sech" -> 1 / Math.cosh(arg(name, args));
            case "csch" -> 1 / Math.sinh(arg(name, args));
            case "asinh" -> asinh(arg(name, args));
            case "acosh" -> acosh(arg(name, args));
            case "atanh" -> atanh(arg(name, args));
            case "acoth" -> atanh(1 / arg(name, args));
            case "asech" -> acosh(1 / arg(name, args));
            case "acsch" -> asinh(1 / arg(name, args));
            case "ln" -> Math.log(arg(name, args));
            case "log" -> args.length == 2 ? Math.log(args[0]) / Math.log(args[1]) : Math.log(arg(name, args));
            case "log10" -> Math.log10(arg(name, args));
            case "log2" -> Math.log(arg(name, args)) / Math.log(2);
            case "exp" -> Math.exp(arg(name, args));
            case "sqrt" -> Math.sqrt(arg(name, args));
            case "cbrt" -> Math.cbrt(arg(name, args));
            case "abs" -> Math.abs(arg(name, args));
            case "floor" -> Math.floor(arg(name, args));
            case "ceil" -> Math.ceil(arg(name, args));
            case "round" -> (double) Math.round(arg(name, args));
            case "sign" -> Math.signum(arg(name, args));
            case "min" -> reduce(name, args, Math::min);
            case "max" -> reduce(name, args, Math::max);
            case "gcd" -> reduce(name, args, (a, b) -> (double) Numbers.gcd(Math.abs((long) a), Math.abs((long) b)));
            case "lcm" -> reduce(name, args, (a, b) -> Math.abs((long) a * (long) b)
                    / (double) Numbers.gcd(Math.abs((long) a), Math.abs((long) b)));
            case "factorial" -> factorial(arg(name, args));
            case "gamma" -> gamma(arg(name, args));
            case "beta" -> {
                requireArity(name, args, 2);
                yield gamma(args[0]) * gamma(args[1]) / gamma(args[0] + args[1]);
            }
            case "erf" -> erf(arg(name, args));
            case "erfc" -> 1 - erf(arg(name, args));
            default -> throw new ComputationException("Function '" + name + "' cannot be evaluated numerically",
                    List.of("Register a symbolic backend that supports '" + name + "'"));
        };
    }

    private static double arg(String name, double[] args) {
        requireArity(name, args, 1);
        return args[0];
    }

    private static void requireArity(String name, double[] args, int arity) {
        if (args.length != arity) {
            throw new ComputationException(name + " expects " + arity + " argument(s), got " + args.length);
        }
    }

    private static double reduce(String name, double[] args, DoubleBinaryOperator op) {
        if (args.length == 0) {
            throw new ComputationException(name + " expects at least one argument");
        }
        double result = args[0];
        for (int i = 1; i < args.length; i++) {
            result = op.applyAsDouble(result, args[i]);
        }
        return result;
    }

    static double factorial(double n) {
        if (Numbers.isInteger(n) && n >= 0 && n <= 170) {
            double result = 1;
            for (int i = 2; i <= (int) n; i++) {
                result *= i;
            }
            return result;
        }
        return gamma(n + 1);
    }

    static double gamma(double x) {
        if (x < 0.5) {
            return Math.PI / (Math.sin(Math.PI * x) * gamma(1 - x));
        }
        x -= 1;
        double a = LANCZOS[0];
        double t = x + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            a += LANCZOS[i] / (x + i);
        }
        return Math.sqrt(2 * Math.PI) * Math.pow(t, x + 0.5) * Math.exp(-t) * a;
    }

    // Abramowitz and Stegun 7.1.26, absolute error below 1.5e-7
    static double erf(double x) {
        double sign = Math.signum(x);
        double ax = Math.abs(x);
        double t = 1 / (1 + 0.3275911 * ax);
        double y = 1 - (((((1.061405429 * t - 1.453152027) * t) + 1.421413741) * t - 0.284496736) * t
                + 0.254829592) * t * Math.exp(-ax * ax);
        return sign * y;
    }

    private static double asinh(double x) {
        return Math.log(x + Math.sqrt(x * x + 1));
    }

    private static double acosh(double x) {
        return Math.log(x + Math.sqrt(x * x - 1));
    }

    private static double atanh(double x) {
        return 0.5 * Math.log((1 + x) / (1 - x));
    }
}
