package com.mathrok.engine.ast;

import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;
import com.mathrok.engine.lexer.MathFunctions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Queries and rewrites over expression trees.
 */
public final class Expressions {

    private static final double MAX_COMPLEXITY = 100;

    private Expressions() {
    }

    /**
     * Variable names in order of first appearance, reserved constants excluded.
     */
    public static List<String> variables(ExprNode node) {
        Set<String> names = new LinkedHashSet<>();
        collect(node, n -> n instanceof VariableNode v && !MathFunctions.isConstant(v.name()),
                n -> names.add(((VariableNode) n).name()));
        return List.copyOf(names);
    }

    public static List<String> functions(ExprNode node) {
        Set<String> names = new LinkedHashSet<>();
        collect(node, n -> n instanceof FunctionNode, n -> names.add(((FunctionNode) n).name()));
        return List.copyOf(names);
    }

    public static boolean containsVariable(ExprNode node, String name) {
        return anyMatch(node, n -> n instanceof VariableNode v && v.name().equals(name));
    }

    public static boolean anyMatch(ExprNode node, Predicate<ExprNode> predicate) {
        if (predicate.test(node)) {
            return true;
        }
        for (ExprNode child : node.children()) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static List<ExprNode> findAll(ExprNode node, Predicate<ExprNode> predicate) {
        List<ExprNode> found = new ArrayList<>();
        collect(node, predicate, found::add);
        return found;
    }

    /**
     * Weighted node count: numbers 0.5, variables 1, operators 1.5, functions 2, relations 3; capped at 100.
     */
    public static double complexity(ExprNode node) {
        return Math.min(MAX_COMPLEXITY, rawComplexity(node));
    }

    private static double rawComplexity(ExprNode node) {
        double own;
        if (node instanceof NumberNode) {
            own = 0.5;
        } else if (node instanceof VariableNode) {
            own = 1;
        } else if (node instanceof OperatorNode) {
            own = 1.5;
        } else if (node instanceof FunctionNode) {
            own = 2;
        } else {
            own = 3;
        }
        for (ExprNode child : node.children()) {
            own += rawComplexity(child);
        }
        return own;
    }

    /**
     * Returns a new tree in which every variable named in {@code replacements} is replaced.
     */
    public static ExprNode substitute(ExprNode node, Map<String, ExprNode> replacements) {
        return node.accept(new Substitution(replacements));
    }

    public static ExprNode bindNumbers(ExprNode node, Map<String, Double> values) {
        Map<String, ExprNode> replacements = new HashMap<>();
        values.forEach((name, value) -> replacements.put(name, ExprNode.number(value)));
        return substitute(node, replacements);
    }

    /**
     * Rewrites {@code lhs = rhs} as the single expression {@code lhs - rhs}; other nodes are returned as is.
     */
    public static ExprNode toZeroForm(ExprNode node) {
        if (node instanceof EquationNode equation) {
            if (equation.right() instanceof NumberNode number && number.value() == 0) {
                return equation.left();
            }
            return ExprNode.binary("-", equation.left(), equation.right());
        }
        return node;
    }

    private static void collect(ExprNode node, Predicate<ExprNode> predicate,
            Consumer<ExprNode> sink) {
        if (predicate.test(node)) {
            sink.accept(node);
        }
        for (ExprNode child : node.children()) {
            collect(child, predicate, sink);
        }
    }

    private static final class Substitution implements ExprVisitor<ExprNode> {

        private final Map<String, ExprNode> replacements;

        Substitution(Map<String, ExprNode> replacements) {
            this.replacements = replacements;
        }

        @Override
        public ExprNode visitNumber(NumberNode node) {
            return node;
        }

        @Override
        public ExprNode visitVariable(VariableNode node) {
            return replacements.getOrDefault(node.name(), node);
        }

        @Override
        public ExprNode visitFunction(FunctionNode node) {
            return new FunctionNode(node.name(), node.args().stream().map(arg -> arg.accept(this)).toList(),
                    node.span());
        }

        @Override
        public ExprNode visitOperator(OperatorNode node) {
            return new OperatorNode(node.symbol(), node.operands().stream().map(op -> op.accept(this)).toList(),
                    node.precedence(), node.associativity(), node.span());
        }

        @Override
        public ExprNode visitEquation(EquationNode node) {
            return new EquationNode(node.left().accept(this), node.right().accept(this), node.span());
        }

        @Override
        public ExprNode visitInequality(InequalityNode node) {
            return new InequalityNode(node.operator(), node.left().accept(this), node.right().accept(this),
                    node.span());
        }
    }
}
