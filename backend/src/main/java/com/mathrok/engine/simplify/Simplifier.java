package com.mathrok.engine.simplify;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;
import com.mathrok.engine.ast.ExprVisitor;

import java.util.List;
import java.util.Optional;

/**
 * Bottom-up application of {@link RewriteRule}s until no rule matches.
 * Always returns a new tree; the input is never modified.
 */
public class Simplifier implements ExprVisitor<ExprNode> {

    private static final int MAX_PASSES = 32;

    private final List<RewriteRule> rules;

    public Simplifier() {
        this(RewriteRules.defaults());
    }

    public Simplifier(List<RewriteRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ExprNode simplify(ExprNode node) {
        return node.accept(this);
    }

    @Override
    public ExprNode visitNumber(NumberNode node) {
        return node;
    }

    @Override
    public ExprNode visitVariable(VariableNode node) {
        return node;
    }

    @Override
    public ExprNode visitFunction(FunctionNode node) {
        return rewrite(new FunctionNode(node.name(), node.args().stream().map(arg -> arg.accept(this)).toList(),
                node.span()));
    }

    @Override
    public ExprNode visitOperator(OperatorNode node) {
        return rewrite(new OperatorNode(node.symbol(), node.operands().stream().map(op -> op.accept(this)).toList(),
                node.precedence(), node.associativity(), node.span()));
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

    private ExprNode rewrite(ExprNode node) {
        ExprNode current = node;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            Optional<ExprNode> rewritten = applyFirst(current);
            if (rewritten.isEmpty()) {
                return current;
            }
            current = rewritten.get();
        }
        return current;
    }

    private Optional<ExprNode> applyFirst(ExprNode node) {
        for (RewriteRule rule : rules) {
            Optional<ExprNode> rewritten = rule.rewrite(node);
            if (rewritten.isPresent()) {
                return rewritten;
            }
        }
        return Optional.empty();
    }
}
