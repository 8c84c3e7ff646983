package com.mathrok.engine.ast;

/**
 * One method per node kind; adding a kind to {@link ExprNode} breaks every visitor until it is handled.
 */
public interface ExprVisitor<R> {

    R visitNumber(ExprNode.NumberNode node);

    R visitVariable(ExprNode.VariableNode node);

    R visitFunction(ExprNode.FunctionNode node);

    R visitOperator(ExprNode.OperatorNode node);

    R visitEquation(ExprNode.EquationNode node);

    R visitInequality(ExprNode.InequalityNode node);
}
