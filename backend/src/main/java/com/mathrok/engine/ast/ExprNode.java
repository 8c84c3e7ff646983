package com.mathrok.engine.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.mathrok.engine.lexer.Span;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree. Each node owns its children; rewriting always builds new nodes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExprNode.NumberNode.class, name = "number"),
        @JsonSubTypes.Type(value = ExprNode.VariableNode.class, name = "variable"),
        @JsonSubTypes.Type(value = ExprNode.FunctionNode.class, name = "function"),
        @JsonSubTypes.Type(value = ExprNode.OperatorNode.class, name = "operator"),
        @JsonSubTypes.Type(value = ExprNode.EquationNode.class, name = "equation"),
        @JsonSubTypes.Type(value = ExprNode.InequalityNode.class, name = "inequality")
})
public sealed interface ExprNode {

    Span span();

    <R> R accept(ExprVisitor<R> visitor);

    @JsonIgnore
    default List<ExprNode> children() {
        return List.of();
    }

    record NumberNode(double value, Span span) implements ExprNode {

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record VariableNode(String name, Span span) implements ExprNode {

        public VariableNode {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    record FunctionNode(String name, List<ExprNode> args, Span span) implements ExprNode {

        public FunctionNode {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public List<ExprNode> children() {
            return args;
        }
    }

    record OperatorNode(
            String symbol,
            List<ExprNode> operands,
            int precedence,
            Associativity associativity,
            Span span) implements ExprNode {

        public OperatorNode {
            Objects.requireNonNull(symbol, "symbol");
            operands = List.copyOf(operands);
            if (operands.isEmpty() || operands.size() > 2) {
                throw new IllegalArgumentException("Operator '" + symbol + "' needs one or two operands, got "
                        + operands.size());
            }
        }

        @JsonIgnore
        public boolean isUnary() {
            return operands.size() == 1;
        }

        @JsonIgnore
        public ExprNode left() {
            return operands.get(0);
        }

        @JsonIgnore
        public ExprNode right() {
            return operands.get(operands.size() - 1);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitOperator(this);
        }

        @Override
        public List<ExprNode> children() {
            return operands;
        }
    }

    record EquationNode(ExprNode left, ExprNode right, Span span) implements ExprNode {

        public EquationNode {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitEquation(this);
        }

        @Override
        public List<ExprNode> children() {
            return List.of(left, right);
        }
    }

    record InequalityNode(String operator, ExprNode left, ExprNode right, Span span) implements ExprNode {

        public InequalityNode {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInequality(this);
        }

        @Override
        public List<ExprNode> children() {
            return List.of(left, right);
        }
    }

    static NumberNode number(double value) {
        return new NumberNode(value, Span.NONE);
    }

    static VariableNode variable(String name) {
        return new VariableNode(name, Span.NONE);
    }

    static FunctionNode function(String name, List<ExprNode> args) {
        return new FunctionNode(name, args, Span.NONE);
    }

    static OperatorNode binary(String symbol, ExprNode left, ExprNode right) {
        return new OperatorNode(symbol, List.of(left, right), Operators.precedenceOf(symbol),
                Operators.associativityOf(symbol), Span.covering(left.span(), right.span()));
    }

    static OperatorNode unary(String symbol, ExprNode operand) {
        return new OperatorNode(symbol, List.of(operand), Operators.precedenceOf(symbol),
                Operators.associativityOf(symbol), operand.span());
    }

    static EquationNode equation(ExprNode left, ExprNode right) {
        return new EquationNode(left, right, Span.covering(left.span(), right.span()));
    }
}
