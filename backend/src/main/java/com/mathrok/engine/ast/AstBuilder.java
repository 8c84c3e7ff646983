package com.mathrok.engine.ast;

import com.mathrok.engine.ast.ExprNode.EquationNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.InequalityNode;
import com.mathrok.engine.ast.ExprNode.NumberNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExprNode.VariableNode;
import com.mathrok.engine.exception.ParseException;
import com.mathrok.engine.exception.SyntaxException;
import com.mathrok.engine.lexer.Span;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser over a token list. One method per grammar level, lowest binding first:
 *
 * <pre>
 * expression     := comparison ( "=" comparison )*
 * comparison     := addition ( ( "<" | ">" | "<=" | ">=" | "!=" ) addition )*
 * addition       := multiplication ( ( "+" | "-" ) multiplication )*
 * multiplication := unary ( ( "*" | "/" | "%" ) unary )*
 * unary          := ( "+" | "-" ) unary | exponentiation
 * exponentiation := postfix ( ( "^" | "**" ) unary )?
 * postfix        := primary "!"*
 * primary        := NUMBER | VARIABLE | FUNCTION "(" arguments? ")" | "(" expression ")" | "[" expression "]"
 * </pre>
 *
 * Unary minus binds looser than exponentiation, so {@code -2^2} is {@code -(2^2)}.
 */
public class AstBuilder {

    private final List<Token> tokens;
    private int current = 0;

    public AstBuilder(List<Token> tokens) {
        this.tokens = tokens;
    }

    public ExprNode build() {
        current = 0;
        if (tokens.isEmpty() || (tokens.size() == 1 && tokens.get(0).is(TokenKind.EOF))) {
            throw ParseException.emptyExpression();
        }

        ExprNode ast = expression();

        if (!isAtEnd()) {
            Token token = peek();
            throw new SyntaxException("Unexpected token '" + token.text() + "' at position " + token.span().start(),
                    token.span(), List.of("Remove '" + token.text() + "' or add an operator before it"));
        }

        return ast;
    }

    private ExprNode expression() {
        ExprNode expr = comparison();

        while (match(TokenKind.EQUALS)) {
            ExprNode right = comparison();
            expr = new EquationNode(expr, right, Span.covering(expr.span(), right.span()));
        }

        return expr;
    }

    private ExprNode comparison() {
        ExprNode expr = addition();

        while (match(TokenKind.COMPARISON)) {
            Token operator = previous();
            ExprNode right = addition();
            expr = new InequalityNode(operator.text(), expr, right, Span.covering(expr.span(), right.span()));
        }

        return expr;
    }

    private ExprNode addition() {
        ExprNode expr = multiplication();

        while (checkOperator("+") || checkOperator("-")) {
            Token operator = advance();
            ExprNode right = multiplication();
            expr = binary(operator.text(), expr, right);
        }

        return expr;
    }

    private ExprNode multiplication() {
        ExprNode expr = unary();

        while (checkOperator("*") || checkOperator("/") || checkOperator("%")) {
            Token operator = advance();
            ExprNode right = unary();
            expr = binary(operator.text(), expr, right);
        }

        return expr;
    }

    private ExprNode unary() {
        if (checkOperator("+") || checkOperator("-")) {
            Token operator = advance();
            ExprNode operand = unary();
            String symbol = "u" + operator.text();
            return new OperatorNode(symbol, List.of(operand), Operators.UNARY, Associativity.RIGHT,
                    Span.covering(operator.span(), operand.span()));
        }

        return exponentiation();
    }

    private ExprNode exponentiation() {
        ExprNode base = postfix();

        if (checkOperator("^") || checkOperator("**")) {
            advance();
            // right operand re-enters unary, which recurses back here: 2^3^2 = 2^(3^2)
            ExprNode exponent = unary();
            return binary(Operators.POWER, base, exponent);
        }

        return base;
    }

    private ExprNode postfix() {
        ExprNode expr = primary();

        while (checkOperator("!")) {
            Token operator = advance();
            expr = new OperatorNode(Operators.FACTORIAL, List.of(expr), Operators.POSTFIX, Associativity.LEFT,
                    Span.covering(expr.span(), operator.span()));
        }

        return expr;
    }

    private ExprNode primary() {
        if (match(TokenKind.NUMBER)) {
            Token token = previous();
            return new NumberNode(Double.parseDouble(token.text()), token.span());
        }

        if (match(TokenKind.VARIABLE)) {
            Token token = previous();
            return new VariableNode(token.text(), token.span());
        }

        if (match(TokenKind.FUNCTION)) {
            return functionCall(previous());
        }

        if (match(TokenKind.LEFT_PAREN)) {
            ExprNode expr = expression();
            consume(TokenKind.RIGHT_PAREN, "Expected ')' after expression");
            return expr;
        }

        if (match(TokenKind.LEFT_BRACKET)) {
            ExprNode expr = expression();
            consume(TokenKind.RIGHT_BRACKET, "Expected ']' after expression");
            return expr;
        }

        Token token = peek();
        if (token.is(TokenKind.EOF)) {
            throw new SyntaxException("Unexpected end of expression", token.span(),
                    List.of("Complete the expression after the last operator"));
        }
        throw new SyntaxException("Unexpected token '" + token.text() + "' at position " + token.span().start(),
                token.span());
    }

    private ExprNode functionCall(Token name) {
        if (!check(TokenKind.LEFT_PAREN)) {
            throw new SyntaxException("Expected '(' after function name: " + name.text(), name.span(),
                    List.of("Add parentheses: " + name.text() + "(...)"));
        }
        advance();

        List<ExprNode> args = new ArrayList<>();
        if (!check(TokenKind.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenKind.COMMA));
        }

        Token closing = consume(TokenKind.RIGHT_PAREN, "Expected ')' after function arguments");
        return new FunctionNode(name.text(), args, Span.covering(name.span(), closing.span()));
    }

    private OperatorNode binary(String symbol, ExprNode left, ExprNode right) {
        return new OperatorNode(symbol, List.of(left, right), Operators.precedenceOf(symbol),
                Operators.associativityOf(symbol), Span.covering(left.span(), right.span()));
    }

    private boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenKind kind) {
        if (isAtEnd()) {
            return false;
        }
        return peek().is(kind);
    }

    private boolean checkOperator(String symbol) {
        return !isAtEnd() && peek().isOperator(symbol);
    }

    private Token consume(TokenKind kind, String message) {
        if (check(kind)) {
            return advance();
        }
        Token token = peek();
        throw new SyntaxException(message + " at position " + token.span().start(), token.span());
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() || tokens.get(current).is(TokenKind.EOF);
    }

    private Token peek() {
        if (current >= tokens.size()) {
            Token last = tokens.get(tokens.size() - 1);
            return new Token(TokenKind.EOF, "", new Span(last.span().end(), last.span().end()), last.line(),
                    last.column());
        }
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
