package com.mathrok.engine.lexer;

public record Token(
        TokenKind kind,
        String text,
        Span span,
        int line,
        int column) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String symbol) {
        return kind == TokenKind.OPERATOR && text.equals(symbol);
    }

    @Override
    public String toString() {
        return kind + " '" + text + "' at " + line + ":" + column;
    }
}
