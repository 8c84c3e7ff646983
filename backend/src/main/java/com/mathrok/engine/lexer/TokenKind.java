package com.mathrok.engine.lexer;

public enum TokenKind {
    NUMBER,
    VARIABLE,
    FUNCTION,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    EQUALS,
    COMPARISON,
    EOF
}
