package com.mathrok.engine.exception;

import com.mathrok.engine.lexer.Span;

import java.util.List;

public class SyntaxException extends MathException {

    public SyntaxException(String message, Span span) {
        super(ErrorType.SYNTAX_ERROR, message, span, List.of());
    }

    public SyntaxException(String message, Span span, List<String> suggestions) {
        super(ErrorType.SYNTAX_ERROR, message, span, suggestions);
    }
}
