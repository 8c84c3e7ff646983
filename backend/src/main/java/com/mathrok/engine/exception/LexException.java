package com.mathrok.engine.exception;

import com.mathrok.engine.lexer.Span;

import java.util.List;

public class LexException extends MathException {

    public LexException(String message, Span span) {
        super(ErrorType.LEX_ERROR, message, span, List.of("Check the characters around position " + span.start()));
    }

    public int getPosition() {
        return getSpan().start();
    }
}
