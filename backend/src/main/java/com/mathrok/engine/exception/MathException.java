package com.mathrok.engine.exception;

import com.mathrok.engine.lexer.Span;

import java.util.List;

/**
 * Base of every failure raised by the parsing and solving pipeline.
 */
public abstract class MathException extends RuntimeException {

    private final ErrorType type;
    private final Span span;
    private final List<String> suggestions;

    protected MathException(ErrorType type, String message, Span span, List<String> suggestions) {
        super(message);
        this.type = type;
        this.span = span;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    protected MathException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.span = null;
        this.suggestions = List.of();
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * Source range the failure refers to, or {@code null} when it is not tied to a position.
     */
    public Span getSpan() {
        return span;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }
}
