package com.mathrok.engine.lexer;

/**
 * Half-open character range {@code [start, end)} in the normalized source.
 */
public record Span(int start, int end) {

    public static final Span NONE = new Span(0, 0);

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static Span covering(Span first, Span last) {
        return new Span(Math.min(first.start, last.start), Math.max(first.end, last.end));
    }

    public int length() {
        return end - start;
    }
}
