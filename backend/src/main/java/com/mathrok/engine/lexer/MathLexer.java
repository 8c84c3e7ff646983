package com.mathrok.engine.lexer;

import com.mathrok.engine.exception.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scans an expression into a flat token list terminated by {@link TokenKind#EOF}.
 * <p>
 * A lexer instance is bound to one source string and is not shared between calls.
 */
public class MathLexer {

    private final String source;
    private final Set<String> customFunctions;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    public MathLexer(String source) {
        this(source, Set.of());
    }

    public MathLexer(String source, Set<String> customFunctions) {
        this.source = source == null ? "" : source;
        this.customFunctions = customFunctions;
    }

    public List<Token> tokenize() {
        tokens.clear();
        current = 0;
        line = 1;
        column = 1;

        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenKind.EOF, "", new Span(current, current), line, column));
        return List.copyOf(tokens);
    }

    public static boolean isFunctionName(String name, Set<String> customFunctions) {
        String lower = name.toLowerCase(Locale.ROOT);
        return MathFunctions.BUILTIN.contains(lower) || customFunctions.contains(lower);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r' -> {
                // skipped
            }
            case '\n' -> {
                line++;
                column = 1;
            }
            case '(' -> addToken(TokenKind.LEFT_PAREN);
            case ')' -> addToken(TokenKind.RIGHT_PAREN);
            case '[' -> addToken(TokenKind.LEFT_BRACKET);
            case ']' -> addToken(TokenKind.RIGHT_BRACKET);
            case ',' -> addToken(TokenKind.COMMA);
            case '=' -> {
                match('=');
                addToken(TokenKind.EQUALS);
            }
            case '<', '>' -> {
                match('=');
                addToken(TokenKind.COMPARISON);
            }
            case '!' -> addToken(match('=') ? TokenKind.COMPARISON : TokenKind.OPERATOR);
            case '*' -> {
                match('*');
                addToken(TokenKind.OPERATOR);
            }
            case '+', '-', '/', '^', '%' -> addToken(TokenKind.OPERATOR);
            default -> {
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw new LexException("Unexpected character '" + c + "' at position " + start,
                            new Span(start, current));
                }
            }
        }
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }

        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (!isDigit(peek())) {
                throw new LexException("Invalid scientific notation: exponent digits expected at position " + current,
                        new Span(start, current));
            }
            while (isDigit(peek())) {
                advance();
            }
        }

        addToken(TokenKind.NUMBER);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }

        String text = source.substring(start, current);
        addToken(isFunctionName(text, customFunctions) ? TokenKind.FUNCTION : TokenKind.VARIABLE);
    }

    private void addToken(TokenKind kind) {
        String text = source.substring(start, current);
        tokens.add(new Token(kind, text, new Span(start, current), startLine, startColumn));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        column++;
        return true;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
