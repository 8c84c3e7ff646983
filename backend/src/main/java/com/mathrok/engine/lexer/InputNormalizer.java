package com.mathrok.engine.lexer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites typographic math symbols to their ASCII form and inserts implicit multiplication tokens.
 */
public final class InputNormalizer {

    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();

    // √x and √2 take the following operand as argument; √(...) keeps its own parentheses
    private static final Pattern RADICAL_OPERAND = Pattern.compile("√\\s*([0-9]+(?:\\.[0-9]+)?|[A-Za-z_][A-Za-z0-9_]*)");

    static {
        SYMBOLS.put("×", "*");
        SYMBOLS.put("·", "*");
        SYMBOLS.put("÷", "/");
        SYMBOLS.put("−", "-");
        SYMBOLS.put("²", "^2");
        SYMBOLS.put("³", "^3");
        SYMBOLS.put("π", "pi");
        SYMBOLS.put("∞", "infinity");
        SYMBOLS.put("≤", "<=");
        SYMBOLS.put("≥", ">=");
        SYMBOLS.put("≠", "!=");
    }

    private InputNormalizer() {
    }

    public static String normalize(String expression) {
        if (expression == null) {
            return "";
        }

        String normalized = expression.replace("\0", "")
                .replace("\r\n", "\n")
                .replace("\r", "\n");

        normalized = RADICAL_OPERAND.matcher(normalized).replaceAll("sqrt($1)").replace("√", "sqrt");

        for (Map.Entry<String, String> symbol : SYMBOLS.entrySet()) {
            normalized = normalized.replace(symbol.getKey(), symbol.getValue());
        }

        return normalized.replaceAll("[ \\t]+", " ").trim();
    }

    /**
     * Inserts a {@code *} operator between juxtaposed operands such as {@code 2x}, {@code 3(x+1)},
     * {@code (x+1)(x-1)} or {@code 2sin(x)}. Inserted tokens have an empty span at the boundary.
     */
    public static List<Token> insertImplicitMultiplication(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        Token previous = null;

        for (Token token : tokens) {
            if (previous != null && isImplicitProduct(previous, token)) {
                int at = previous.span().end();
                result.add(new Token(TokenKind.OPERATOR, "*", new Span(at, at), previous.line(),
                        previous.column() + previous.text().length()));
            }
            result.add(token);
            previous = token;
        }

        return result;
    }

    private static boolean isImplicitProduct(Token left, Token right) {
        boolean leftEndsOperand = left.is(TokenKind.NUMBER)
                || left.is(TokenKind.VARIABLE)
                || left.is(TokenKind.RIGHT_PAREN)
                || left.is(TokenKind.RIGHT_BRACKET)
                || left.isOperator("!");
        if (!leftEndsOperand) {
            return false;
        }

        return switch (right.kind()) {
            case VARIABLE, FUNCTION, LEFT_PAREN, LEFT_BRACKET -> true;
            case NUMBER -> !left.is(TokenKind.NUMBER);
            default -> false;
        };
    }
}
