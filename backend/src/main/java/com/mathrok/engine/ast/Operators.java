package com.mathrok.engine.ast;

/**
 * Operator symbols and binding powers used by the builder and the printer.
 */
public final class Operators {

    public static final String UNARY_PLUS = "u+";
    public static final String UNARY_MINUS = "u-";
    public static final String FACTORIAL = "!";
    public static final String POWER = "^";

    public static final int ADDITIVE = 1;
    public static final int MULTIPLICATIVE = 2;
    public static final int UNARY = 3;
    public static final int EXPONENT = 4;
    public static final int POSTFIX = 5;

    private Operators() {
    }

    public static int precedenceOf(String symbol) {
        return switch (symbol) {
            case "+", "-" -> ADDITIVE;
            case "*", "/", "%" -> MULTIPLICATIVE;
            case UNARY_PLUS, UNARY_MINUS -> UNARY;
            case POWER, "**" -> EXPONENT;
            case FACTORIAL -> POSTFIX;
            default -> throw new IllegalArgumentException("Unknown operator: " + symbol);
        };
    }

    public static Associativity associativityOf(String symbol) {
        return switch (symbol) {
            case POWER, "**", UNARY_PLUS, UNARY_MINUS -> Associativity.RIGHT;
            default -> Associativity.LEFT;
        };
    }

    /**
     * Printable form of an operator symbol, dropping the unary tag.
     */
    public static String display(String symbol) {
        return switch (symbol) {
            case UNARY_PLUS -> "+";
            case UNARY_MINUS -> "-";
            default -> symbol;
        };
    }
}
