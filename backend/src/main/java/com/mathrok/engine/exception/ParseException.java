package com.mathrok.engine.exception;

import java.util.List;

public class ParseException extends MathException {

    public ParseException(String message) {
        super(ErrorType.PARSE_ERROR, message, null, List.of());
    }

    private ParseException(ErrorType type, String message, List<String> suggestions) {
        super(type, message, null, suggestions);
    }

    public static ParseException emptyExpression() {
        return new ParseException(ErrorType.EMPTY_EXPRESSION, "Empty expression",
                List.of("Enter an expression such as 2*x + 3 = 7"));
    }

    public static ParseException tooLong(int length, int maxLength) {
        return new ParseException(ErrorType.PARSE_ERROR,
                "Expression too long (" + length + " characters, maximum " + maxLength + ")",
                List.of("Split the expression into smaller parts"));
    }
}
