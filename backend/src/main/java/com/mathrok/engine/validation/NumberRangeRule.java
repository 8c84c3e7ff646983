package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;

public class NumberRangeRule implements ValidationRule {

    // 2^53 - 1, the largest integer a double holds exactly
    static final double MAX_SAFE_INTEGER = 9_007_199_254_740_991d;

    @Override
    public String name() {
        return "numbers";
    }

    @Override
    public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();

        for (Token token : tokens) {
            if (!token.is(TokenKind.NUMBER)) {
                continue;
            }

            double value;
            try {
                value = Double.parseDouble(token.text());
            } catch (NumberFormatException e) {
                issues.add(ValidationIssue.error("Invalid number: " + token.text(), token, "Check number format"));
                continue;
            }

            if (!Double.isFinite(value)) {
                issues.add(ValidationIssue.error("Number out of range: " + token.text(), token,
                        "Use a smaller exponent"));
            } else if (Math.abs(value) > MAX_SAFE_INTEGER) {
                issues.add(ValidationIssue.warning("Very large number may lose precision: " + token.text(), token,
                        "Consider using scientific notation"));
            } else if (value != 0 && Math.abs(value) < Double.MIN_NORMAL) {
                issues.add(ValidationIssue.warning("Very small number may underflow: " + token.text(), token,
                        "Consider using scientific notation"));
            }
        }

        return issues;
    }
}
