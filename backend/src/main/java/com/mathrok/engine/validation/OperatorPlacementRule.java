package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rejects consecutive operators and operators at the edges of the expression.
 * A sign after a binary operator ({@code 2*-3}) and any operator after a postfix {@code !} are allowed.
 */
public class OperatorPlacementRule implements ValidationRule {

    private static final Set<String> SIGNS = Set.of("+", "-");
    private static final Set<String> BINARY = Set.of("+", "-", "*", "/", "^", "**", "%");

    @Override
    public String name() {
        return "operators";
    }

    @Override
    public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<Token> significant = tokens.stream()
                .filter(token -> !token.is(TokenKind.EOF))
                .toList();

        Token previous = null;
        for (int i = 0; i < significant.size(); i++) {
            Token token = significant.get(i);

            if (token.is(TokenKind.OPERATOR)) {
                if (previous != null && previous.is(TokenKind.OPERATOR) && !allowedAfter(previous, token)) {
                    issues.add(ValidationIssue.error(
                            "Consecutive operators: " + previous.text() + " " + token.text(), token,
                            "Remove one of the operators or add operand between them"));
                }

                if (i == 0 && !SIGNS.contains(token.text())) {
                    issues.add(ValidationIssue.error(
                            "Binary operator '" + token.text() + "' at start of expression", token,
                            "Add operand before the operator"));
                }

                if (i == significant.size() - 1 && !"!".equals(token.text())) {
                    issues.add(ValidationIssue.error(
                            "Operator '" + token.text() + "' at end of expression", token,
                            "Add operand after the operator"));
                }
            }

            previous = token;
        }

        return issues;
    }

    private static boolean allowedAfter(Token previous, Token token) {
        if ("!".equals(previous.text())) {
            return true;
        }
        return SIGNS.contains(token.text()) && BINARY.contains(previous.text());
    }
}
