package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.MathFunctions;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;

public class FunctionCallRule implements ValidationRule {

    @Override
    public String name() {
        return "functions";
    }

    @Override
    public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(TokenKind.FUNCTION)) {
                continue;
            }

            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            if (next == null || !next.is(TokenKind.LEFT_PAREN)) {
                issues.add(ValidationIssue.error(
                        "Function '" + token.text() + "' must be followed by parentheses", token,
                        "Add parentheses: " + token.text() + "()"));
            }

            if (!MathFunctions.isBuiltin(token.text())) {
                issues.add(ValidationIssue.warning("Unknown function: " + token.text(), token,
                        "Check function name spelling"));
            }
        }

        return issues;
    }
}
