package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.List;

public class ComplexityRule implements ValidationRule {

    @Override
    public String name() {
        return "complexity";
    }

    @Override
    public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
        long complexity = tokens.stream().filter(token -> !token.is(TokenKind.EOF)).count();
        if (complexity > config.maxComplexity()) {
            return List.of(ValidationIssue.warning("Expression is very complex (" + complexity + " tokens)", null,
                    "Consider breaking into smaller expressions"));
        }
        return List.of();
    }
}
