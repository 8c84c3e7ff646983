package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.MathFunctions;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class VariableNameRule implements ValidationRule {

    @Override
    public String name() {
        return "variables";
    }

    @Override
    public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> variables = new LinkedHashSet<>();

        for (Token token : tokens) {
            if (!token.is(TokenKind.VARIABLE)) {
                continue;
            }
            String name = token.text();
            variables.add(name);

            if (name.length() > config.maxVariableNameLength()) {
                issues.add(ValidationIssue.warning("Very long variable name: " + name, token,
                        "Consider using shorter variable names"));
            }

            if (MathFunctions.RESERVED_WORDS.contains(name)) {
                issues.add(ValidationIssue.warning("Variable name '" + name + "' is a reserved word", token,
                        "Use a different variable name"));
            }
        }

        if (variables.size() > config.maxVariables()) {
            issues.add(ValidationIssue.warning("Too many variables (" + variables.size()
                    + "), maximum recommended: " + config.maxVariables(), null,
                    "Consider simplifying the expression"));
        }

        return issues;
    }
}
