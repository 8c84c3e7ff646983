package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Checks that every opening delimiter of one kind has a matching closing one.
 * Used twice: once for parentheses, once for square brackets.
 */
public class GroupingBalanceRule implements ValidationRule {

    private final String name;
    private final TokenKind open;
    private final TokenKind close;
    private final String noun;

    private GroupingBalanceRule(String name, TokenKind open, TokenKind close, String noun) {
        this.name = name;
        this.open = open;
        this.close = close;
        this.noun = noun;
    }

    public static GroupingBalanceRule parentheses() {
        return new GroupingBalanceRule("parentheses", TokenKind.LEFT_PAREN, TokenKind.RIGHT_PAREN, "parenthesis");
    }

    public static GroupingBalanceRule brackets() {
        return new GroupingBalanceRule("brackets", TokenKind.LEFT_BRACKET, TokenKind.RIGHT_BRACKET, "bracket");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();
        Deque<Token> openTokens = new ArrayDeque<>();

        for (Token token : tokens) {
            if (token.is(open)) {
                openTokens.push(token);
            } else if (token.is(close)) {
                if (openTokens.isEmpty()) {
                    issues.add(ValidationIssue.error("Unmatched closing " + noun, token,
                            "Remove the extra closing " + noun));
                } else {
                    openTokens.pop();
                }
            }
        }

        // the innermost unclosed delimiter is the one reported
        if (!openTokens.isEmpty()) {
            issues.add(ValidationIssue.error("Unmatched opening " + noun, openTokens.peek(),
                    "Add missing closing " + noun));
        }

        return issues;
    }
}
