package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.Token;

import java.util.List;

/**
 * A single check over the token stream. Rules are stateless and run in a fixed order.
 */
public interface ValidationRule {

    String name();

    List<ValidationIssue> check(List<Token> tokens, MathConfig config);
}
