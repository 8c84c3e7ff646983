package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.lexer.Token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the validation rules over a token stream in order and collects their findings.
 * <p>
 * The validator works on tokens rather than on the tree, so it reports every structural
 * problem of an expression the builder would stop at on the first one. Instances are
 * immutable and safe to share.
 */
public class ExpressionValidator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionValidator.class);

    private final List<ValidationRule> rules;

    public ExpressionValidator() {
        this(defaultRules());
    }

    public ExpressionValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<ValidationRule> defaultRules() {
        return List.of(
                GroupingBalanceRule.parentheses(),
                GroupingBalanceRule.brackets(),
                new OperatorPlacementRule(),
                new FunctionCallRule(),
                new NumberRangeRule(),
                new VariableNameRule(),
                new ComplexityRule());
    }

    public ValidationResult validate(List<Token> tokens, MathConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();

        for (ValidationRule rule : rules) {
            try {
                issues.addAll(rule.check(tokens, config));
            } catch (RuntimeException e) {
                logger.warn("Validation rule '{}' failed: {}", rule.name(), e.getMessage(), e);
                issues.add(new ValidationIssue(Severity.ERROR,
                        "Validation rule '" + rule.name() + "' failed: " + e.getMessage(), null, List.of()));
            }
        }

        ValidationResult result = ValidationResult.of(issues);
        logger.debug("Validated {} tokens: {} errors, {} warnings", tokens.size(), result.errors().size(),
                result.warnings().size());
        return result;
    }

    public List<ValidationRule> getRules() {
        return rules;
    }
}
