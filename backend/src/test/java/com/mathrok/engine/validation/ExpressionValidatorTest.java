package com.mathrok.engine.validation;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.config.NumericSettings;
import com.mathrok.engine.lexer.InputNormalizer;
import com.mathrok.engine.lexer.MathLexer;
import com.mathrok.engine.lexer.Span;
import com.mathrok.engine.lexer.Token;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionValidatorTest {

    private final ExpressionValidator validator = new ExpressionValidator();

    private static List<Token> tokens(String source) {
        return InputNormalizer.insertImplicitMultiplication(new MathLexer(source).tokenize());
    }

    private ValidationResult validate(String source) {
        return validator.validate(tokens(source), MathConfig.defaults());
    }

    private static List<String> errorMessages(ValidationResult result) {
        return result.errors().stream().map(ValidationIssue::message).toList();
    }

    @Test
    void validate_wellFormedEquationIsValid() {
        ValidationResult result = validate("2x^2 + 3x - 5 = 0");

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void validate_reportsInnermostUnclosedParenthesis() {
        ValidationResult result = validate("((x+1)");

        assertFalse(result.valid());
        assertEquals(List.of("Unmatched opening parenthesis"), errorMessages(result));
        assertEquals(new Span(0, 1), result.errors().get(0).span());
        assertEquals(List.of("Add missing closing parenthesis"), result.suggestions());
    }

    @Test
    void validate_reportsEachExtraClosingDelimiter() {
        ValidationResult result = validate("x + 1))]");

        assertEquals(List.of("Unmatched closing parenthesis", "Unmatched closing parenthesis",
                "Unmatched closing bracket"), errorMessages(result));
        assertEquals(List.of("Remove the extra closing parenthesis", "Remove the extra closing bracket"),
                result.suggestions());
    }

    @Test
    void validate_consecutiveOperators() {
        ValidationResult result = validate("2 * / 3");

        assertEquals(List.of("Consecutive operators: * /"), errorMessages(result));
        assertEquals(new Span(4, 5), result.errors().get(0).span());
    }

    @Test
    void validate_signAfterBinaryOperatorAndOperatorAfterFactorialAreAllowed() {
        assertTrue(validate("2 * -3").valid());
        assertTrue(validate("x ^ -1").valid());
        assertTrue(validate("3! + 1").valid());
        assertTrue(validate("-x").valid());
    }

    @Test
    void validate_operatorsAtTheEdges() {
        assertEquals(List.of("Binary operator '*' at start of expression"), errorMessages(validate("* 2")));
        assertEquals(List.of("Operator '+' at end of expression"), errorMessages(validate("2 +")));
        assertTrue(validate("4!").valid());
    }

    @Test
    void validate_functionWithoutParentheses() {
        ValidationResult result = validate("sin + 1");

        assertEquals(List.of("Function 'sin' must be followed by parentheses"), errorMessages(result));
        assertEquals(List.of("Add parentheses: sin()"), result.errors().get(0).suggestions());
    }

    @Test
    void validate_customFunctionIsUnknownButNotAnError() {
        MathConfig config = new MathConfig(15, true, true, true, 10_000, 100, 1000, 20, true, true, Set.of("f"),
                NumericSettings.defaults());

        ValidationResult result = validator.validate(new MathLexer("f(x) = 2", Set.of("f")).tokenize(), config);

        assertTrue(result.valid());
        assertEquals(List.of("Unknown function: f"), result.warnings());
        assertEquals(List.of("Check function name spelling"), result.suggestions());
    }

    @Test
    void validate_numberRangeFindings() {
        ValidationResult large = validate("12345678901234567890 + x");
        assertTrue(large.valid());
        assertEquals(List.of("Very large number may lose precision: 12345678901234567890"), large.warnings());

        ValidationResult overflow = validate("1e400");
        assertEquals(List.of("Number out of range: 1e400"), errorMessages(overflow));

        ValidationResult tiny = validate("1e-320");
        assertEquals(List.of("Very small number may underflow: 1e-320"), tiny.warnings());
    }

    @Test
    void validate_variableNameFindings() {
        ValidationResult reserved = validate("null + 1");
        assertEquals(List.of("Variable name 'null' is a reserved word"), reserved.warnings());

        ValidationResult longName = validate("abcdefghijklmnopqrstuvwxyz = 1");
        assertEquals(List.of("Very long variable name: abcdefghijklmnopqrstuvwxyz"), longName.warnings());
    }

    @Test
    void validate_tooManyVariablesAndTooManyTokens() {
        MathConfig tight = new MathConfig(15, true, true, true, 10_000, 1, 4, 20, true, true, Set.of(),
                NumericSettings.defaults());

        ValidationResult result = validator.validate(tokens("x + y + 1"), tight);

        assertTrue(result.valid());
        assertEquals(List.of("Too many variables (2), maximum recommended: 1",
                "Expression is very complex (5 tokens)"), result.warnings());
    }

    @Test
    void validate_failingRuleBecomesAnError() {
        ValidationRule broken = new ValidationRule() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public List<ValidationIssue> check(List<Token> tokens, MathConfig config) {
                throw new IllegalStateException("boom");
            }
        };
        ExpressionValidator withBrokenRule = new ExpressionValidator(List.of(broken, new ComplexityRule()));

        ValidationResult result = withBrokenRule.validate(tokens("x"), MathConfig.defaults());

        assertFalse(result.valid());
        assertEquals(List.of("Validation rule 'broken' failed: boom"), errorMessages(result));
        assertNull(result.errors().get(0).span());
    }

    @Test
    void defaultRules_runInDocumentedOrder() {
        List<String> names = validator.getRules().stream().map(ValidationRule::name).toList();

        assertEquals(List.of("parentheses", "brackets", "operators", "functions", "numbers", "variables",
                "complexity"), names);
    }
}
