package com.mathrok.engine.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mathrok.engine.lexer.Span;
import com.mathrok.engine.lexer.Token;

import java.util.List;

/**
 * One finding of a validation rule. {@code span} is {@code null} for findings about the whole expression.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
        Severity severity,
        String message,
        Span span,
        List<String> suggestions
) {

    public ValidationIssue {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ValidationIssue error(String message, Token token, String... suggestions) {
        return new ValidationIssue(Severity.ERROR, message, token == null ? null : token.span(), List.of(suggestions));
    }

    public static ValidationIssue warning(String message, Token token, String... suggestions) {
        return new ValidationIssue(Severity.WARNING, message, token == null ? null : token.span(),
                List.of(suggestions));
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
