package com.mathrok.engine.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Outcome of {@link ExpressionValidator#validate}. The expression is valid iff there are no errors.
 */
public record ValidationResult(
        boolean valid,
        List<ValidationIssue> errors,
        List<String> warnings,
        List<String> suggestions
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(new LinkedHashSet<>(suggestions));
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    public static ValidationResult of(List<ValidationIssue> issues) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                errors.add(issue);
            } else {
                warnings.add(issue.message());
            }
            suggestions.addAll(issue.suggestions());
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings, suggestions);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of(), List.of());
    }
}
