package com.mathrok.engine.dto;

import com.mathrok.engine.validation.ValidationIssue;
import com.mathrok.engine.validation.ValidationResult;

import java.util.List;

public record ValidationResponse(
        boolean valid,
        List<ValidationIssue> errors,
        List<String> warnings,
        List<String> suggestions,
        long analysisTimeMs
) {

    public static ValidationResponse from(ValidationResult result, long analysisTimeMs) {
        return new ValidationResponse(result.valid(), result.errors(), result.warnings(), result.suggestions(),
                analysisTimeMs);
    }

    public static ValidationResponse invalid(String message) {
        return new ValidationResponse(false, List.of(ValidationIssue.error(message, null)), List.of(), List.of(), 0);
    }
}
