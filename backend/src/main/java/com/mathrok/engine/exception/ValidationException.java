package com.mathrok.engine.exception;

import com.mathrok.engine.validation.ValidationIssue;
import com.mathrok.engine.validation.ValidationResult;

/**
 * Raised when the validator reports at least one error; the first error provides message and span.
 */
public class ValidationException extends MathException {

    private final ValidationResult result;

    public ValidationException(ValidationResult result) {
        this(result, result.errors().get(0));
    }

    private ValidationException(ValidationResult result, ValidationIssue first) {
        super(ErrorType.VALIDATION_ERROR, first.message(), first.span(), first.suggestions());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
