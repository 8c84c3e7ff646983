package com.mathrok.engine.exception;

import java.util.List;

public class ComputationException extends MathException {

    public ComputationException(String message) {
        super(ErrorType.COMPUTATION_ERROR, message, null, List.of());
    }

    public ComputationException(String message, List<String> suggestions) {
        super(ErrorType.COMPUTATION_ERROR, message, null, suggestions);
    }

    public ComputationException(String message, Throwable cause) {
        super(ErrorType.COMPUTATION_ERROR, message, cause);
    }
}
