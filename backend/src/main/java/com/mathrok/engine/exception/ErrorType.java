package com.mathrok.engine.exception;

public enum ErrorType {
    LEX_ERROR,
    PARSE_ERROR,
    EMPTY_EXPRESSION,
    SYNTAX_ERROR,
    VALIDATION_ERROR,
    DEGREE_MISMATCH,
    COMPUTATION_ERROR
}
