package com.mathrok.engine.validation;

public enum Severity {
    ERROR,
    WARNING
}
