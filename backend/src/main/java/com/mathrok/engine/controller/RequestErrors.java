package com.mathrok.engine.controller;

import org.springframework.web.bind.MethodArgumentNotValidException;

final class RequestErrors {

    private RequestErrors() {
    }

    static String describe(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        return errorMessage.toString();
    }
}
