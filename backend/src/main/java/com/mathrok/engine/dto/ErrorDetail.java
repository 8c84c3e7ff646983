package com.mathrok.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mathrok.engine.exception.MathException;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetail(
        String type,
        String message,
        Integer start,
        Integer end,
        List<String> suggestions
) {

    public static ErrorDetail from(MathException e) {
        return new ErrorDetail(
                e.getType().name(),
                e.getMessage(),
                e.getSpan() != null ? e.getSpan().start() : null,
                e.getSpan() != null ? e.getSpan().end() : null,
                e.getSuggestions());
    }

    public static ErrorDetail invalidRequest(String message) {
        return new ErrorDetail("INVALID_REQUEST", message, null, null, List.of());
    }

    public static ErrorDetail internal(String message) {
        return new ErrorDetail("INTERNAL_ERROR", message, null, null, List.of());
    }
}
