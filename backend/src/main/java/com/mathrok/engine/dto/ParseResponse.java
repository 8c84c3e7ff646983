package com.mathrok.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mathrok.engine.service.ParseResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResponse(
        boolean success,
        ParseResult result,
        ErrorDetail error,
        long analysisTimeMs
) {

    public static ParseResponse success(ParseResult result, long analysisTimeMs) {
        return new ParseResponse(true, result, null, analysisTimeMs);
    }

    public static ParseResponse error(ErrorDetail error, long analysisTimeMs) {
        return new ParseResponse(false, null, error, analysisTimeMs);
    }
}
