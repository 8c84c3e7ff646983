package com.mathrok.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mathrok.engine.solver.SolveResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResponse(
        boolean success,
        SolveResult result,
        ErrorDetail error,
        long computationTimeMs
) {

    public static SolveResponse success(SolveResult result, long computationTimeMs) {
        return new SolveResponse(true, result, null, computationTimeMs);
    }

    public static SolveResponse error(ErrorDetail error, long computationTimeMs) {
        return new SolveResponse(false, null, error, computationTimeMs);
    }
}
