package com.mathrok.engine.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.solver.SolutionStep;
import com.mathrok.engine.validation.ValidationResult;

import java.util.List;

/**
 * @param simplified printed form after the structural simplifier, present only when simplification is on
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResult(
        String expression,
        String normalized,
        ExprNode ast,
        List<String> variables,
        List<String> functions,
        double complexity,
        ValidationResult validation,
        List<SolutionStep> steps,
        String simplified
) {

    public ParseResult {
        variables = List.copyOf(variables);
        functions = List.copyOf(functions);
        steps = List.copyOf(steps);
    }
}
