package com.mathrok.engine.solver;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * @param value exact text such as {@code -2/3} or a decimal rendering
 * @param approximation numeric value, absent when the solution is not a single number
 * @param multiplicity set only for repeated roots
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Solution(
        String variable,
        String value,
        boolean exact,
        Double approximation,
        List<String> conditions,
        Integer multiplicity
) {

    public Solution {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Solution exact(String variable, String value, double approximation) {
        return new Solution(variable, value, true, approximation, List.of(), null);
    }

    public static Solution approximate(String variable, String value, double approximation) {
        return new Solution(variable, value, false, approximation, List.of(), null);
    }

    public Solution withMultiplicity(int multiplicity) {
        return new Solution(variable, value, exact, approximation, conditions, multiplicity);
    }

    public Solution withConditions(List<String> conditions) {
        return new Solution(variable, value, exact, approximation, conditions, multiplicity);
    }
}
