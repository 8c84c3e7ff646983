package com.mathrok.engine.solver;

import com.mathrok.engine.classify.EquationType;

import java.util.List;

public record SolveResult(
        List<Solution> solutions,
        List<SolutionStep> steps,
        EquationType equationType,
        List<String> variables,
        List<DomainRestriction> domainRestrictions
) {

    public SolveResult {
        solutions = List.copyOf(solutions);
        steps = List.copyOf(steps);
        variables = List.copyOf(variables);
        domainRestrictions = List.copyOf(domainRestrictions);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A solve result needs at least one step");
        }
    }

    /**
     * Same result with only the concluding step, for callers that do not want the derivation.
     */
    public SolveResult finalStepOnly() {
        return new SolveResult(solutions, List.of(steps.get(steps.size() - 1)), equationType, variables,
                domainRestrictions);
    }
}
