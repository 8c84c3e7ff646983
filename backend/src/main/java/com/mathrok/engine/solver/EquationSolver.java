package com.mathrok.engine.solver;

import java.util.List;

public interface EquationSolver {

    /**
     * Solves {@code context.equation()} for {@code context.variable()}, appending the derivation to {@code trace}.
     *
     * @throws com.mathrok.engine.exception.DegreeMismatchException if the equation is beyond this solver's degree
     * @throws com.mathrok.engine.exception.ComputationException if the equation cannot be solved by this solver
     */
    List<Solution> solve(SolveContext context, StepTrace trace);
}
