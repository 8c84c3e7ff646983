package com.mathrok.engine.solver;

import com.mathrok.engine.config.MathConfig;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mathrok.engine.solver.SolverFixtures.config;
import static com.mathrok.engine.solver.SolverFixtures.ids;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinearSolverTest {

    private final LinearSolver solver = new LinearSolver();

    @Test
    void solve_integerRoot() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(2, -6, "x", MathConfig.defaults(), trace);

        assertEquals(1, solutions.size());
        Solution solution = solutions.get(0);
        assertEquals("3", solution.value());
        assertTrue(solution.exact());
        assertEquals(3.0, solution.approximation(), 1e-15);
        assertEquals(List.of("identify_form", "isolate_variable_term", "solve_for_variable", "verify_solution"),
                ids(trace.steps()));
        assertEquals("2x - 6 = 0", trace.steps().get(0).before());
        assertEquals("2x = 6", trace.steps().get(1).after());
        assertEquals("2(3) - 6 = 0", trace.last().after());
    }

    @Test
    void solve_fractionWhenExact() {
        List<Solution> solutions = solver.solve(3, 2, "x", MathConfig.defaults(), new StepTrace());

        assertEquals("-2/3", solutions.get(0).value());
        assertTrue(solutions.get(0).exact());
        assertEquals(-2.0 / 3, solutions.get(0).approximation(), 1e-15);
    }

    @Test
    void solve_decimalWhenNotExact() {
        List<Solution> solutions = solver.solve(3, 2, "x", config(false, true), new StepTrace());

        assertEquals("-0.666666666666667", solutions.get(0).value());
        assertFalse(solutions.get(0).exact());
    }

    @Test
    void solve_nonIntegerCoefficientsAreApproximate() {
        List<Solution> solutions = solver.solve(0.5, -1.25, "t", MathConfig.defaults(), new StepTrace());

        assertEquals("2.5", solutions.get(0).value());
        assertEquals("t", solutions.get(0).variable());
        assertFalse(solutions.get(0).exact());
    }

    @Test
    void solve_identityHasEveryRealAsSolution() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(0, 0, "x", MathConfig.defaults(), trace);

        assertEquals(1, solutions.size());
        assertEquals("all real numbers", solutions.get(0).value());
        assertEquals(List.of("x ∈ ℝ"), solutions.get(0).conditions());
        assertEquals("infinite_solutions", trace.last().id());
    }

    @Test
    void solve_contradictionHasNoSolution() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(0, 5, "x", MathConfig.defaults(), trace);

        assertTrue(solutions.isEmpty());
        assertEquals("no_solution", trace.last().id());
        assertEquals("5 = 0", trace.last().after());
    }
}
