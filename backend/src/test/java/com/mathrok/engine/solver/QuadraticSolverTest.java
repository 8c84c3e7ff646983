package com.mathrok.engine.solver;

import com.mathrok.engine.config.MathConfig;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mathrok.engine.solver.SolverFixtures.config;
import static com.mathrok.engine.solver.SolverFixtures.ids;
import static com.mathrok.engine.solver.SolverFixtures.values;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuadraticSolverTest {

    private final QuadraticSolver solver = new QuadraticSolver(new LinearSolver());

    @Test
    void solve_twoExactRoots() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(1, 0, -4, "x", MathConfig.defaults(), trace);

        assertEquals(List.of("2", "-2"), values(solutions));
        assertTrue(solutions.stream().allMatch(Solution::exact));
        assertEquals(List.of("identify_quadratic", "calculate_discriminant", "two_distinct_roots",
                "apply_quadratic_formula"), ids(trace.steps()));
        assertEquals("Δ = 16", trace.steps().get(1).after());
        assertEquals("x = 2 or x = -2", trace.last().after());
    }

    @Test
    void solve_fractionalRoots() {
        List<Solution> solutions = solver.solve(2, 1, -1, "x", MathConfig.defaults(), new StepTrace());

        assertEquals(List.of("1/2", "-1"), values(solutions));
        assertEquals(0.5, solutions.get(0).approximation(), 1e-15);
    }

    @Test
    void solve_fractionalRootsAsDecimals() {
        List<Solution> solutions = solver.solve(2, 1, -1, "x", config(false, true), new StepTrace());

        assertEquals(List.of("0.5", "-1"), values(solutions));
        assertFalse(solutions.get(0).exact());
        assertTrue(solutions.get(1).exact());
    }

    @Test
    void solve_irrationalRootsAreApproximate() {
        List<Solution> solutions = solver.solve(1, 0, -2, "x", MathConfig.defaults(), new StepTrace());

        assertEquals(2, solutions.size());
        assertFalse(solutions.get(0).exact());
        assertEquals(Math.sqrt(2), solutions.get(0).approximation(), 1e-12);
        assertEquals(-Math.sqrt(2), solutions.get(1).approximation(), 1e-12);
    }

    @Test
    void solve_repeatedRootHasMultiplicityTwo() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(1, -4, 4, "x", MathConfig.defaults(), trace);

        assertEquals(1, solutions.size());
        assertEquals("2", solutions.get(0).value());
        assertEquals(Integer.valueOf(2), solutions.get(0).multiplicity());
        assertEquals("calculate_repeated_root", trace.last().id());
    }

    @Test
    void solve_negativeDiscriminantHasNoRealRoots() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(1, 0, 1, "x", MathConfig.defaults(), trace);

        assertTrue(solutions.isEmpty());
        assertEquals(List.of("identify_quadratic", "calculate_discriminant", "no_real_solutions",
                "apply_quadratic_formula"), ids(trace.steps()));
        assertEquals(StepOperation.CALCULATION, trace.last().operation());
        assertEquals("No real solutions", trace.last().after());
    }

    @Test
    void solve_zeroLeadingCoefficientReducesToLinear() {
        StepTrace trace = new StepTrace();

        List<Solution> solutions = solver.solve(0, 2, -6, "x", MathConfig.defaults(), trace);

        assertEquals(List.of("3"), values(solutions));
        assertNull(solutions.get(0).multiplicity());
        assertEquals(List.of("identify_quadratic", "reduce_to_linear", "identify_form", "isolate_variable_term",
                "solve_for_variable", "verify_solution"), ids(trace.steps()));
    }

    @Test
    void discriminant_snapsRoundingNoiseToZero() {
        assertEquals(0, QuadraticSolver.discriminant(0.1, 0.2, 0.1));
        assertEquals(16, QuadraticSolver.discriminant(1, 0, -4));
    }
}
