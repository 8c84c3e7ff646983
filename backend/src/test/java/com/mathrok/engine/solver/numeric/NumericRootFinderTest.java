package com.mathrok.engine.solver.numeric;

import com.mathrok.engine.config.NumericSettings;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NumericRootFinderTest {

    private final NumericRootFinder finder = new NumericRootFinder(NumericSettings.defaults());

    @Test
    void findRoots_signChangesInAscendingOrder() {
        List<Double> roots = finder.findRoots(x -> x * x - 2);

        assertEquals(2, roots.size());
        assertEquals(-Math.sqrt(2), roots.get(0), 1e-9);
        assertEquals(Math.sqrt(2), roots.get(1), 1e-9);
    }

    @Test
    void findRoots_evenMultiplicityRootWithoutSignChange() {
        assertEquals(List.of(3.0), finder.findRoots(x -> (x - 3) * (x - 3)));
    }

    @Test
    void findRoots_touchingRootBetweenSamples() {
        List<Double> roots = finder.findRoots(x -> (x - 0.123) * (x - 0.123));

        assertEquals(1, roots.size());
        assertEquals(0.123, roots.get(0), 1e-4);
    }

    @Test
    void findRoots_polesAreNotRoots() {
        assertTrue(finder.findRoots(x -> 1 / x).isEmpty());
        assertEquals(List.of(1.0), finder.findRoots(x -> (x - 1) / x));
    }

    @Test
    void findRoots_skipsPointsOutsideTheDomain() {
        List<Double> roots = finder.findRoots(x -> Math.sqrt(x) - 2);

        assertEquals(1, roots.size());
        assertEquals(4, roots.get(0), 1e-9);
    }

    @Test
    void findRoots_onAnExplicitInterval() {
        List<Double> roots = finder.findRoots(Math::sin, 1, 7);

        assertEquals(2, roots.size());
        assertEquals(Math.PI, roots.get(0), 1e-9);
        assertEquals(2 * Math.PI, roots.get(1), 1e-9);
    }

    @Test
    void findRoots_noRoots() {
        assertTrue(finder.findRoots(x -> x * x + 1).isEmpty());
    }

    @Test
    void refine_convergesInsideTheBracket() {
        double root = finder.refine(x -> x * x * x - 2, 1, -1, 2, 6);

        assertEquals(Math.cbrt(2), root, 1e-9);
    }
}
