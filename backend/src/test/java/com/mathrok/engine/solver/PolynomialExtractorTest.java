package com.mathrok.engine.solver;

import com.mathrok.engine.exception.ComputationException;
import com.mathrok.engine.exception.DegreeMismatchException;

import org.junit.jupiter.api.Test;

import static com.mathrok.engine.solver.SolverFixtures.parse;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PolynomialExtractorTest {

    @Test
    void extractLinear_movesEverythingToTheLeft() {
        assertArrayEquals(new double[] {3, 2}, PolynomialExtractor.extractLinear(parse("3x + 2 = 0"), "x"));
        assertArrayEquals(new double[] {2, -6}, PolynomialExtractor.extractLinear(parse("2x = 6"), "x"));
        assertArrayEquals(new double[] {0.5, -1}, PolynomialExtractor.extractLinear(parse("x/2 = 1"), "x"));
    }

    @Test
    void extractQuadratic_expandsProductsAndPowers() {
        assertArrayEquals(new double[] {1, 2, 1}, PolynomialExtractor.extractQuadratic(parse("(x+1)^2 = 0"), "x"));
        assertArrayEquals(new double[] {1, -2, 0}, PolynomialExtractor.extractQuadratic(parse("x^2 = 2x"), "x"));
        assertArrayEquals(new double[] {1, 0, -1},
                PolynomialExtractor.extractQuadratic(parse("(x+1)(x-1) = 0"), "x"));
    }

    @Test
    void extract_evaluatesConstantSubtrees() {
        Polynomial p = PolynomialExtractor.extract(parse("2^3*x - sqrt(16) = 0"), "x");

        assertEquals(1, p.degree());
        assertEquals(8, p.coefficient(1));
        assertEquals(-4, p.coefficient(0));
    }

    @Test
    void extract_degreeAboveLimitIsMismatch() {
        assertThrows(DegreeMismatchException.class,
                () -> PolynomialExtractor.extractQuadratic(parse("x^3 = 1"), "x"));
        assertThrows(DegreeMismatchException.class,
                () -> PolynomialExtractor.extractLinear(parse("x^2 = 1"), "x"));
    }

    @Test
    void extract_nonPolynomialTermsFail() {
        ComputationException e = assertThrows(ComputationException.class,
                () -> PolynomialExtractor.extract(parse("sin(x) = 0"), "x"));

        assertEquals("Term sin(x) is not polynomial in x", e.getMessage());
        assertThrows(ComputationException.class, () -> PolynomialExtractor.extract(parse("1/x = 1"), "x"));
        assertThrows(ComputationException.class, () -> PolynomialExtractor.extract(parse("2^x = 1"), "x"));
        assertThrows(ComputationException.class, () -> PolynomialExtractor.extract(parse("x^0.5 = 1"), "x"));
    }

    @Test
    void extract_refusesHugeExpansions() {
        assertThrows(ComputationException.class, () -> PolynomialExtractor.extract(parse("x^100 = 1"), "x"));
    }

    @Test
    void extract_unboundNameFails() {
        assertThrows(ComputationException.class, () -> PolynomialExtractor.extract(parse("y*x = 1"), "x"));
    }

    @Test
    void polynomial_arithmeticAndFormatting() {
        Polynomial xPlusOne = new Polynomial("x", 1, 1);
        Polynomial xMinusOne = new Polynomial("x", -1, 1);

        assertEquals(new Polynomial("x", -1, 0, 1), xPlusOne.times(xMinusOne));
        assertEquals("x^2 - 4", new Polynomial("x", -4, 0, 1).format(15));
        assertEquals("-2x^2 + 3x", new Polynomial("x", 0, 3, -2).format(15));
        assertEquals("0", new Polynomial("x", 0, 0, 0).format(15));
        assertEquals(0, new Polynomial("x", 0, 0, 0).degree());
        assertEquals(9, xPlusOne.pow(2).evaluate(2));
    }
}
