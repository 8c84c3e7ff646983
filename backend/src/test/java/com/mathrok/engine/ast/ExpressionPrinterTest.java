package com.mathrok.engine.ast;

import org.junit.jupiter.api.Test;

import static com.mathrok.engine.ast.AstBuilderTest.parse;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExpressionPrinterTest {

    private static String roundTrip(String source) {
        return ExpressionPrinter.print(parse(source));
    }

    @Test
    void print_spacesAdditiveOperatorsOnly() {
        assertEquals("2*x + 3", roundTrip("2x+3"));
        assertEquals("x/2 - 1", roundTrip("x / 2 - 1"));
    }

    @Test
    void print_keepsRequiredParentheses() {
        assertEquals("(x + 1)*(x - 1)", roundTrip("(x+1)(x-1)"));
        assertEquals("x - (y - z)", roundTrip("x-(y-z)"));
        assertEquals("(-2)^2", roundTrip("(-2)^2"));
        assertEquals("(2^3)^2", roundTrip("(2^3)^2"));
    }

    @Test
    void print_dropsRedundantParentheses() {
        assertEquals("2^3^2", roundTrip("2^(3^2)"));
        assertEquals("x + y*z", roundTrip("x + (y*z)"));
        assertEquals("-2^2", roundTrip("-(2^2)"));
    }

    @Test
    void print_relationsAndCalls() {
        assertEquals("sin(x) = 0.5", roundTrip("sin(x) = 0.5"));
        assertEquals("x >= 1", roundTrip("x>=1"));
        assertEquals("max(1, 2)", roundTrip("max(1,2)"));
        assertEquals("3!", roundTrip("3!"));
    }

    @Test
    void print_reparsesToTheSameValue() {
        String source = "-(x - 2)^3 / (4 - x) + 2^-1";
        ExprNode original = parse(source.replace("x", "1.5"));
        ExprNode reparsed = parse(ExpressionPrinter.print(original));

        assertEquals(ExpressionEvaluator.evaluate(original), ExpressionEvaluator.evaluate(reparsed), 1e-12);
    }
}
