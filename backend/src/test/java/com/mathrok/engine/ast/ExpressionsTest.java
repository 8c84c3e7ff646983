package com.mathrok.engine.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.mathrok.engine.ast.AstBuilderTest.parse;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionsTest {

    @Test
    void variables_inOrderOfFirstAppearanceWithoutConstants() {
        assertEquals(List.of("y", "x"), Expressions.variables(parse("y + 2*pi*x + y = e")));
    }

    @Test
    void functions_distinctNames() {
        assertEquals(List.of("sin", "cos"), Expressions.functions(parse("sin(x) + cos(sin(x))")));
    }

    @Test
    void containsVariable_searchesTheWholeTree() {
        ExprNode ast = parse("sqrt(2*x) = 1");

        assertTrue(Expressions.containsVariable(ast, "x"));
        assertFalse(Expressions.containsVariable(ast, "y"));
    }

    @Test
    void complexity_weightsNodeKinds() {
        assertEquals(3, Expressions.complexity(parse("x + 1")));
        assertEquals(6.5, Expressions.complexity(parse("sin(x) = 1")));
    }

    @Test
    void complexity_isCapped() {
        String longSum = "x" + " + x".repeat(60);

        assertEquals(100, Expressions.complexity(parse(longSum)));
    }

    @Test
    void bindNumbers_replacesOnlyNamedVariables() {
        ExprNode bound = Expressions.bindNumbers(parse("a*x + b"), Map.of("a", 2.0, "b", 3.0));

        assertEquals("2*x + 3", ExpressionPrinter.print(bound));
    }

    @Test
    void toZeroForm_movesRightSideAcross() {
        assertEquals("2*x - 6", ExpressionPrinter.print(Expressions.toZeroForm(parse("2x = 6"))));
        assertEquals("x^2", ExpressionPrinter.print(Expressions.toZeroForm(parse("x^2 = 0"))));

        ExprNode plain = parse("x + 1");
        assertSame(plain, Expressions.toZeroForm(plain));
    }
}
