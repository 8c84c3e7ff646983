package com.mathrok.engine.solver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mathrok.engine.solver.SolverFixtures.parse;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DomainAnalyzerTest {

    private final DomainAnalyzer analyzer = new DomainAnalyzer();

    private List<String> restrictions(String equation) {
        return analyzer.analyze(parse(equation), "x").stream().map(DomainRestriction::restriction).toList();
    }

    @Test
    void analyze_collectsEveryKindOfRestriction() {
        assertEquals(List.of("x - 1 ≥ 0", "x > 0", "x - 2 ≠ 0"), restrictions("sqrt(x - 1) + log(x) = 1/(x - 2)"));
    }

    @Test
    void analyze_describesTheRestriction() {
        DomainRestriction restriction = analyzer.analyze(parse("1/x = 2"), "x").get(0);

        assertEquals("x", restriction.variable());
        assertEquals("Denominator cannot be zero", restriction.description());
    }

    @Test
    void analyze_mergesDuplicates() {
        assertEquals(List.of("x ≠ 0"), restrictions("1/x + 2/x = 1"));
    }

    @Test
    void analyze_ignoresTermsWithoutTheVariable() {
        assertTrue(restrictions("x/2 + sqrt(2) = ln(3)").isEmpty());
    }
}
