package com.mathrok.engine.backend;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolicBackendChainTest {

    @Test
    void solve_emptyChainHasNoAnswer() {
        SymbolicBackendChain chain = SymbolicBackendChain.empty();

        assertTrue(chain.isEmpty());
        assertTrue(chain.solve("x = 1", "x").isEmpty());
        assertFalse(chain.supports(SymbolicCapability.SOLVE));
    }

    @Test
    void solve_skipsBackendsWithoutTheCapability() {
        StubBackend differentiator = StubBackend.differentiating("deriver", "2*x");
        StubBackend solver = StubBackend.solving("solver", List.of("3"));
        SymbolicBackendChain chain = new SymbolicBackendChain(List.of(differentiator, solver));

        Optional<BackendResult<List<String>>> result = chain.solve("2^x = 8", "x");

        assertTrue(result.isPresent());
        assertEquals("solver", result.get().backend());
        assertEquals(List.of("3"), result.get().value());
        assertEquals(0, differentiator.calls());
    }

    @Test
    void solve_failingBackendFallsThroughToTheNextOne() {
        StubBackend broken = StubBackend.failing("broken");
        StubBackend solver = StubBackend.solving("solver", List.of("1", "-1"));
        SymbolicBackendChain chain = new SymbolicBackendChain(List.of(broken, solver));

        Optional<BackendResult<List<String>>> result = chain.solve("x^2 = 1", "x");

        assertEquals("solver", result.orElseThrow().backend());
        assertEquals(1, broken.calls());
    }

    @Test
    void solve_emptyAnswerCountsAsNoAnswer() {
        StubBackend silent = StubBackend.solving("silent", List.of());
        StubBackend solver = StubBackend.solving("solver", List.of("2"));

        assertEquals("solver", new SymbolicBackendChain(List.of(silent, solver)).solve("x = 2", "x")
                .orElseThrow().backend());
        assertTrue(new SymbolicBackendChain(List.of(silent)).solve("x = 2", "x").isEmpty());
    }

    @Test
    void differentiate_blankAnswerCountsAsNoAnswer() {
        SymbolicBackendChain chain = new SymbolicBackendChain(List.of(
                StubBackend.differentiating("blank", " "),
                StubBackend.differentiating("deriver", "cos(x)")));

        BackendResult<String> result = chain.differentiate("sin(x)", "x").orElseThrow();

        assertEquals("deriver", result.backend());
        assertEquals("cos(x)", result.value());
    }

    @Test
    void operationsWithoutAnyCapableBackendAreEmpty() {
        SymbolicBackendChain chain = new SymbolicBackendChain(List.of(StubBackend.solving("solver", List.of("1"))));

        assertTrue(chain.integrate("x", "x").isEmpty());
        assertTrue(chain.factor("x^2 - 1", "x").isEmpty());
        assertTrue(chain.expand("(x+1)^2", "x").isEmpty());
        assertTrue(chain.simplify("x + x", "x").isEmpty());
    }

    @Test
    void defaultOperationsAreUnsupported() {
        SymbolicBackend solver = StubBackend.solving("solver", List.of("1"));

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> solver.integrate("x", "x"));
        assertEquals("solver cannot integrate", e.getMessage());
    }
}
