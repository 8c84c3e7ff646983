package com.mathrok.engine.backend;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double answering {@code solve} and {@code differentiate} with fixed values, or failing on demand.
 */
public class StubBackend implements SymbolicBackend {

    private final String name;
    private final Set<SymbolicCapability> capabilities;
    private final List<String> solutions;
    private final String derivative;
    private final boolean failing;
    private final AtomicInteger calls = new AtomicInteger();

    private StubBackend(String name, Set<SymbolicCapability> capabilities, List<String> solutions,
            String derivative, boolean failing) {
        this.name = name;
        this.capabilities = capabilities;
        this.solutions = solutions;
        this.derivative = derivative;
        this.failing = failing;
    }

    public static StubBackend solving(String name, List<String> solutions) {
        return new StubBackend(name, Set.of(SymbolicCapability.SOLVE), solutions, null, false);
    }

    public static StubBackend differentiating(String name, String derivative) {
        return new StubBackend(name, Set.of(SymbolicCapability.DIFFERENTIATE), List.of(), derivative, false);
    }

    public static StubBackend failing(String name) {
        return new StubBackend(name, Set.of(SymbolicCapability.values()), List.of(), null, true);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<SymbolicCapability> capabilities() {
        return capabilities;
    }

    @Override
    public List<String> solve(String equation, String variable) {
        calls.incrementAndGet();
        if (failing) {
            throw new IllegalStateException(name + " is unavailable");
        }
        return solutions;
    }

    @Override
    public String differentiate(String expression, String variable) {
        calls.incrementAndGet();
        if (failing) {
            throw new IllegalStateException(name + " is unavailable");
        }
        return derivative;
    }
}
