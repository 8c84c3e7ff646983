package com.mathrok.engine.backend;

import java.util.List;
import java.util.Set;

/**
 * An external computer algebra system. Expressions travel as infix text in the engine's own syntax.
 * <p>
 * Implementations declare what they can do through {@link #capabilities()}; the chain never calls an
 * operation outside that set. Any runtime exception thrown by an operation is treated as "not available"
 * and the next backend is tried.
 */
public interface SymbolicBackend {

    String name();

    Set<SymbolicCapability> capabilities();

    default boolean supports(SymbolicCapability capability) {
        return capabilities().contains(capability);
    }

    default String differentiate(String expression, String variable) {
        throw new UnsupportedOperationException(name() + " cannot differentiate");
    }

    default String integrate(String expression, String variable) {
        throw new UnsupportedOperationException(name() + " cannot integrate");
    }

    default String factor(String expression, String variable) {
        throw new UnsupportedOperationException(name() + " cannot factor");
    }

    default String expand(String expression, String variable) {
        throw new UnsupportedOperationException(name() + " cannot expand");
    }

    default String simplify(String expression, String variable) {
        throw new UnsupportedOperationException(name() + " cannot simplify");
    }

    /**
     * Closed-form solutions of {@code equation} for {@code variable}, one value per entry.
     */
    default List<String> solve(String equation, String variable) {
        throw new UnsupportedOperationException(name() + " cannot solve");
    }
}
