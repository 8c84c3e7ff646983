package com.mathrok.engine.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Backends in priority order. Each call is offered to every backend that declares the capability,
 * first to last, until one returns an acceptable value.
 */
public class SymbolicBackendChain {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicBackendChain.class);

    private final List<SymbolicBackend> backends;

    public SymbolicBackendChain(List<SymbolicBackend> backends) {
        this.backends = List.copyOf(backends);
    }

    public static SymbolicBackendChain empty() {
        return new SymbolicBackendChain(List.of());
    }

    public List<SymbolicBackend> getBackends() {
        return backends;
    }

    public boolean isEmpty() {
        return backends.isEmpty();
    }

    public boolean supports(SymbolicCapability capability) {
        return backends.stream().anyMatch(backend -> backend.supports(capability));
    }

    public Optional<BackendResult<List<String>>> solve(String equation, String variable) {
        return attempt(SymbolicCapability.SOLVE, backend -> backend.solve(equation, variable),
                solutions -> solutions != null && !solutions.isEmpty());
    }

    public Optional<BackendResult<String>> differentiate(String expression, String variable) {
        return attempt(SymbolicCapability.DIFFERENTIATE, backend -> backend.differentiate(expression, variable));
    }

    public Optional<BackendResult<String>> integrate(String expression, String variable) {
        return attempt(SymbolicCapability.INTEGRATE, backend -> backend.integrate(expression, variable));
    }

    public Optional<BackendResult<String>> factor(String expression, String variable) {
        return attempt(SymbolicCapability.FACTOR, backend -> backend.factor(expression, variable));
    }

    public Optional<BackendResult<String>> expand(String expression, String variable) {
        return attempt(SymbolicCapability.EXPAND, backend -> backend.expand(expression, variable));
    }

    public Optional<BackendResult<String>> simplify(String expression, String variable) {
        return attempt(SymbolicCapability.SIMPLIFY, backend -> backend.simplify(expression, variable));
    }

    private <T> Optional<BackendResult<T>> attempt(SymbolicCapability capability,
            Function<SymbolicBackend, T> operation) {
        return attempt(capability, operation, value -> value != null && !value.toString().isBlank());
    }

    private <T> Optional<BackendResult<T>> attempt(SymbolicCapability capability,
            Function<SymbolicBackend, T> operation, Predicate<T> acceptable) {
        for (SymbolicBackend backend : backends) {
            if (!backend.supports(capability)) {
                continue;
            }
            try {
                T value = operation.apply(backend);
                if (acceptable.test(value)) {
                    logger.debug("Backend {} handled {}", backend.name(), capability);
                    return Optional.of(new BackendResult<>(backend.name(), value));
                }
                logger.debug("Backend {} returned no result for {}", backend.name(), capability);
            } catch (RuntimeException e) {
                logger.warn("Backend {} failed on {}: {}", backend.name(), capability, e.getMessage());
            }
        }
        return Optional.empty();
    }
}
