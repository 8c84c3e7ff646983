package com.mathrok.engine.config;

import com.mathrok.engine.backend.SymbolicBackend;
import com.mathrok.engine.backend.SymbolicBackendChain;
import com.mathrok.engine.cache.InMemoryResultCache;
import com.mathrok.engine.cache.ResultCache;
import com.mathrok.engine.classify.EquationClassifier;
import com.mathrok.engine.simplify.Simplifier;
import com.mathrok.engine.solver.DomainAnalyzer;
import com.mathrok.engine.solver.GeneralizedSolver;
import com.mathrok.engine.solver.LinearSolver;
import com.mathrok.engine.solver.QuadraticSolver;
import com.mathrok.engine.solver.SolverDispatcher;
import com.mathrok.engine.validation.ExpressionValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the parsing and solving pipeline. The pipeline classes themselves carry no Spring annotations.
 * Symbolic backends are picked up from the context in {@code @Order} order.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public MathConfig defaultMathConfig(MathEngineProperties properties) {
        return properties.toMathConfig();
    }

    @Bean
    public ExpressionValidator expressionValidator() {
        return new ExpressionValidator();
    }

    @Bean
    public Simplifier simplifier() {
        return new Simplifier();
    }

    @Bean
    public EquationClassifier equationClassifier() {
        return new EquationClassifier();
    }

    @Bean
    public SymbolicBackendChain symbolicBackendChain(ObjectProvider<SymbolicBackend> backends) {
        List<SymbolicBackend> ordered = backends.orderedStream().toList();
        logger.info("Symbolic backends in priority order: {}",
                ordered.stream().map(SymbolicBackend::name).toList());
        return new SymbolicBackendChain(ordered);
    }

    @Bean
    public SolverDispatcher solverDispatcher(SymbolicBackendChain backends, Simplifier simplifier) {
        LinearSolver linear = new LinearSolver();
        QuadraticSolver quadratic = new QuadraticSolver(linear);
        GeneralizedSolver generalized = new GeneralizedSolver(quadratic, backends);
        return new SolverDispatcher(linear, quadratic, generalized, new DomainAnalyzer(), simplifier);
    }

    @Bean
    public ResultCache resultCache(MathEngineProperties properties) {
        return new InMemoryResultCache(properties.cacheMaxEntries());
    }
}
