package com.mathrok.engine.service;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.cache.ResultCache;
import com.mathrok.engine.classify.Classification;
import com.mathrok.engine.classify.EquationClassifier;
import com.mathrok.engine.config.ConfigOverrides;
import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.config.MathEngineProperties;
import com.mathrok.engine.exception.ComputationException;
import com.mathrok.engine.solver.SolveResult;
import com.mathrok.engine.solver.SolverDispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Service
public class EquationSolverService {

    private static final Logger logger = LoggerFactory.getLogger(EquationSolverService.class);

    private final ExpressionParserService parserService;
    private final EquationClassifier classifier;
    private final SolverDispatcher dispatcher;
    private final ResultCache cache;
    private final Duration cacheTtl;

    public EquationSolverService(ExpressionParserService parserService, EquationClassifier classifier,
            SolverDispatcher dispatcher, ResultCache cache, MathEngineProperties properties) {
        this.parserService = parserService;
        this.classifier = classifier;
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.cacheTtl = Duration.ofSeconds(properties.cacheTtlSeconds());
    }

    public SolveResult solve(String expression, String variable, Map<String, Double> bindings,
            ConfigOverrides overrides) {
        return solve(expression, variable, bindings, parserService.resolveConfig(overrides));
    }

    /**
     * @param variable target to solve for, or {@code null} to let the classifier choose
     * @param bindings values for the other names in the equation; may be {@code null}
     */
    public SolveResult solve(String expression, String variable, Map<String, Double> bindings, MathConfig config) {
        Map<String, Double> bound = bindings == null ? Map.of() : new TreeMap<>(bindings);
        for (Map.Entry<String, Double> binding : bound.entrySet()) {
            if (binding.getValue() == null) {
                throw new ComputationException("Binding for '" + binding.getKey() + "' has no value",
                        List.of("Give '" + binding.getKey() + "' a number or remove it from the bindings"));
            }
        }
        if (variable != null && bound.containsKey(variable.trim())) {
            throw new ComputationException("Variable '" + variable.trim() + "' is both the target and bound to a value",
                    List.of("Remove '" + variable.trim() + "' from the bindings"));
        }

        String cacheKey = "solve|" + parserService.normalize(expression, config) + "|" + variable + "|" + bound
                + "|" + config.fingerprint();
        if (config.useCache()) {
            Optional<SolveResult> cached = cache.get(cacheKey, SolveResult.class);
            if (cached.isPresent()) {
                logger.debug("Solve cache hit for '{}'", expression);
                return cached.get();
            }
        }

        ParseResult parsed = parserService.parse(expression, config);
        // bound names are numbers by the time the dispatcher solves
        ExprNode substituted = Expressions.bindNumbers(parsed.ast(), bound);
        Classification classification = classifier.classify(substituted, variable, bound.keySet());
        logger.info("Solving '{}' for {} as {}", parsed.normalized(), classification.variable(),
                classification.type());

        SolveResult result = dispatcher.dispatch(parsed.ast(), classification, bound, config);
        logger.info("Solved '{}': {} solution(s)", parsed.normalized(), result.solutions().size());

        if (config.useCache()) {
            cache.put(cacheKey, result, cacheTtl);
        }
        return result;
    }
}
