package com.mathrok.engine.service;

import com.mathrok.engine.ast.AstBuilder;
import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExpressionPrinter;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.cache.ResultCache;
import com.mathrok.engine.config.ConfigOverrides;
import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.config.MathEngineProperties;
import com.mathrok.engine.exception.LexException;
import com.mathrok.engine.exception.ParseException;
import com.mathrok.engine.exception.ValidationException;
import com.mathrok.engine.lexer.InputNormalizer;
import com.mathrok.engine.lexer.MathLexer;
import com.mathrok.engine.lexer.Token;
import com.mathrok.engine.simplify.Simplifier;
import com.mathrok.engine.solver.StepOperation;
import com.mathrok.engine.solver.StepTrace;
import com.mathrok.engine.validation.ExpressionValidator;
import com.mathrok.engine.validation.Severity;
import com.mathrok.engine.validation.ValidationIssue;
import com.mathrok.engine.validation.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Turns expression text into a validated tree: normalize, tokenize, validate, build.
 */
@Service
public class ExpressionParserService {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionParserService.class);

    private final MathConfig defaults;
    private final ExpressionValidator validator;
    private final Simplifier simplifier;
    private final ResultCache cache;
    private final Duration cacheTtl;

    public ExpressionParserService(MathConfig defaults, MathEngineProperties properties,
            ExpressionValidator validator, Simplifier simplifier, ResultCache cache) {
        this.defaults = defaults;
        this.validator = validator;
        this.simplifier = simplifier;
        this.cache = cache;
        this.cacheTtl = Duration.ofSeconds(properties.cacheTtlSeconds());
    }

    public MathConfig resolveConfig(ConfigOverrides overrides) {
        return defaults.withOverrides(overrides);
    }

    public ParseResult parse(String expression, ConfigOverrides overrides) {
        return parse(expression, resolveConfig(overrides));
    }

    /**
     * @throws com.mathrok.engine.exception.MathException on lexing, validation or syntax errors
     */
    public ParseResult parse(String expression, MathConfig config) {
        String normalized = normalize(expression, config);
        String cacheKey = "parse|" + normalized + "|" + config.fingerprint();
        if (config.useCache()) {
            Optional<ParseResult> cached = cache.get(cacheKey, ParseResult.class);
            if (cached.isPresent()) {
                logger.debug("Parse cache hit for '{}'", normalized);
                return cached.get();
            }
        }

        StepTrace trace = new StepTrace();
        trace.add("normalize", StepOperation.PARSING,
                "Normalize input",
                expression,
                normalized,
                "Rewrite math symbols to their ASCII form and collapse whitespace");

        List<Token> tokens = tokenize(normalized, config);
        trace.add("tokenize", StepOperation.PARSING,
                "Split the expression into tokens",
                normalized,
                (tokens.size() - 1) + " tokens",
                config.implicitMultiplication()
                        ? "Juxtaposed operands such as 2x are read as products"
                        : "Implicit multiplication is disabled");

        ValidationResult validation = validator.validate(tokens, config);
        if (!validation.valid()) {
            logger.info("Validation failed for '{}': {}", normalized, validation.errors().get(0).message());
            throw new ValidationException(validation);
        }
        trace.add("validate", StepOperation.ANALYSIS,
                "Validate the token stream",
                normalized,
                validation.warnings().isEmpty() ? "valid" : "valid with " + validation.warnings().size() + " warning(s)",
                "Check grouping, operator placement, function calls, numbers and variable names");

        ExprNode ast = new AstBuilder(tokens).build();
        String printed = ExpressionPrinter.print(ast);
        trace.add("build_ast", StepOperation.PARSING,
                "Build the expression tree",
                normalized,
                printed,
                "Operators are grouped by precedence; ^ groups to the right");

        String simplified = null;
        if (config.autoSimplify()) {
            simplified = ExpressionPrinter.print(simplifier.simplify(ast));
            if (!simplified.equals(printed)) {
                trace.add("simplify", StepOperation.SIMPLIFICATION,
                        "Simplify the expression",
                        printed,
                        simplified,
                        "Fold constants and remove identity operations");
            }
        }

        ParseResult result = new ParseResult(expression, normalized, ast, Expressions.variables(ast),
                Expressions.functions(ast), Expressions.complexity(ast), validation, trace.steps(), simplified);
        logger.debug("Parsed '{}' with {} variable(s), complexity {}", normalized, result.variables().size(),
                result.complexity());

        if (config.useCache()) {
            cache.put(cacheKey, result, cacheTtl);
        }
        return result;
    }

    /**
     * Runs only the validation rules. Lexing failures are reported as a single error instead of thrown.
     */
    public ValidationResult validate(String expression, MathConfig config) {
        String normalized;
        List<Token> tokens;
        try {
            normalized = normalize(expression, config);
            tokens = tokenize(normalized, config);
        } catch (LexException e) {
            return ValidationResult.of(List.of(new ValidationIssue(Severity.ERROR, e.getMessage(), e.getSpan(),
                    e.getSuggestions())));
        } catch (ParseException e) {
            return ValidationResult.of(List.of(new ValidationIssue(Severity.ERROR, e.getMessage(), null,
                    e.getSuggestions())));
        }
        return validator.validate(tokens, config);
    }

    public String normalize(String expression, MathConfig config) {
        if (expression != null && expression.length() > config.maxExpressionLength()) {
            throw ParseException.tooLong(expression.length(), config.maxExpressionLength());
        }
        String normalized = InputNormalizer.normalize(expression);
        if (normalized.isEmpty()) {
            throw ParseException.emptyExpression();
        }
        return normalized;
    }

    private List<Token> tokenize(String normalized, MathConfig config) {
        List<Token> tokens = new MathLexer(normalized, config.customFunctions()).tokenize();
        return config.implicitMultiplication() ? InputNormalizer.insertImplicitMultiplication(tokens) : tokens;
    }
}
