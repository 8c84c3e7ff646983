package com.mathrok.engine.controller;

import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.dto.ErrorDetail;
import com.mathrok.engine.dto.ParseRequest;
import com.mathrok.engine.dto.ParseResponse;
import com.mathrok.engine.dto.ValidationResponse;
import com.mathrok.engine.exception.MathException;
import com.mathrok.engine.service.ExpressionParserService;
import com.mathrok.engine.service.ParseResult;
import com.mathrok.engine.validation.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class ParseController {

    private static final Logger logger = LoggerFactory.getLogger(ParseController.class);

    private final ExpressionParserService parserService;

    public ParseController(ExpressionParserService parserService) {
        this.parserService = parserService;
    }

    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
        logger.info("Received parse request (length: {} chars)", request.expression().length());
        long start = System.currentTimeMillis();

        try {
            ParseResult result = parserService.parse(request.expression(), request.config());
            long elapsed = System.currentTimeMillis() - start;

            logger.info("Parse completed in {} ms - variables: {}", elapsed, result.variables());
            return ResponseEntity.ok(ParseResponse.success(result, elapsed));

        } catch (MathException e) {
            logger.info("Parse rejected - {}: {}", e.getType(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(ParseResponse.error(ErrorDetail.from(e), System.currentTimeMillis() - start));

        } catch (Exception e) {
            logger.error("Unexpected error during parsing: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(ParseResponse.error(ErrorDetail.internal("Internal server error: " + e.getMessage()),
                            System.currentTimeMillis() - start));
        }
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody ParseRequest request) {
        long start = System.currentTimeMillis();

        try {
            MathConfig config = parserService.resolveConfig(request.config());
            ValidationResult result = parserService.validate(request.expression(), config);

            logger.debug("Validation completed: valid={}, errors={}, warnings={}",
                    result.valid(), result.errors().size(), result.warnings().size());
            return ResponseEntity.ok(ValidationResponse.from(result, System.currentTimeMillis() - start));

        } catch (MathException e) {
            logger.info("Validation rejected - {}: {}", e.getType(), e.getMessage());
            return ResponseEntity.badRequest().body(ValidationResponse.invalid(e.getMessage()));

        } catch (Exception e) {
            logger.error("Unexpected error during validation", e);
            return ResponseEntity.internalServerError()
                    .body(ValidationResponse.invalid("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Mathrok engine is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ParseResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = RequestErrors.describe(e);
        logger.warn("Validation error: {}", message);
        return ResponseEntity.badRequest().body(ParseResponse.error(ErrorDetail.invalidRequest(message), 0));
    }
}
