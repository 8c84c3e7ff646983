package com.mathrok.engine.controller;

import com.mathrok.engine.dto.ErrorDetail;
import com.mathrok.engine.dto.SolveRequest;
import com.mathrok.engine.dto.SolveResponse;
import com.mathrok.engine.exception.MathException;
import com.mathrok.engine.service.EquationSolverService;
import com.mathrok.engine.solver.SolveResult;

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
public class SolveController {

    private static final Logger logger = LoggerFactory.getLogger(SolveController.class);

    private final EquationSolverService solverService;

    public SolveController(EquationSolverService solverService) {
        this.solverService = solverService;
    }

    @PostMapping("/solve")
    public ResponseEntity<SolveResponse> solve(@Valid @RequestBody SolveRequest request) {
        logger.info("Received solve request (length: {} chars, variable: {})",
                request.expression().length(), request.variable());
        long start = System.currentTimeMillis();

        try {
            SolveResult result = solverService.solve(request.expression(), request.variable(), request.bindings(),
                    request.config());
            long elapsed = System.currentTimeMillis() - start;

            logger.info("Solve completed in {} ms - Type: {}, Solutions: {}",
                    elapsed, result.equationType(), result.solutions().size());
            return ResponseEntity.ok(SolveResponse.success(result, elapsed));

        } catch (MathException e) {
            logger.info("Solve rejected - {}: {}", e.getType(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(SolveResponse.error(ErrorDetail.from(e), System.currentTimeMillis() - start));

        } catch (Exception e) {
            logger.error("Unexpected error while solving: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(SolveResponse.error(ErrorDetail.internal("Internal server error: " + e.getMessage()),
                            System.currentTimeMillis() - start));
        }
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SolveResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = RequestErrors.describe(e);
        logger.warn("Validation error: {}", message);
        return ResponseEntity.badRequest().body(SolveResponse.error(ErrorDetail.invalidRequest(message), 0));
    }
}
