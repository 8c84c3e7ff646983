package com.mathrok.engine.dto;

import com.mathrok.engine.config.ConfigOverrides;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * @param variable target to solve for; chosen automatically when absent
 * @param bindings values for the other variables of the equation
 */
public record SolveRequest(
    @NotBlank(message = "Expression cannot be blank")
    @Size(max = 100_000, message = "Expression cannot exceed 100,000 characters")
    String expression,

    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*", message = "Variable must be an identifier")
    String variable,

    Map<String, @NotNull(message = "Binding values cannot be null") Double> bindings,

    @Valid
    ConfigOverrides config
) {
}
