package com.mathrok.engine.dto;

import com.mathrok.engine.config.ConfigOverrides;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ParseRequest(
    @NotBlank(message = "Expression cannot be blank")
    @Size(max = 100_000, message = "Expression cannot exceed 100,000 characters")
    String expression,

    @Valid
    ConfigOverrides config
) {
}
