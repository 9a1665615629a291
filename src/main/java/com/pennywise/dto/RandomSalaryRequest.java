package com.pennywise.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Salary deposit with an amount drawn from [min, max].
 */
public record RandomSalaryRequest(
        @NotNull(message = "Account ID is required") Long accountId,
        @NotNull(message = "min is required")
        @DecimalMin(value = "0.01", message = "min must be at least 0.01") BigDecimal min,
        @NotNull(message = "max is required")
        @DecimalMin(value = "0.01", message = "max must be at least 0.01") BigDecimal max) {
}
