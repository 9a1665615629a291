package com.pennywise.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Salary deposit into one of the caller's accounts.
 */
public record SalaryRequest(
        @NotNull(message = "Account ID is required") Long accountId,
        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Amount must be at least 0.01") BigDecimal amount) {
}
