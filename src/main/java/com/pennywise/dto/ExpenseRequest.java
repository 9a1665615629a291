package com.pennywise.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for creating and updating expenses.
 * On update, omitted (null) fields keep their stored value.
 */
public class ExpenseRequest {

    @NotNull(groups = OnCreate.class, message = "Account ID is required")
    private Long accountId;

    @NotNull(groups = OnCreate.class, message = "Category ID is required")
    private Long categoryId;

    @NotNull(groups = OnCreate.class, message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @Digits(integer = 8, fraction = 2, message = "Amount must have at most 2 decimal places")
    private BigDecimal amount;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    public ExpenseRequest() {
    }

    public ExpenseRequest(Long accountId, Long categoryId, BigDecimal amount, String description) {
        this.accountId = accountId;
        this.categoryId = categoryId;
        this.amount = amount;
        this.description = description;
    }

    public Long getAccountId() {
        return accountId;
    }

    public void setAccountId(Long accountId) {
        this.accountId = accountId;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
