package com.pennywise.exception;

import java.math.BigDecimal;

/**
 * From-account of a transfer cannot cover the amount.
 * Account balances are unchanged when this is thrown.
 */
public class InsufficientFundsException extends IllegalStateException {

    private final Long accountId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(Long accountId, BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient funds in account %d: available %s, requested %s",
                accountId, available, requested));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }

    public Long getAccountId() {
        return accountId;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
