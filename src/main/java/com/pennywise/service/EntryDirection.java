package com.pennywise.service;

import java.math.BigDecimal;

/**
 * Sign a single-sided entry applies to its account.
 */
public enum EntryDirection {

    /** Expense: money leaves the account. */
    DEBIT,

    /** Income: money enters the account. */
    CREDIT;

    public BigDecimal signed(BigDecimal amount) {
        return this == DEBIT ? amount.negate() : amount;
    }
}
