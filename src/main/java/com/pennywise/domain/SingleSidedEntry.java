package com.pennywise.domain;

import java.math.BigDecimal;

/**
 * A ledger entry that moves money on exactly one account (Expense, Income).
 */
public interface SingleSidedEntry {

    Long getId();

    Account getAccount();

    BigDecimal getAmount();

    User getUser();
}
