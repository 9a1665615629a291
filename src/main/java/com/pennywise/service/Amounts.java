package com.pennywise.service;

import com.pennywise.exception.LedgerValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary input checks shared by every mutation path.
 */
final class Amounts {

    /** Entry amount columns are DECIMAL(10,2). */
    private static final int MAX_INTEGER_DIGITS = 8;

    private Amounts() {
    }

    /**
     * Validate an entry amount: present, positive, at most 2 decimal places, fits the column.
     *
     * @return the amount with scale 2
     * @throws LedgerValidationException if any check fails
     */
    static BigDecimal requireValid(BigDecimal amount, String field) {
        if (amount == null) {
            throw new LedgerValidationException(field, field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new LedgerValidationException(field, field + " must be positive. Got: " + amount.toPlainString());
        }
        BigDecimal scaled;
        try {
            scaled = amount.setScale(2, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new LedgerValidationException(field,
                    field + " must have at most 2 decimal places. Got: " + amount.toPlainString());
        }
        if (scaled.precision() - scaled.scale() > MAX_INTEGER_DIGITS) {
            throw new LedgerValidationException(field, field + " is too large. Got: " + amount.toPlainString());
        }
        return scaled;
    }
}
