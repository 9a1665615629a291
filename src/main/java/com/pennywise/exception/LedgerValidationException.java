package com.pennywise.exception;

/**
 * Rejected input: ownership mismatch, non-positive amount, system-account misuse,
 * duplicate name, identical from/to accounts, malformed report period.
 *
 * Always raised before any balance is touched, or inside a transaction that
 * is rolled back as a whole.
 */
public class LedgerValidationException extends IllegalArgumentException {

    private final String field;

    public LedgerValidationException(String message) {
        this(null, message);
    }

    public LedgerValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Name of the offending request field, or null for object-level errors.
     */
    public String getField() {
        return field;
    }
}
