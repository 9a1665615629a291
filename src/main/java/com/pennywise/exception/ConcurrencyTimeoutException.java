package com.pennywise.exception;

/**
 * Account locks could not be acquired in time (lock wait timeout or deadlock victim).
 * Transient: the whole mutation may be retried from scratch.
 */
public class ConcurrencyTimeoutException extends RuntimeException {

    public ConcurrencyTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
