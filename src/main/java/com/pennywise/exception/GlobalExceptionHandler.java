package com.pennywise.exception;

import com.pennywise.dto.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                    | HTTP Status | When
 * ----------------------------------|-------------|------------------------------------------
 * LedgerValidationException         | 400         | Ownership, amount, system account, period
 * MethodArgumentNotValidException   | 400         | Bean Validation failure on DTO fields
 * Malformed body / query parameter  | 400         | Unreadable JSON, wrong type, missing param
 * AuthenticationException           | 401         | Wrong username or password
 * ResourceNotFoundException         | 404         | Account / category / entry not found
 * InsufficientFundsException        | 409         | Transfer would overdraw the from-account
 * DataIntegrityViolationException   | 409         | Unique name constraint hit by a race
 * IllegalStateException             | 409         | Other state conflicts
 * ConcurrencyTimeoutException       | 503         | Account locks not acquired in time
 * Exception (fallback)              | 500         | Unexpected system errors
 *
 * RULES:
 * - No stack traces in responses
 * - All responses use ErrorResponse shape, except the field-level validation map
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleValidation(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    /**
     * Handles @Valid annotation failures on request DTOs.
     * Returns a field → message map instead of a generic error.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleBeanValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError
                    ? fieldError.getField()
                    : error.getObjectName();
            errors.putIfAbsent(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponses.ErrorResponse> handleMalformedRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request: " + ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 401 / 404 / 405
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleAuthentication(AuthenticationException ex) {
        return error(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", ex.getMessage());
    }

    /**
     * ResourceNotFoundException is a NoSuchElementException; both land here.
     * Entries owned by someone else and system accounts are reported exactly like missing ones.
     */
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", "No endpoint " + ex.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * The transaction was rolled back and the previous transfer (if any)
     * was re-applied, so balances are exactly as before the request.
     */
    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleInsufficientFunds(InsufficientFundsException ex) {
        return error(HttpStatus.CONFLICT, "INSUFFICIENT_FUNDS", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        return error(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage());
    }

    /**
     * Two concurrent requests created the same account or category name and
     * the second one reached the unique constraint after passing the service check.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.CONFLICT, "CONFLICT", "Request conflicts with existing data");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 503 SERVICE UNAVAILABLE, transient; the client retries the whole request
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(ConcurrencyTimeoutException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleConcurrencyTimeout(ConcurrencyTimeoutException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "CONCURRENCY_TIMEOUT", ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 INTERNAL SERVER ERROR
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Safety net for any unhandled exception.
     * Message is deliberately generic, internal detail must not leak to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please contact support.");
    }

    private ResponseEntity<ApiResponses.ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiResponses.ErrorResponse(code, message));
    }
}
