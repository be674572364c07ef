package com.siteledger.exception;

import com.siteledger.dto.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * LEDGER ERROR → HTTP STATUS MAPPING:
 *
 * Exception Type                          | HTTP Status | Error code
 * ----------------------------------------|-------------|------------------------
 * LedgerValidationException               | 400         | VALIDATION_ERROR
 * IllegalArgumentException                | 400         | BAD_REQUEST
 * MethodArgumentNotValidException         | 400         | field → message map
 * Unreadable body / bad query parameter   | 400         | BAD_REQUEST
 * NoSuchElementException                  | 404         | NOT_FOUND
 * InsufficientStockException              | 409         | INSUFFICIENT_STOCK
 * AccountHaltedException                  | 409         | ACCOUNT_HALTED
 * IllegalStateException                   | 409         | CONFLICT
 * DataIntegrityViolationException         | 409         | CONFLICT
 * ConsistencyViolationException           | 500         | CONSISTENCY_VIOLATION
 * ConcurrentLedgerModificationException   | 503         | CONCURRENT_MODIFICATION
 * Exception (fallback)                    | 500         | INTERNAL_SERVER_ERROR
 *
 * RULES:
 * - Ledger exception messages are passed through; they carry the account id and figures
 * - No stack traces in responses
 * - All responses use ErrorResponse shape, except field-level validation maps
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "1";

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST: Invalid input
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Request rejected before the ledger was touched: sign convention, missing
     * fields, due date rules, duplicate account code, bad page size.
     */
    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleValidationError(LedgerValidationException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Handles @Valid/@NotNull/@DecimalMin annotation failures on request DTOs.
     * Returns a field → message map instead of generic error for clearer API feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    /**
     * Malformed JSON, or an unknown transaction type in the body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", "Malformed request body"));
    }

    /**
     * Unknown enum or non-numeric value in a path or query parameter.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST",
                        String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName())));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 NOT FOUND: Resource does not exist
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT: Business rule / state violation
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Issue or consumption larger than the stock on hand. No entry was written.
     */
    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleInsufficientStock(InsufficientStockException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("INSUFFICIENT_STOCK", ex.getMessage()));
    }

    @ExceptionHandler(AccountHaltedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleHalted(AccountHaltedException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("ACCOUNT_HALTED", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", ex.getMessage()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", "Request conflicts with stored ledger data"));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 / 503: Ledger integrity and contention
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * The account's stored state disagrees with a full recompute. The account has
     * been halted; an operator must investigate before writes resume.
     */
    @ExceptionHandler(ConsistencyViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleConsistencyViolation(ConsistencyViolationException ex) {
        log.error("Consistency violation surfaced to client: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse("CONSISTENCY_VIOLATION", ex.getMessage()));
    }

    /**
     * Every retry lost to another writer or timed out waiting for the account lock.
     * Transient: the client may retry.
     */
    @ExceptionHandler({ConcurrentLedgerModificationException.class, ConcurrencyFailureException.class})
    public ResponseEntity<ApiResponses.ErrorResponse> handleConcurrentModification(RuntimeException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(new ApiResponses.ErrorResponse("CONCURRENT_MODIFICATION", ex.getMessage()));
    }

    /**
     * Safety net for any unhandled exception.
     * Message is generic; internal detail stays in the log.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse(
                        "INTERNAL_SERVER_ERROR",
                        "An unexpected error occurred. Please contact support."
                ));
    }
}
