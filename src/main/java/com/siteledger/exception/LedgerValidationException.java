package com.siteledger.exception;

/**
 * Bad input, rejected before the ledger store is touched.
 * Maps to 400 through {@link GlobalExceptionHandler}.
 */
public class LedgerValidationException extends IllegalArgumentException {

    public LedgerValidationException(String message) {
        super(message);
    }
}
