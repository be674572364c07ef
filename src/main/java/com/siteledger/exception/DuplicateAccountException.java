package com.siteledger.exception;

public class DuplicateAccountException extends LedgerValidationException {

    public DuplicateAccountException(String code) {
        super("Account code already registered: " + code);
    }
}
