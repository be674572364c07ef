package com.siteledger.exception;

import java.util.NoSuchElementException;

/**
 * Unknown account id. Maps to 404.
 */
public class AccountNotFoundException extends NoSuchElementException {

    private final Long accountId;

    public AccountNotFoundException(Long accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }

    public Long getAccountId() {
        return accountId;
    }
}
