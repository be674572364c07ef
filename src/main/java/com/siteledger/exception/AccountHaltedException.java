package com.siteledger.exception;

/**
 * Writes to the account are stopped after a consistency violation and stay
 * stopped until an operator resumes the account.
 */
public class AccountHaltedException extends IllegalStateException {

    private final Long accountId;

    public AccountHaltedException(Long accountId, String reason) {
        super(String.format("Account %d is halted pending investigation: %s", accountId, reason));
        this.accountId = accountId;
    }

    public Long getAccountId() {
        return accountId;
    }
}
