package com.siteledger.exception;

/**
 * Another writer appended to the account between our read of the latest entry
 * and our write. Retryable; surfaces to callers only once the recorder has used
 * up its attempts.
 */
public class ConcurrentLedgerModificationException extends IllegalStateException {

    private final Long accountId;

    public ConcurrentLedgerModificationException(Long accountId, String message) {
        super(message);
        this.accountId = accountId;
    }

    public ConcurrentLedgerModificationException(Long accountId, String message, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
    }

    public Long getAccountId() {
        return accountId;
    }
}
