package com.siteledger.exception;

/**
 * The incrementally maintained balance disagrees with a full recompute, or the
 * stored entry chain no longer satisfies the running-balance invariant.
 *
 * Never retried and never corrected automatically: it points at a concurrency
 * or logic bug upstream, so the affected account is halted instead.
 */
public class ConsistencyViolationException extends IllegalStateException {

    private final Long accountId;

    public ConsistencyViolationException(Long accountId, String detail) {
        super(String.format("Ledger inconsistency on account %d: %s", accountId, detail));
        this.accountId = accountId;
    }

    public Long getAccountId() {
        return accountId;
    }
}
