package com.siteledger.service;

import java.math.BigDecimal;

/**
 * One account and amount of a batch recording.
 */
public final class BatchLine {

    private final Long accountId;
    private final BigDecimal amount;

    public BatchLine(Long accountId, BigDecimal amount) {
        this.accountId = accountId;
        this.amount = amount;
    }

    public Long getAccountId() {
        return accountId;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
