package com.siteledger.exception;

import java.math.BigDecimal;

/**
 * An inventory decrease would take the quantity on hand below zero and the
 * caller did not flag the movement as an allowed backorder.
 */
public class InsufficientStockException extends IllegalStateException {

    private final Long accountId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientStockException(Long accountId, BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient stock on account %d. Available: %s, requested: %s",
                accountId, available.stripTrailingZeros().toPlainString(),
                requested.stripTrailingZeros().toPlainString()));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }

    public Long getAccountId() {
        return accountId;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
