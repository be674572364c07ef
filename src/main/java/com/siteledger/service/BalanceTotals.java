package com.siteledger.service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregates over an account's full history. Summary and list views both read
 * these, so their figures cannot drift apart.
 */
public final class BalanceTotals {

    public static final BalanceTotals EMPTY =
            new BalanceTotals(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, 0);

    private final long entryCount;
    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;
    private final BigDecimal balance;
    private final Instant lastOccurredAt;
    private final long lastEntryNumber;

    public BalanceTotals(long entryCount, BigDecimal totalDebits, BigDecimal totalCredits,
                         BigDecimal balance, Instant lastOccurredAt, long lastEntryNumber) {
        this.entryCount = entryCount;
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
        this.balance = balance;
        this.lastOccurredAt = lastOccurredAt;
        this.lastEntryNumber = lastEntryNumber;
    }

    public long getEntryCount() {
        return entryCount;
    }

    /**
     * Sum of positive deltas.
     */
    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    /**
     * Sum of negative deltas, as a magnitude.
     */
    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    /**
     * Latest business date across all entries; null without entries.
     */
    public Instant getLastOccurredAt() {
        return lastOccurredAt;
    }

    public long getLastEntryNumber() {
        return lastEntryNumber;
    }
}
