package com.siteledger.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Result of comparing an account's full recompute with its incrementally
 * maintained state. Reconciliation only reports; it never corrects.
 */
public final class ReconciliationReport {

    private final Long accountId;
    private final Instant checkedAt;
    private final BigDecimal recomputedBalance;
    private final BigDecimal cachedBalance;
    private final BigDecimal latestBalanceAfter;
    private final long latestEntryNumber;
    private final long cachedEntryNumber;
    private final long entryCount;
    private final List<String> divergences;
    private final boolean halted;

    public ReconciliationReport(Long accountId, Instant checkedAt, BigDecimal recomputedBalance,
                                BigDecimal cachedBalance, BigDecimal latestBalanceAfter, long latestEntryNumber,
                                long cachedEntryNumber, long entryCount, List<String> divergences, boolean halted) {
        this.accountId = accountId;
        this.checkedAt = checkedAt;
        this.recomputedBalance = recomputedBalance;
        this.cachedBalance = cachedBalance;
        this.latestBalanceAfter = latestBalanceAfter;
        this.latestEntryNumber = latestEntryNumber;
        this.cachedEntryNumber = cachedEntryNumber;
        this.entryCount = entryCount;
        this.divergences = List.copyOf(divergences);
        this.halted = halted;
    }

    public Long getAccountId() {
        return accountId;
    }

    public Instant getCheckedAt() {
        return checkedAt;
    }

    public boolean isConsistent() {
        return divergences.isEmpty();
    }

    public BigDecimal getRecomputedBalance() {
        return recomputedBalance;
    }

    public BigDecimal getCachedBalance() {
        return cachedBalance;
    }

    /**
     * balanceAfter of the latest entry; zero for an empty ledger.
     */
    public BigDecimal getLatestBalanceAfter() {
        return latestBalanceAfter;
    }

    public long getLatestEntryNumber() {
        return latestEntryNumber;
    }

    public long getCachedEntryNumber() {
        return cachedEntryNumber;
    }

    public long getEntryCount() {
        return entryCount;
    }

    public List<String> getDivergences() {
        return divergences;
    }

    /**
     * Whether the account is halted after this check.
     */
    public boolean isHalted() {
        return halted;
    }
}
