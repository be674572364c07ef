package com.siteledger.service;

import java.math.BigDecimal;

/**
 * Outcome of replaying an account's entries in sequence order and checking
 * that entry numbers run 1, 2, 3... and every balanceAfter equals the previous
 * balanceAfter plus the entry's delta.
 */
public final class ChainReplay {

    private final boolean intact;
    private final long entriesChecked;
    private final Long brokenAtEntry;
    private final String detail;
    private final BigDecimal replayedBalance;

    private ChainReplay(boolean intact, long entriesChecked, Long brokenAtEntry, String detail,
                        BigDecimal replayedBalance) {
        this.intact = intact;
        this.entriesChecked = entriesChecked;
        this.brokenAtEntry = brokenAtEntry;
        this.detail = detail;
        this.replayedBalance = replayedBalance;
    }

    static ChainReplay intact(long entriesChecked, BigDecimal replayedBalance) {
        return new ChainReplay(true, entriesChecked, null, null, replayedBalance);
    }

    static ChainReplay broken(long entriesChecked, long brokenAtEntry, String detail, BigDecimal replayedBalance) {
        return new ChainReplay(false, entriesChecked, brokenAtEntry, detail, replayedBalance);
    }

    public boolean isIntact() {
        return intact;
    }

    public long getEntriesChecked() {
        return entriesChecked;
    }

    /**
     * Entry number of the first break, or null when intact.
     */
    public Long getBrokenAtEntry() {
        return brokenAtEntry;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Sum of deltas up to and including the last checked entry.
     */
    public BigDecimal getReplayedBalance() {
        return replayedBalance;
    }
}
