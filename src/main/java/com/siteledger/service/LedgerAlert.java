package com.siteledger.service;

import java.util.List;

/**
 * An account that needs attention as of a date: an overdue supplier, or a
 * material that is low on stock or at its reorder point.
 */
public final class LedgerAlert {

    public enum Reason {
        OVERDUE,
        LOW_STOCK,
        REORDER
    }

    private final AccountSummary summary;
    private final List<Reason> reasons;
    private final List<OverdueEntry> overdueEntries;

    LedgerAlert(AccountSummary summary, List<Reason> reasons, List<OverdueEntry> overdueEntries) {
        this.summary = summary;
        this.reasons = List.copyOf(reasons);
        this.overdueEntries = List.copyOf(overdueEntries);
    }

    public AccountSummary getSummary() {
        return summary;
    }

    public List<Reason> getReasons() {
        return reasons;
    }

    /**
     * Empty unless the alert is for an overdue supplier.
     */
    public List<OverdueEntry> getOverdueEntries() {
        return overdueEntries;
    }
}
