package com.siteledger.service;

/**
 * Published when reconciliation finds an account whose stored state disagrees
 * with a full recompute. The account has already been halted when listeners run.
 */
public class LedgerInconsistencyEvent {

    private final ReconciliationReport report;

    public LedgerInconsistencyEvent(ReconciliationReport report) {
        this.report = report;
    }

    public Long getAccountId() {
        return report.getAccountId();
    }

    public ReconciliationReport getReport() {
        return report;
    }

    @Override
    public String toString() {
        return "LedgerInconsistencyEvent{accountId=" + report.getAccountId()
                + ", divergences=" + report.getDivergences() + '}';
    }
}
