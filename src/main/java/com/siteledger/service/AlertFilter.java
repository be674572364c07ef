package com.siteledger.service;

import com.siteledger.domain.LedgerKind;

import java.time.LocalDate;

/**
 * Selection for the overdue / low-stock listing. Both parts are optional:
 * no kind means both ledgers, no date means today on the ledger clock.
 */
public final class AlertFilter {

    private static final AlertFilter ALL = new AlertFilter(null, null);

    private final LedgerKind kind;
    private final LocalDate asOf;

    private AlertFilter(LedgerKind kind, LocalDate asOf) {
        this.kind = kind;
        this.asOf = asOf;
    }

    public static AlertFilter all() {
        return ALL;
    }

    public static AlertFilter of(LedgerKind kind, LocalDate asOf) {
        return new AlertFilter(kind, asOf);
    }

    public LedgerKind getKind() {
        return kind;
    }

    public LocalDate getAsOf() {
        return asOf;
    }
}
