package com.siteledger.service;

import com.siteledger.domain.DerivedStatus;
import com.siteledger.domain.LedgerEntry;

/**
 * A ledger entry as shown in a history view, with its derived status.
 */
public final class EntryView {

    private final LedgerEntry entry;
    private final DerivedStatus status;

    public EntryView(LedgerEntry entry, DerivedStatus status) {
        this.entry = entry;
        this.status = status;
    }

    public LedgerEntry getEntry() {
        return entry;
    }

    public DerivedStatus getStatus() {
        return status;
    }
}
