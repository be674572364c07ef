package com.siteledger.service;

import com.siteledger.domain.LedgerEntry;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A debit entry with an unpaid remainder whose due date has passed.
 */
public final class OverdueEntry {

    private final long entryNumber;
    private final Instant occurredAt;
    private final LocalDate dueDate;
    private final String reference;
    private final String description;
    private final BigDecimal amount;
    private final BigDecimal outstanding;
    private final long daysOverdue;

    OverdueEntry(LedgerEntry entry, BigDecimal outstanding, LocalDate asOf) {
        this.entryNumber = entry.getEntryNumber();
        this.occurredAt = entry.getOccurredAt();
        this.dueDate = entry.getDueDate();
        this.reference = entry.getReference();
        this.description = entry.getDescription();
        this.amount = entry.getDelta();
        this.outstanding = outstanding;
        this.daysOverdue = ChronoUnit.DAYS.between(entry.getDueDate(), asOf);
    }

    public long getEntryNumber() {
        return entryNumber;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public String getReference() {
        return reference;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    /**
     * Part of the amount not yet covered by payments.
     */
    public BigDecimal getOutstanding() {
        return outstanding;
    }

    public long getDaysOverdue() {
        return daysOverdue;
    }
}
