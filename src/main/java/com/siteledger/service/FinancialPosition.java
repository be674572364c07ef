package com.siteledger.service;

import com.siteledger.domain.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Payment position of a supplier account as of one date.
 */
public final class FinancialPosition {

    private final PaymentStatus status;
    private final BigDecimal balance;
    private final BigDecimal overdueAmount;
    private final LocalDate oldestOverdueDueDate;
    private final List<OverdueEntry> overdueEntries;
    private final Map<Long, PaymentStatus> entryStatuses;

    FinancialPosition(PaymentStatus status, BigDecimal balance, BigDecimal overdueAmount,
                      LocalDate oldestOverdueDueDate, List<OverdueEntry> overdueEntries,
                      Map<Long, PaymentStatus> entryStatuses) {
        this.status = status;
        this.balance = balance;
        this.overdueAmount = overdueAmount;
        this.oldestOverdueDueDate = oldestOverdueDueDate;
        this.overdueEntries = List.copyOf(overdueEntries);
        this.entryStatuses = Collections.unmodifiableMap(entryStatuses);
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    /**
     * Unpaid remainder of debits whose due date has passed.
     */
    public BigDecimal getOverdueAmount() {
        return overdueAmount;
    }

    public LocalDate getOldestOverdueDueDate() {
        return oldestOverdueDueDate;
    }

    /**
     * Overdue debits, oldest due date first.
     */
    public List<OverdueEntry> getOverdueEntries() {
        return overdueEntries;
    }

    public boolean isOverdue() {
        return status == PaymentStatus.OVERDUE;
    }

    /**
     * Per-entry status keyed by entry number, in entry-number order.
     */
    public Map<Long, PaymentStatus> getEntryStatuses() {
        return entryStatuses;
    }

    public PaymentStatus statusOf(long entryNumber) {
        return entryStatuses.getOrDefault(entryNumber, PaymentStatus.NO_ACTIVITY);
    }
}
