package com.siteledger.service;

import com.siteledger.domain.Account;
import com.siteledger.domain.DerivedStatus;
import com.siteledger.domain.LedgerKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Totals and derived status of one account.
 *
 * For a supplier, debits are purchases and debit notes, credits are payments
 * and credit notes, and the balance is the amount owed. For a material, debits
 * are quantities in, credits quantities out, and the balance is stock on hand.
 */
public final class AccountSummary {

    private final Long accountId;
    private final String code;
    private final String name;
    private final LedgerKind kind;
    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;
    private final BigDecimal currentBalance;
    private final long entryCount;
    private final Instant lastTransactionAt;
    private final DerivedStatus status;
    private final boolean reorderRequired;
    private final BigDecimal overdueAmount;
    private final LocalDate oldestOverdueDueDate;
    private final boolean halted;

    AccountSummary(Account account, BalanceTotals totals, DerivedStatus status, boolean reorderRequired,
                   BigDecimal overdueAmount, LocalDate oldestOverdueDueDate) {
        this.accountId = account.getId();
        this.code = account.getCode();
        this.name = account.getName();
        this.kind = account.getKind();
        this.totalDebits = totals.getTotalDebits();
        this.totalCredits = totals.getTotalCredits();
        this.currentBalance = totals.getBalance();
        this.entryCount = totals.getEntryCount();
        this.lastTransactionAt = totals.getLastOccurredAt();
        this.status = status;
        this.reorderRequired = reorderRequired;
        this.overdueAmount = overdueAmount;
        this.oldestOverdueDueDate = oldestOverdueDueDate;
        this.halted = account.isHalted();
    }

    public Long getAccountId() {
        return accountId;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public LedgerKind getKind() {
        return kind;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getCurrentBalance() {
        return currentBalance;
    }

    public long getEntryCount() {
        return entryCount;
    }

    public Instant getLastTransactionAt() {
        return lastTransactionAt;
    }

    public DerivedStatus getStatus() {
        return status;
    }

    public boolean isReorderRequired() {
        return reorderRequired;
    }

    /**
     * Financial accounts only; null for inventory.
     */
    public BigDecimal getOverdueAmount() {
        return overdueAmount;
    }

    public LocalDate getOldestOverdueDueDate() {
        return oldestOverdueDueDate;
    }

    public boolean isHalted() {
        return halted;
    }
}
