package com.siteledger.domain;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One immutable, ordered record of a signed change to an account's balance or quantity.
 *
 * Ledger rules:
 * 1. Entries are IMMUTABLE. Every column is updatable = false and there are no setters.
 * 2. Entries are APPEND-ONLY. Corrections are new offsetting entries.
 * 3. entryNumber starts at 1 per account and increases by exactly 1; the
 *    (account_id, entry_number) unique key rejects a second writer that lost a race.
 * 4. balanceAfter = balanceAfter of entry (entryNumber - 1), or 0, plus delta.
 * 5. occurredAt is the business date and may be earlier than entries already in the
 *    ledger. A backdated entry still gets the next entryNumber and chains from the
 *    latest balance.
 */
@Entity
@Table(
    name = "ledger_entries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_ledger_account_entry", columnNames = {"account_id", "entry_number"})
    },
    indexes = {
        @Index(name = "idx_ledger_account_occurred", columnList = "account_id,occurred_at,entry_number"),
        @Index(name = "idx_ledger_type", columnList = "transaction_type")
    }
)
public class LedgerEntry {

    /**
     * Integer digits the amount columns (precision 19, scale 4) can hold.
     */
    public static final int MAX_INTEGER_DIGITS = 15;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private Long accountId;

    /**
     * Per-account entry id. Assignment order is causal order.
     */
    @Column(name = "entry_number", nullable = false, updatable = false)
    private long entryNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 30, updatable = false)
    private TransactionType transactionType;

    /**
     * Signed contribution to the running balance, derived from the type's sign convention.
     */
    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal delta;

    @Column(name = "balance_after", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal balanceAfter;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    /**
     * When the amount owed by this entry falls due. Debit-side financial entries only.
     */
    @Column(name = "due_date", updatable = false)
    private LocalDate dueDate;

    /**
     * True when an inventory decrease was allowed to take stock below zero.
     */
    @Column(nullable = false, updatable = false)
    private boolean backorder;

    @Column(length = 100, updatable = false)
    private String reference;

    @Column(length = 500, updatable = false)
    private String description;

    @Column(name = "created_by", length = 100, updatable = false)
    private String createdBy;

    /**
     * JPA requires a no-arg constructor.
     */
    protected LedgerEntry() {
    }

    private LedgerEntry(Builder builder) {
        if (builder.accountId == null) {
            throw new IllegalArgumentException("Account id cannot be null");
        }
        if (builder.entryNumber < 1) {
            throw new IllegalArgumentException("Entry number must start at 1, got " + builder.entryNumber);
        }
        if (builder.transactionType == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        if (builder.delta == null || builder.balanceAfter == null) {
            throw new IllegalArgumentException("Delta and balance after are required");
        }
        if (builder.occurredAt == null || builder.recordedAt == null) {
            throw new IllegalArgumentException("Occurred-at and recorded-at are required");
        }
        this.accountId = builder.accountId;
        this.entryNumber = builder.entryNumber;
        this.transactionType = builder.transactionType;
        this.delta = builder.delta;
        this.balanceAfter = builder.balanceAfter;
        this.occurredAt = builder.occurredAt;
        this.recordedAt = builder.recordedAt;
        this.dueDate = builder.dueDate;
        this.backorder = builder.backorder;
        this.reference = builder.reference;
        this.description = builder.description;
        this.createdBy = builder.createdBy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True if the value can be stored as a delta or balance without overflowing the column.
     */
    public static boolean fitsAmountColumn(BigDecimal value) {
        return value.precision() - value.scale() <= MAX_INTEGER_DIGITS;
    }

    // Getters only - no setters (immutability)

    public Long getId() {
        return id;
    }

    public Long getAccountId() {
        return accountId;
    }

    public long getEntryNumber() {
        return entryNumber;
    }

    public TransactionType getTransactionType() {
        return transactionType;
    }

    public BigDecimal getDelta() {
        return delta;
    }

    public BigDecimal getBalanceAfter() {
        return balanceAfter;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public boolean isBackorder() {
        return backorder;
    }

    public String getReference() {
        return reference;
    }

    public String getDescription() {
        return description;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    // Convenience methods

    public boolean isIncrease() {
        return delta.signum() > 0;
    }

    public boolean isDecrease() {
        return delta.signum() < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LedgerEntry that = (LedgerEntry) o;
        return entryNumber == that.entryNumber && Objects.equals(accountId, that.accountId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, entryNumber);
    }

    @Override
    public String toString() {
        return "LedgerEntry{" +
                "accountId=" + accountId +
                ", entryNumber=" + entryNumber +
                ", type=" + transactionType +
                ", delta=" + delta +
                ", balanceAfter=" + balanceAfter +
                ", occurredAt=" + occurredAt +
                '}';
    }

    public static final class Builder {
        private Long accountId;
        private long entryNumber;
        private TransactionType transactionType;
        private BigDecimal delta;
        private BigDecimal balanceAfter;
        private Instant occurredAt;
        private Instant recordedAt;
        private LocalDate dueDate;
        private boolean backorder;
        private String reference;
        private String description;
        private String createdBy;

        private Builder() {
        }

        public Builder accountId(Long accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder entryNumber(long entryNumber) {
            this.entryNumber = entryNumber;
            return this;
        }

        public Builder transactionType(TransactionType transactionType) {
            this.transactionType = transactionType;
            return this;
        }

        public Builder delta(BigDecimal delta) {
            this.delta = delta;
            return this;
        }

        public Builder balanceAfter(BigDecimal balanceAfter) {
            this.balanceAfter = balanceAfter;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder recordedAt(Instant recordedAt) {
            this.recordedAt = recordedAt;
            return this;
        }

        public Builder dueDate(LocalDate dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder backorder(boolean backorder) {
            this.backorder = backorder;
            return this;
        }

        public Builder reference(String reference) {
            this.reference = reference;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public LedgerEntry build() {
            return new LedgerEntry(this);
        }
    }
}
