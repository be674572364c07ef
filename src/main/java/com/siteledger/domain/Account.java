package com.siteledger.domain;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * An entity that owns a ledger: a supplier (FINANCIAL) or a material at a
 * location (INVENTORY).
 *
 * Ledger rules:
 * - The balance belongs to the entries. {@code cachedBalance} and
 *   {@code lastEntryNumber} are a redundant write-side cache, updated only in
 *   the transaction that appends an entry and checked against the latest
 *   entry before every write and during reconciliation.
 * - The account row is the serialization point for writers: the recorder locks
 *   it with PESSIMISTIC_WRITE before it reads the latest entry.
 * - A halted account accepts no writes until an operator resumes it.
 * - Stock thresholds and payment terms are configuration, not history, and may
 *   change over time.
 */
@Entity
@Table(
    name = "ledger_accounts",
    indexes = {
        @Index(name = "idx_accounts_code", columnList = "code", unique = true),
        @Index(name = "idx_accounts_kind", columnList = "kind")
    }
)
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private LedgerKind kind;

    /**
     * Business key: supplier code, or material code plus location.
     */
    @Column(nullable = false, unique = true, length = 100, updatable = false)
    private String code;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 255)
    private String location;

    /**
     * Supplier credit terms. A purchase recorded without a due date falls due
     * this many days after its transaction date.
     */
    @Column(name = "payment_terms_days")
    private Integer paymentTermsDays;

    @Column(name = "minimum_stock_level", precision = 19, scale = 4)
    private BigDecimal minimumStockLevel;

    @Column(name = "maximum_stock_level", precision = 19, scale = 4)
    private BigDecimal maximumStockLevel;

    @Column(name = "reorder_point", precision = 19, scale = 4)
    private BigDecimal reorderPoint;

    @Column(name = "cached_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal cachedBalance;

    @Column(name = "last_entry_number", nullable = false)
    private long lastEntryNumber;

    @Column(nullable = false)
    private boolean halted;

    @Column(name = "halt_reason", length = 1000)
    private String haltReason;

    @Column(name = "halted_at")
    private Instant haltedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected Account() {
    }

    private Account(LedgerKind kind, String code, String name, Instant now) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Account code cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name cannot be blank");
        }
        this.kind = kind;
        this.code = code.trim();
        this.name = name.trim();
        this.cachedBalance = BigDecimal.ZERO;
        this.lastEntryNumber = 0L;
        this.halted = false;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Open a supplier account.
     *
     * @param paymentTermsDays optional credit terms, must be non-negative
     */
    public static Account financial(String code, String name, Integer paymentTermsDays, Instant now) {
        if (paymentTermsDays != null && paymentTermsDays < 0) {
            throw new IllegalArgumentException("Payment terms cannot be negative: " + paymentTermsDays);
        }
        Account account = new Account(LedgerKind.FINANCIAL, code, name, now);
        account.paymentTermsDays = paymentTermsDays;
        return account;
    }

    /**
     * Open an account for one material at one location.
     */
    public static Account inventory(String code, String name, String location,
                                    StockThresholds thresholds, Instant now) {
        Account account = new Account(LedgerKind.INVENTORY, code, name, now);
        account.location = location;
        account.applyThresholds(thresholds);
        return account;
    }

    // Getters

    public Long getId() {
        return id;
    }

    public LedgerKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getLocation() {
        return location;
    }

    public Integer getPaymentTermsDays() {
        return paymentTermsDays;
    }

    /**
     * Thresholds of an inventory account; null for a financial one.
     */
    public StockThresholds getStockThresholds() {
        if (kind != LedgerKind.INVENTORY) {
            return null;
        }
        return StockThresholds.of(
                minimumStockLevel != null ? minimumStockLevel : BigDecimal.ZERO,
                maximumStockLevel,
                reorderPoint);
    }

    /**
     * Balance as maintained incrementally by the write path.
     * WARNING: a cache. Reconciliation compares it against a full recompute.
     */
    public BigDecimal getCachedBalance() {
        return cachedBalance;
    }

    public long getLastEntryNumber() {
        return lastEntryNumber;
    }

    public boolean isHalted() {
        return halted;
    }

    public String getHaltReason() {
        return haltReason;
    }

    public Instant getHaltedAt() {
        return haltedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    // Business methods

    /**
     * Move the write-side cache forward to a freshly appended entry.
     * Must run in the same transaction as the append.
     *
     * @throws IllegalStateException if the entry does not directly follow the cached position
     */
    public void recordAppend(LedgerEntry entry, Instant now) {
        if (!Objects.equals(entry.getAccountId(), id)) {
            throw new IllegalStateException(String.format(
                    "Entry for account %d cannot be applied to account %d", entry.getAccountId(), id));
        }
        if (entry.getEntryNumber() != lastEntryNumber + 1) {
            throw new IllegalStateException(String.format(
                    "Entry %d does not follow cached position %d on account %d",
                    entry.getEntryNumber(), lastEntryNumber, id));
        }
        this.cachedBalance = entry.getBalanceAfter();
        this.lastEntryNumber = entry.getEntryNumber();
        this.updatedAt = now;
    }

    /**
     * Stop all writes. Keeps the first reason if already halted.
     *
     * @return true if this call halted the account
     */
    public boolean halt(String reason, Instant now) {
        if (halted) {
            return false;
        }
        this.halted = true;
        this.haltReason = truncate(reason, 1000);
        this.haltedAt = now;
        this.updatedAt = now;
        return true;
    }

    /**
     * Clear the halt and reseed the cache from an authoritative recompute.
     */
    public void resume(BigDecimal recomputedBalance, long latestEntryNumber, Instant now) {
        this.cachedBalance = recomputedBalance;
        this.lastEntryNumber = latestEntryNumber;
        this.halted = false;
        this.haltReason = null;
        this.haltedAt = null;
        this.updatedAt = now;
    }

    /**
     * Replace stock thresholds. Inventory accounts only.
     */
    public void updateThresholds(StockThresholds thresholds, Instant now) {
        if (kind != LedgerKind.INVENTORY) {
            throw new IllegalArgumentException("Stock thresholds apply to inventory accounts only");
        }
        applyThresholds(thresholds);
        this.updatedAt = now;
    }

    /**
     * Change credit terms. Applies to purchases recorded from now on; due dates
     * already written to entries stay as they are.
     */
    public void updatePaymentTerms(Integer paymentTermsDays, Instant now) {
        if (kind != LedgerKind.FINANCIAL) {
            throw new IllegalArgumentException("Payment terms apply to financial accounts only");
        }
        if (paymentTermsDays != null && paymentTermsDays < 0) {
            throw new IllegalArgumentException("Payment terms cannot be negative: " + paymentTermsDays);
        }
        this.paymentTermsDays = paymentTermsDays;
        this.updatedAt = now;
    }

    private void applyThresholds(StockThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("Stock thresholds are required for inventory accounts");
        }
        this.minimumStockLevel = thresholds.getMinimum();
        this.maximumStockLevel = thresholds.getMaximum();
        this.reorderPoint = thresholds.getReorderPoint();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account account = (Account) o;
        return Objects.equals(code, account.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code);
    }

    @Override
    public String toString() {
        return "Account{" +
                "id=" + id +
                ", kind=" + kind +
                ", code='" + code + '\'' +
                ", cachedBalance=" + cachedBalance +
                ", lastEntryNumber=" + lastEntryNumber +
                ", halted=" + halted +
                ", version=" + version +
                '}';
    }
}
