package com.siteledger.dto;

import com.siteledger.domain.Account;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.StockThresholds;
import com.siteledger.service.AccountSummary;
import com.siteledger.service.BatchResult;
import com.siteledger.service.EntryView;
import com.siteledger.service.HistoryPage;
import com.siteledger.service.LedgerAlert;
import com.siteledger.service.OverdueEntry;
import com.siteledger.service.ReconciliationReport;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Account details and configuration.
     */
    public static class AccountResponse {
        private Long accountId;
        private String kind;
        private String code;
        private String name;
        private String location;
        private Integer paymentTermsDays;
        private BigDecimal minimumStockLevel;
        private BigDecimal maximumStockLevel;
        private BigDecimal reorderPoint;
        private BigDecimal balance;
        private long lastEntryNumber;
        private boolean halted;
        private String haltReason;
        private Instant haltedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public AccountResponse(Account account) {
            this.accountId = account.getId();
            this.kind = account.getKind().toString();
            this.code = account.getCode();
            this.name = account.getName();
            this.location = account.getLocation();
            this.paymentTermsDays = account.getPaymentTermsDays();
            StockThresholds thresholds = account.getStockThresholds();
            if (thresholds != null) {
                this.minimumStockLevel = thresholds.getMinimum();
                this.maximumStockLevel = thresholds.getMaximum();
                this.reorderPoint = thresholds.getReorderPoint();
            }
            this.balance = account.getCachedBalance();
            this.lastEntryNumber = account.getLastEntryNumber();
            this.halted = account.isHalted();
            this.haltReason = account.getHaltReason();
            this.haltedAt = account.getHaltedAt();
            this.createdAt = account.getCreatedAt();
            this.updatedAt = account.getUpdatedAt();
        }

        // Getters
        public Long getAccountId() { return accountId; }
        public String getKind() { return kind; }
        public String getCode() { return code; }
        public String getName() { return name; }
        public String getLocation() { return location; }
        public Integer getPaymentTermsDays() { return paymentTermsDays; }
        public BigDecimal getMinimumStockLevel() { return minimumStockLevel; }
        public BigDecimal getMaximumStockLevel() { return maximumStockLevel; }
        public BigDecimal getReorderPoint() { return reorderPoint; }
        public BigDecimal getBalance() { return balance; }
        public long getLastEntryNumber() { return lastEntryNumber; }
        public boolean isHalted() { return halted; }
        public String getHaltReason() { return haltReason; }
        public Instant getHaltedAt() { return haltedAt; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    /**
     * A single ledger entry, with its derived status when shown in a history view.
     */
    public static class EntryResponse {
        private Long accountId;
        private long entryNumber;
        private String type;
        private BigDecimal delta;
        private BigDecimal balanceAfter;
        private Instant occurredAt;
        private Instant recordedAt;
        private LocalDate dueDate;
        private boolean backorder;
        private String reference;
        private String description;
        private String createdBy;
        private String status;

        public EntryResponse(LedgerEntry entry) {
            this(entry, null);
        }

        public EntryResponse(EntryView view) {
            this(view.getEntry(), view.getStatus() != null ? view.getStatus().name() : null);
        }

        private EntryResponse(LedgerEntry entry, String status) {
            this.accountId = entry.getAccountId();
            this.entryNumber = entry.getEntryNumber();
            this.type = entry.getTransactionType().toString();
            this.delta = entry.getDelta();
            this.balanceAfter = entry.getBalanceAfter();
            this.occurredAt = entry.getOccurredAt();
            this.recordedAt = entry.getRecordedAt();
            this.dueDate = entry.getDueDate();
            this.backorder = entry.isBackorder();
            this.reference = entry.getReference();
            this.description = entry.getDescription();
            this.createdBy = entry.getCreatedBy();
            this.status = status;
        }

        // Getters
        public Long getAccountId() { return accountId; }
        public long getEntryNumber() { return entryNumber; }
        public String getType() { return type; }
        public BigDecimal getDelta() { return delta; }
        public BigDecimal getBalanceAfter() { return balanceAfter; }
        public Instant getOccurredAt() { return occurredAt; }
        public Instant getRecordedAt() { return recordedAt; }
        public LocalDate getDueDate() { return dueDate; }
        public boolean isBackorder() { return backorder; }
        public String getReference() { return reference; }
        public String getDescription() { return description; }
        public String getCreatedBy() { return createdBy; }
        public String getStatus() { return status; }
    }

    /**
     * Page of history with pagination metadata.
     */
    public static class HistoryResponse {
        private Long accountId;
        private String order;
        private List<EntryResponse> entries;
        private Pagination pagination;

        public HistoryResponse(HistoryPage page) {
            this.accountId = page.getAccountId();
            this.order = page.getOrder().toString();
            this.entries = page.getEntries().stream()
                    .map(EntryResponse::new)
                    .collect(Collectors.toList());
            this.pagination = new Pagination(page.getPage(), page.getTotalPages(), page.getTotalItems(),
                    page.getSize());
        }

        // Getters
        public Long getAccountId() { return accountId; }
        public String getOrder() { return order; }
        public List<EntryResponse> getEntries() { return entries; }
        public Pagination getPagination() { return pagination; }
    }

    public static class Pagination {
        private int currentPage;
        private int totalPages;
        private long totalItems;
        private int itemsPerPage;

        public Pagination(int currentPage, int totalPages, long totalItems, int itemsPerPage) {
            this.currentPage = currentPage;
            this.totalPages = totalPages;
            this.totalItems = totalItems;
            this.itemsPerPage = itemsPerPage;
        }

        // Getters
        public int getCurrentPage() { return currentPage; }
        public int getTotalPages() { return totalPages; }
        public long getTotalItems() { return totalItems; }
        public int getItemsPerPage() { return itemsPerPage; }
    }

    /**
     * Totals and derived status of one account.
     */
    public static class SummaryResponse {
        private Long accountId;
        private String code;
        private String name;
        private String kind;
        private BigDecimal totalDebits;
        private BigDecimal totalCredits;
        private BigDecimal currentBalance;
        private long entryCount;
        private Instant lastTransactionAt;
        private String status;
        private boolean reorderRequired;
        private BigDecimal overdueAmount;
        private LocalDate oldestOverdueDueDate;
        private boolean halted;

        public SummaryResponse(AccountSummary summary) {
            this.accountId = summary.getAccountId();
            this.code = summary.getCode();
            this.name = summary.getName();
            this.kind = summary.getKind().toString();
            this.totalDebits = summary.getTotalDebits();
            this.totalCredits = summary.getTotalCredits();
            this.currentBalance = summary.getCurrentBalance();
            this.entryCount = summary.getEntryCount();
            this.lastTransactionAt = summary.getLastTransactionAt();
            this.status = summary.getStatus().name();
            this.reorderRequired = summary.isReorderRequired();
            this.overdueAmount = summary.getOverdueAmount();
            this.oldestOverdueDueDate = summary.getOldestOverdueDueDate();
            this.halted = summary.isHalted();
        }

        // Getters
        public Long getAccountId() { return accountId; }
        public String getCode() { return code; }
        public String getName() { return name; }
        public String getKind() { return kind; }
        public BigDecimal getTotalDebits() { return totalDebits; }
        public BigDecimal getTotalCredits() { return totalCredits; }
        public BigDecimal getCurrentBalance() { return currentBalance; }
        public long getEntryCount() { return entryCount; }
        public Instant getLastTransactionAt() { return lastTransactionAt; }
        public String getStatus() { return status; }
        public boolean isReorderRequired() { return reorderRequired; }
        public BigDecimal getOverdueAmount() { return overdueAmount; }
        public LocalDate getOldestOverdueDueDate() { return oldestOverdueDueDate; }
        public boolean isHalted() { return halted; }
    }

    /**
     * Overdue / low-stock listing row.
     */
    public static class AlertResponse {
        private List<String> reasons;
        private SummaryResponse account;
        private List<OverdueEntryResponse> overdueEntries;

        public AlertResponse(LedgerAlert alert) {
            this.reasons = alert.getReasons().stream()
                    .map(Enum::name)
                    .collect(Collectors.toList());
            this.account = new SummaryResponse(alert.getSummary());
            this.overdueEntries = alert.getOverdueEntries().stream()
                    .map(OverdueEntryResponse::new)
                    .collect(Collectors.toList());
        }

        // Getters
        public List<String> getReasons() { return reasons; }
        public SummaryResponse getAccount() { return account; }
        public List<OverdueEntryResponse> getOverdueEntries() { return overdueEntries; }
    }

    /**
     * One overdue debit inside an alert, oldest due date first.
     */
    public static class OverdueEntryResponse {
        private long entryNumber;
        private Instant occurredAt;
        private LocalDate dueDate;
        private String reference;
        private String description;
        private BigDecimal amount;
        private BigDecimal outstanding;
        private long daysOverdue;

        public OverdueEntryResponse(OverdueEntry entry) {
            this.entryNumber = entry.getEntryNumber();
            this.occurredAt = entry.getOccurredAt();
            this.dueDate = entry.getDueDate();
            this.reference = entry.getReference();
            this.description = entry.getDescription();
            this.amount = entry.getAmount();
            this.outstanding = entry.getOutstanding();
            this.daysOverdue = entry.getDaysOverdue();
        }

        // Getters
        public long getEntryNumber() { return entryNumber; }
        public Instant getOccurredAt() { return occurredAt; }
        public LocalDate getDueDate() { return dueDate; }
        public String getReference() { return reference; }
        public String getDescription() { return description; }
        public BigDecimal getAmount() { return amount; }
        public BigDecimal getOutstanding() { return outstanding; }
        public long getDaysOverdue() { return daysOverdue; }
    }

    /**
     * Outcome of a batch recording.
     */
    public static class BatchResponse {
        private int recordedCount;
        private int failedCount;
        private List<EntryResponse> recorded;
        private List<BatchFailureResponse> failures;

        public BatchResponse(BatchResult result) {
            this.recorded = result.getRecorded().stream()
                    .map(EntryResponse::new)
                    .collect(Collectors.toList());
            this.failures = result.getFailures().stream()
                    .map(BatchFailureResponse::new)
                    .collect(Collectors.toList());
            this.recordedCount = recorded.size();
            this.failedCount = failures.size();
        }

        // Getters
        public int getRecordedCount() { return recordedCount; }
        public int getFailedCount() { return failedCount; }
        public List<EntryResponse> getRecorded() { return recorded; }
        public List<BatchFailureResponse> getFailures() { return failures; }
    }

    public static class BatchFailureResponse {
        private int line;
        private Long accountId;
        private String error;
        private String message;

        public BatchFailureResponse(BatchResult.Failure failure) {
            this.line = failure.getLine();
            this.accountId = failure.getAccountId();
            this.error = failure.getError();
            this.message = failure.getMessage();
        }

        // Getters
        public int getLine() { return line; }
        public Long getAccountId() { return accountId; }
        public String getError() { return error; }
        public String getMessage() { return message; }
    }

    /**
     * Outcome of an on-demand reconciliation.
     */
    public static class ReconciliationResponse {
        private Long accountId;
        private boolean consistent;
        private BigDecimal recomputedBalance;
        private BigDecimal cachedBalance;
        private BigDecimal latestBalanceAfter;
        private long latestEntryNumber;
        private long cachedEntryNumber;
        private long entryCount;
        private List<String> divergences;
        private boolean halted;
        private Instant checkedAt;

        public ReconciliationResponse(ReconciliationReport report) {
            this.accountId = report.getAccountId();
            this.consistent = report.isConsistent();
            this.recomputedBalance = report.getRecomputedBalance();
            this.cachedBalance = report.getCachedBalance();
            this.latestBalanceAfter = report.getLatestBalanceAfter();
            this.latestEntryNumber = report.getLatestEntryNumber();
            this.cachedEntryNumber = report.getCachedEntryNumber();
            this.entryCount = report.getEntryCount();
            this.divergences = report.getDivergences();
            this.halted = report.isHalted();
            this.checkedAt = report.getCheckedAt();
        }

        // Getters
        public Long getAccountId() { return accountId; }
        public boolean isConsistent() { return consistent; }
        public BigDecimal getRecomputedBalance() { return recomputedBalance; }
        public BigDecimal getCachedBalance() { return cachedBalance; }
        public BigDecimal getLatestBalanceAfter() { return latestBalanceAfter; }
        public long getLatestEntryNumber() { return latestEntryNumber; }
        public long getCachedEntryNumber() { return cachedEntryNumber; }
        public long getEntryCount() { return entryCount; }
        public List<String> getDivergences() { return divergences; }
        public boolean isHalted() { return halted; }
        public Instant getCheckedAt() { return checkedAt; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
