package com.siteledger.service;

import com.siteledger.domain.Account;
import com.siteledger.domain.EntryOrder;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.LedgerKind;
import com.siteledger.domain.PaymentStatus;
import com.siteledger.domain.StockStatus;
import com.siteledger.domain.StockThresholds;
import com.siteledger.domain.TransactionType;
import com.siteledger.exception.AccountNotFoundException;
import com.siteledger.exception.LedgerValidationException;
import com.siteledger.repository.AccountRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only projections of the ledgers: paginated history, per-account summary,
 * and the overdue / low-stock listing.
 *
 * Statuses are derived at query time from the entries, the account's current
 * thresholds and the ledger clock. Nothing here writes or takes locks, so the
 * same call repeated without an intervening write returns the same result.
 */
@Service
@Transactional(readOnly = true)
public class LedgerQueryService {

    public static final int MAX_PAGE_SIZE = 100;

    private final AccountRepository accountRepository;
    private final EntryStore entryStore;
    private final BalanceCalculator balanceCalculator;
    private final StatusResolver statusResolver;
    private final Clock clock;

    public LedgerQueryService(AccountRepository accountRepository, EntryStore entryStore,
                              BalanceCalculator balanceCalculator, StatusResolver statusResolver, Clock clock) {
        this.accountRepository = accountRepository;
        this.entryStore = entryStore;
        this.balanceCalculator = balanceCalculator;
        this.statusResolver = statusResolver;
        this.clock = clock;
    }

    /**
     * One page of an account's entries with running balances and per-entry status.
     *
     * @param page     1-based page number
     * @param pageSize between 1 and {@value #MAX_PAGE_SIZE}
     * @param order    CHRONOLOGICAL when null
     * @param filter   optional type, date range and text search; null means all entries
     */
    public HistoryPage history(Long accountId, int page, int pageSize, EntryOrder order, HistoryFilter filter) {
        if (page < 1) {
            throw new LedgerValidationException("Page must be 1 or greater, got " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new LedgerValidationException(String.format(
                    "Page size must be between 1 and %d, got %d", MAX_PAGE_SIZE, pageSize));
        }
        EntryOrder effectiveOrder = order != null ? order : EntryOrder.CHRONOLOGICAL;
        HistoryFilter effectiveFilter = filter != null ? filter : HistoryFilter.none();
        Account account = findAccount(accountId);
        TransactionType type = effectiveFilter.getType();
        if (type != null && type.getLedger() != account.getKind()) {
            throw new LedgerValidationException(String.format(
                    "%s does not apply to %s account %d", type, account.getKind(), accountId));
        }

        Page<LedgerEntry> entries = entryStore.page(accountId, effectiveFilter, clock.getZone(),
                PageRequest.of(page - 1, pageSize, effectiveOrder.getSort()));

        List<EntryView> views = new ArrayList<>(entries.getNumberOfElements());
        if (account.getKind() == LedgerKind.FINANCIAL) {
            FinancialPosition position = statusResolver.resolveFinancial(
                    entryStore.listByAccount(accountId, EntryOrder.SEQUENCE), today());
            for (LedgerEntry entry : entries) {
                views.add(new EntryView(entry, position.statusOf(entry.getEntryNumber())));
            }
        } else {
            StockThresholds thresholds = account.getStockThresholds();
            for (LedgerEntry entry : entries) {
                views.add(new EntryView(entry, statusResolver.stockStatus(entry.getBalanceAfter(), thresholds)));
            }
        }

        return new HistoryPage(accountId, views, page, pageSize, entries.getTotalElements(),
                entries.getTotalPages(), effectiveOrder);
    }

    public AccountSummary summary(Long accountId) {
        return summarize(findAccount(accountId), today());
    }

    /**
     * One summary per account, optionally limited to one ledger kind.
     */
    public List<AccountSummary> summaries(LedgerKind kind) {
        LocalDate today = today();
        List<AccountSummary> summaries = new ArrayList<>();
        for (Account account : accounts(kind)) {
            summaries.add(summarize(account, today));
        }
        return summaries;
    }

    /**
     * Overdue suppliers and materials that are low or at their reorder point,
     * evaluated as of {@code filter.asOf} or today. An overdue supplier's alert
     * lists its overdue entries, oldest due date first.
     */
    public List<LedgerAlert> overdueOrLowStock(AlertFilter filter) {
        AlertFilter effective = filter != null ? filter : AlertFilter.all();
        LocalDate asOf = effective.getAsOf() != null ? effective.getAsOf() : today();

        List<LedgerAlert> alerts = new ArrayList<>();
        for (Account account : accounts(effective.getKind())) {
            if (account.getKind() == LedgerKind.FINANCIAL) {
                FinancialPosition position = financialPosition(account, asOf);
                if (position.getStatus() == PaymentStatus.OVERDUE) {
                    alerts.add(new LedgerAlert(summarize(account, position), List.of(LedgerAlert.Reason.OVERDUE),
                            position.getOverdueEntries()));
                }
                continue;
            }
            AccountSummary summary = summarize(account, asOf);
            List<LedgerAlert.Reason> reasons = new ArrayList<>();
            if (summary.getStatus() == StockStatus.LOW) {
                reasons.add(LedgerAlert.Reason.LOW_STOCK);
            }
            if (summary.isReorderRequired()) {
                reasons.add(LedgerAlert.Reason.REORDER);
            }
            if (!reasons.isEmpty()) {
                alerts.add(new LedgerAlert(summary, reasons, List.of()));
            }
        }
        return alerts;
    }

    private AccountSummary summarize(Account account, LocalDate asOf) {
        if (account.getKind() == LedgerKind.FINANCIAL) {
            return summarize(account, financialPosition(account, asOf));
        }
        BalanceTotals totals = balanceCalculator.totals(account.getId());
        StockPosition position = statusResolver.resolveStock(
                totals.getBalance(), totals.getEntryCount(), account.getStockThresholds());
        return new AccountSummary(account, totals, position.getStatus(), position.isReorderRequired(), null, null);
    }

    private AccountSummary summarize(Account account, FinancialPosition position) {
        return new AccountSummary(account, balanceCalculator.totals(account.getId()), position.getStatus(), false,
                position.getOverdueAmount(), position.getOldestOverdueDueDate());
    }

    private FinancialPosition financialPosition(Account account, LocalDate asOf) {
        return statusResolver.resolveFinancial(entryStore.listByAccount(account.getId(), EntryOrder.SEQUENCE), asOf);
    }

    private List<Account> accounts(LedgerKind kind) {
        if (kind == null) {
            return accountRepository.findAllByOrderByIdAsc();
        }
        return accountRepository.findAllByKindOrderByIdAsc(kind);
    }

    private Account findAccount(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
