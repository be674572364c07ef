package com.siteledger.service;

import com.siteledger.domain.Account;
import com.siteledger.domain.EntryOrder;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.exception.AccountNotFoundException;
import com.siteledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares the full recompute of an account with its incrementally maintained state.
 *
 * Takes the account write lock, so the comparison waits for in-flight appends and
 * sees a settled ledger. On divergence the account is halted in the same
 * transaction, an ERROR is logged and a {@link LedgerInconsistencyEvent} is published.
 * Nothing is ever corrected here.
 */
@Service
@Transactional
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final AccountRepository accountRepository;
    private final EntryStore entryStore;
    private final BalanceCalculator balanceCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReconciliationService(AccountRepository accountRepository, EntryStore entryStore,
                                 BalanceCalculator balanceCalculator, ApplicationEventPublisher eventPublisher,
                                 Clock clock) {
        this.accountRepository = accountRepository;
        this.entryStore = entryStore;
        this.balanceCalculator = balanceCalculator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * @throws AccountNotFoundException if the account does not exist
     */
    public ReconciliationReport reconcile(Long accountId) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        BigDecimal recomputed = balanceCalculator.recompute(accountId);
        ChainReplay replay = balanceCalculator.replay(entryStore.listByAccount(accountId, EntryOrder.SEQUENCE));
        Optional<LedgerEntry> latest = entryStore.latest(accountId);
        BigDecimal latestBalance = latest.map(LedgerEntry::getBalanceAfter).orElse(BigDecimal.ZERO);
        long latestNumber = latest.map(LedgerEntry::getEntryNumber).orElse(0L);
        long entryCount = entryStore.count(accountId);

        List<String> divergences = new ArrayList<>();
        if (recomputed.compareTo(account.getCachedBalance()) != 0) {
            divergences.add(String.format("recomputed balance %s differs from cached balance %s",
                    recomputed.toPlainString(), account.getCachedBalance().toPlainString()));
        }
        if (recomputed.compareTo(latestBalance) != 0) {
            divergences.add(String.format("recomputed balance %s differs from latest balanceAfter %s",
                    recomputed.toPlainString(), latestBalance.toPlainString()));
        }
        if (latestNumber != account.getLastEntryNumber()) {
            divergences.add(String.format("latest entry %d differs from cached entry number %d",
                    latestNumber, account.getLastEntryNumber()));
        }
        if (latestNumber != entryCount) {
            divergences.add(String.format("%d entries stored but latest entry number is %d",
                    entryCount, latestNumber));
        }
        if (!replay.isIntact()) {
            divergences.add("entry chain broken at entry " + replay.getBrokenAtEntry() + ": " + replay.getDetail());
        }

        Instant now = clock.instant();
        if (!divergences.isEmpty()) {
            account.halt("Reconciliation failed: " + String.join("; ", divergences), now);
            accountRepository.save(account);
        }

        ReconciliationReport report = new ReconciliationReport(accountId, now, recomputed,
                account.getCachedBalance(), latestBalance, latestNumber, account.getLastEntryNumber(),
                entryCount, divergences, account.isHalted());

        if (report.isConsistent()) {
            log.info("Reconciled account {}: balance={}, entries={}", accountId, recomputed.toPlainString(),
                    entryCount);
        } else {
            log.error("LEDGER INCONSISTENCY on account {}: {}", accountId, divergences);
            eventPublisher.publishEvent(new LedgerInconsistencyEvent(report));
        }
        return report;
    }
}
