package com.siteledger.service;

import com.siteledger.domain.Account;
import com.siteledger.domain.EntryMetadata;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.LedgerKind;
import com.siteledger.domain.TransactionType;
import com.siteledger.exception.AccountHaltedException;
import com.siteledger.exception.AccountNotFoundException;
import com.siteledger.exception.ConsistencyViolationException;
import com.siteledger.exception.InsufficientStockException;
import com.siteledger.exception.LedgerValidationException;
import com.siteledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * One attempt at appending an entry, inside one database transaction.
 *
 * CRITICAL: every append MUST
 * 1. Lock the account row (findByIdForUpdate) before reading the latest entry
 * 2. Check the latest entry against the account's cached position
 * 3. Write the entry FIRST
 * 4. Move the account cache SECOND, in the same transaction
 *
 * Called only by TransactionRecorder, which owns validation and retries.
 */
@Service
public class LedgerAppendService {

    private static final Logger log = LoggerFactory.getLogger(LedgerAppendService.class);

    private final AccountRepository accountRepository;
    private final EntryStore entryStore;
    private final BalanceCalculator balanceCalculator;
    private final Clock clock;

    public LedgerAppendService(AccountRepository accountRepository, EntryStore entryStore,
                               BalanceCalculator balanceCalculator, Clock clock) {
        this.accountRepository = accountRepository;
        this.entryStore = entryStore;
        this.balanceCalculator = balanceCalculator;
        this.clock = clock;
    }

    /**
     * @throws AccountNotFoundException if the account does not exist
     * @throws AccountHaltedException if writes to the account are stopped
     * @throws LedgerValidationException if the type belongs to the other ledger or the balance would overflow
     * @throws ConsistencyViolationException if the cached position disagrees with the latest entry
     * @throws InsufficientStockException if an inventory decrease would go below zero without a backorder flag
     * @throws com.siteledger.exception.ConcurrentLedgerModificationException if another writer took the slot
     */
    @Transactional
    public LedgerEntry append(Long accountId, TransactionType type, BigDecimal amount, Instant occurredAt,
                              EntryMetadata metadata) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        if (account.isHalted()) {
            throw new AccountHaltedException(accountId, account.getHaltReason());
        }
        if (type.getLedger() != account.getKind()) {
            throw new LedgerValidationException(String.format(
                    "%s is a %s transaction type but account %d is a %s account",
                    type, type.getLedger(), accountId, account.getKind()));
        }

        Optional<LedgerEntry> latest = entryStore.latest(accountId);
        BigDecimal lastBalance = latest.map(LedgerEntry::getBalanceAfter).orElse(BigDecimal.ZERO);
        long lastNumber = latest.map(LedgerEntry::getEntryNumber).orElse(0L);
        if (lastNumber != account.getLastEntryNumber()
                || lastBalance.compareTo(account.getCachedBalance()) != 0) {
            throw new ConsistencyViolationException(accountId, String.format(
                    "cached position is entry %d with balance %s but latest entry is %d with balance %s",
                    account.getLastEntryNumber(), account.getCachedBalance().toPlainString(),
                    lastNumber, lastBalance.toPlainString()));
        }

        BigDecimal delta = type.toDelta(amount);
        BigDecimal newBalance = balanceCalculator.incremental(lastBalance, delta);
        if (!LedgerEntry.fitsAmountColumn(newBalance)) {
            throw new LedgerValidationException(String.format(
                    "%s of %s would take account %d to %s, beyond %d integer digits",
                    type, amount.toPlainString(), accountId, newBalance.toPlainString(),
                    LedgerEntry.MAX_INTEGER_DIGITS));
        }
        boolean belowZero = account.getKind() == LedgerKind.INVENTORY
                && delta.signum() < 0 && newBalance.signum() < 0;
        if (belowZero && !metadata.isAllowBackorder()) {
            throw new InsufficientStockException(accountId, lastBalance, delta.negate());
        }

        LedgerEntry entry = LedgerEntry.builder()
                .accountId(accountId)
                .entryNumber(lastNumber + 1)
                .transactionType(type)
                .delta(delta)
                .balanceAfter(newBalance)
                .occurredAt(occurredAt)
                .recordedAt(clock.instant())
                .dueDate(resolveDueDate(account, type, occurredAt, metadata))
                .backorder(belowZero)
                .reference(metadata.getReference())
                .description(metadata.getDescription())
                .createdBy(metadata.getCreatedBy())
                .build();

        entryStore.append(entry);
        account.recordAppend(entry, clock.instant());
        accountRepository.saveAndFlush(account);

        log.info("Recorded {} on account {}: entry={}, delta={}, balanceAfter={}{}",
                type, accountId, entry.getEntryNumber(), delta.toPlainString(), newBalance.toPlainString(),
                belowZero ? " (backorder)" : "");
        return entry;
    }

    /**
     * Explicit due date, else transaction date plus the supplier's payment terms.
     */
    private LocalDate resolveDueDate(Account account, TransactionType type, Instant occurredAt,
                                     EntryMetadata metadata) {
        if (!type.carriesDueDate()) {
            return null;
        }
        if (metadata.getDueDate() != null) {
            return metadata.getDueDate();
        }
        if (account.getPaymentTermsDays() == null) {
            return null;
        }
        return LocalDate.ofInstant(occurredAt, clock.getZone()).plusDays(account.getPaymentTermsDays());
    }
}
