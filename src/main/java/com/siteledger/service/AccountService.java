package com.siteledger.service;

import com.siteledger.domain.Account;
import com.siteledger.domain.LedgerKind;
import com.siteledger.domain.StockThresholds;
import com.siteledger.exception.AccountNotFoundException;
import com.siteledger.exception.ConsistencyViolationException;
import com.siteledger.exception.DuplicateAccountException;
import com.siteledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for account administration: opening supplier and material accounts,
 * changing their configuration, and halting or resuming writes.
 *
 * Ledger writes never happen here; they go through TransactionRecorder.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final BalanceCalculator balanceCalculator;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository, BalanceCalculator balanceCalculator, Clock clock) {
        this.accountRepository = accountRepository;
        this.balanceCalculator = balanceCalculator;
        this.clock = clock;
    }

    /**
     * Open a supplier account.
     *
     * @param paymentTermsDays optional credit terms used to derive due dates of purchases
     * @throws DuplicateAccountException if the code is already registered
     */
    public Account openFinancialAccount(String code, String name, Integer paymentTermsDays) {
        requireUniqueCode(code);
        Account account = Account.financial(code, name, paymentTermsDays, clock.instant());
        account = saveNew(account);
        log.info("Opened financial account: accountId={}, code={}, paymentTermsDays={}",
                account.getId(), account.getCode(), paymentTermsDays);
        return account;
    }

    /**
     * Open an account for one material at one location.
     *
     * @throws com.siteledger.exception.LedgerValidationException if thresholds are invalid or the code is taken
     */
    public Account openInventoryAccount(String code, String name, String location,
                                        BigDecimal minimum, BigDecimal maximum, BigDecimal reorderPoint) {
        StockThresholds thresholds = StockThresholds.of(minimum, maximum, reorderPoint);
        requireUniqueCode(code);
        Account account = Account.inventory(code, name, location, thresholds, clock.instant());
        account = saveNew(account);
        log.info("Opened inventory account: accountId={}, code={}, location={}, thresholds={}",
                account.getId(), account.getCode(), location, thresholds);
        return account;
    }

    /**
     * @throws AccountNotFoundException if no account has this id
     */
    @Transactional(readOnly = true)
    public Account find(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * All accounts, or all accounts of one kind, ordered by id.
     */
    @Transactional(readOnly = true)
    public List<Account> findAll(LedgerKind kind) {
        if (kind == null) {
            return accountRepository.findAllByOrderByIdAsc();
        }
        return accountRepository.findAllByKindOrderByIdAsc(kind);
    }

    @Transactional(readOnly = true)
    public List<Long> findAllIds() {
        return accountRepository.findAllIds();
    }

    /**
     * Replace the stock thresholds of an inventory account.
     * Configuration only: no ledger entry is written.
     */
    public Account updateStockThresholds(Long accountId, BigDecimal minimum, BigDecimal maximum,
                                         BigDecimal reorderPoint) {
        StockThresholds thresholds = StockThresholds.of(minimum, maximum, reorderPoint);
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        account.updateThresholds(thresholds, clock.instant());
        log.info("Updated stock thresholds: accountId={}, thresholds={}", accountId, thresholds);
        return account;
    }

    /**
     * Change the credit terms of a supplier account.
     */
    public Account updatePaymentTerms(Long accountId, Integer paymentTermsDays) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        account.updatePaymentTerms(paymentTermsDays, clock.instant());
        log.info("Updated payment terms: accountId={}, paymentTermsDays={}", accountId, paymentTermsDays);
        return account;
    }

    /**
     * Stop all writes to an account.
     *
     * Runs in its own transaction so the halt survives when the caller's
     * transaction rolls back. Idempotent: a second halt keeps the first reason.
     *
     * @return true if this call halted the account
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean halt(Long accountId, String reason) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        boolean halted = account.halt(reason, clock.instant());
        if (halted) {
            log.error("Account HALTED: accountId={}, reason={}", accountId, reason);
        } else {
            log.warn("Account already halted: accountId={}, originalReason={}", accountId, account.getHaltReason());
        }
        return halted;
    }

    /**
     * Resume writes after an investigation.
     *
     * Replays the stored chain under the account lock. A broken chain is refused;
     * otherwise the write-side cache is reseeded from the full recompute.
     *
     * @param operator who resumed the account, for the log
     * @throws ConsistencyViolationException if the entries themselves break the running-balance chain
     */
    public Account resume(Long accountId, String operator) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (!account.isHalted()) {
            log.info("Resume requested for account that is not halted: accountId={}, operator={}",
                    accountId, operator);
            return account;
        }

        ChainReplay replay = balanceCalculator.replay(accountId);
        if (!replay.isIntact()) {
            log.error("Resume refused, entry chain broken: accountId={}, entry={}, detail={}",
                    accountId, replay.getBrokenAtEntry(), replay.getDetail());
            throw new ConsistencyViolationException(accountId,
                    "cannot resume, entry chain broken at entry " + replay.getBrokenAtEntry()
                            + ": " + replay.getDetail());
        }

        BigDecimal oldBalance = account.getCachedBalance();
        long oldEntryNumber = account.getLastEntryNumber();
        String reason = account.getHaltReason();
        Instant now = clock.instant();
        account.resume(replay.getReplayedBalance(), replay.getEntriesChecked(), now);
        log.warn("Account RESUMED: accountId={}, operator={}, haltReason={}, cachedBalance {} -> {}, "
                        + "lastEntryNumber {} -> {}",
                accountId, operator, reason, oldBalance, replay.getReplayedBalance(),
                oldEntryNumber, replay.getEntriesChecked());
        return account;
    }

    private void requireUniqueCode(String code) {
        if (code != null && accountRepository.existsByCode(code.trim())) {
            throw new DuplicateAccountException(code.trim());
        }
    }

    private Account saveNew(Account account) {
        try {
            return accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateAccountException(account.getCode());
        }
    }
}
