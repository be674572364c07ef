package com.siteledger.service;

import com.siteledger.domain.EntryMetadata;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.LedgerKind;
import com.siteledger.domain.TransactionType;
import com.siteledger.exception.AccountHaltedException;
import com.siteledger.exception.AccountNotFoundException;
import com.siteledger.exception.ConcurrentLedgerModificationException;
import com.siteledger.exception.ConsistencyViolationException;
import com.siteledger.exception.InsufficientStockException;
import com.siteledger.exception.InvalidAmountException;
import com.siteledger.exception.LedgerValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The only write path into the ledger.
 *
 * record() validates the request, then runs {@link LedgerAppendService#append}
 * in a fresh transaction per attempt. Concurrency failures (another writer took
 * the entry slot, lock timeouts, optimistic-lock failures) are retried with a
 * bounded number of attempts. A consistency violation is never retried: the
 * account is halted in a separate transaction and the violation is rethrown.
 */
@Service
public class TransactionRecorder {

    private static final Logger log = LoggerFactory.getLogger(TransactionRecorder.class);

    static final int MAX_DECIMAL_PLACES = 4;
    public static final int MAX_BATCH_LINES = 100;

    private final LedgerAppendService appendService;
    private final AccountService accountService;
    private final Clock clock;
    private final RetryTemplate retryTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public TransactionRecorder(LedgerAppendService appendService,
                               AccountService accountService,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               @Value("${siteledger.recorder.max-attempts:5}") int maxAttempts,
                               @Value("${siteledger.recorder.backoff-ms:25}") long backoffMs,
                               @Value("${siteledger.recorder.lock-timeout-ms:5000}") long lockTimeoutMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Recorder needs at least one attempt: " + maxAttempts);
        }
        this.appendService = appendService;
        this.accountService = accountService;
        this.clock = clock;
        this.maxAttempts = maxAttempts;

        List<Class<? extends Throwable>> retryable = List.of(
                ConcurrentLedgerModificationException.class,
                TransientDataAccessException.class,
                TransactionTimedOutException.class);
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(Math.max(1L, backoffMs))
                .retryOn(retryable)
                .traversingCauses()
                .build();

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transactionTemplate.setTimeout((int) Math.max(1L, (lockTimeoutMs + 999) / 1000));
    }

    /**
     * Record one transaction.
     *
     * @param amount magnitude of the movement; the sign comes from {@code type}
     *               (only the inventory ADJUSTMENT type takes a signed value)
     * @param occurredAt business date of the transaction; may lie in the past
     * @param metadata provenance and options, may be null
     * @return the appended entry
     * @throws LedgerValidationException if the request is malformed
     * @throws com.siteledger.exception.AccountNotFoundException if the account does not exist
     * @throws com.siteledger.exception.InsufficientStockException if stock would go negative
     * @throws com.siteledger.exception.AccountHaltedException if writes to the account are stopped
     * @throws ConsistencyViolationException if the ledger is inconsistent; the account is halted
     * @throws ConcurrentLedgerModificationException if every attempt lost to another writer
     */
    public LedgerEntry record(Long accountId, TransactionType type, BigDecimal amount, Instant occurredAt,
                              EntryMetadata metadata) {
        EntryMetadata meta = metadata != null ? metadata : EntryMetadata.empty();
        validate(accountId, type, amount, occurredAt, meta);

        MDC.put("accountId", String.valueOf(accountId));
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    Throwable last = context.getLastThrowable();
                    log.warn("Retrying append on account {}: attempt {}/{} after {}",
                            accountId, context.getRetryCount() + 1, maxAttempts,
                            last != null ? last.getMessage() : "unknown failure");
                }
                return transactionTemplate.execute(status ->
                        appendService.append(accountId, type, amount, occurredAt, meta));
            });
        } catch (ConsistencyViolationException e) {
            haltAfterViolation(accountId, e);
            throw e;
        } catch (ConcurrentLedgerModificationException e) {
            log.warn("Giving up on account {} after {} attempts: {}", accountId, maxAttempts, e.getMessage());
            throw e;
        } catch (TransientDataAccessException | TransactionTimedOutException e) {
            log.warn("Giving up on account {} after {} attempts: {}", accountId, maxAttempts, e.getMessage());
            throw new ConcurrentLedgerModificationException(accountId, String.format(
                    "Account %d is busy; gave up after %d attempts", accountId, maxAttempts), e);
        } finally {
            MDC.remove("accountId");
        }
    }

    /**
     * Record one type of transaction for several accounts, such as a delivery that
     * restocks many materials at once. Each line is a separate {@link #record} with
     * its own transaction: a refused line is collected and the remaining lines still run.
     *
     * @throws LedgerValidationException if the batch itself is malformed; nothing is recorded
     */
    public BatchResult recordBatch(TransactionType type, List<BatchLine> lines, Instant occurredAt,
                                   EntryMetadata metadata) {
        if (type == null) {
            throw new LedgerValidationException("Transaction type is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new LedgerValidationException("A batch needs at least one line");
        }
        if (lines.size() > MAX_BATCH_LINES) {
            throw new LedgerValidationException(String.format(
                    "A batch holds at most %d lines, got %d", MAX_BATCH_LINES, lines.size()));
        }
        if (occurredAt == null) {
            throw new LedgerValidationException("Transaction date is required");
        }

        List<LedgerEntry> recorded = new ArrayList<>();
        List<BatchResult.Failure> failures = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            BatchLine line = lines.get(i);
            try {
                recorded.add(record(line.getAccountId(), type, line.getAmount(), occurredAt, metadata));
            } catch (LedgerValidationException | AccountNotFoundException | InsufficientStockException
                     | AccountHaltedException | ConsistencyViolationException
                     | ConcurrentLedgerModificationException e) {
                log.warn("Batch {} line {} refused for account {}: {}", type, i, line.getAccountId(), e.getMessage());
                failures.add(new BatchResult.Failure(i, line.getAccountId(), errorCode(e), e.getMessage()));
            }
        }
        log.info("Batch {} finished: {} recorded, {} refused", type, recorded.size(), failures.size());
        return new BatchResult(recorded, failures);
    }

    private static String errorCode(RuntimeException e) {
        if (e instanceof LedgerValidationException) {
            return "VALIDATION_ERROR";
        }
        if (e instanceof AccountNotFoundException) {
            return "NOT_FOUND";
        }
        if (e instanceof InsufficientStockException) {
            return "INSUFFICIENT_STOCK";
        }
        if (e instanceof AccountHaltedException) {
            return "ACCOUNT_HALTED";
        }
        if (e instanceof ConsistencyViolationException) {
            return "CONSISTENCY_VIOLATION";
        }
        return "CONCURRENT_MODIFICATION";
    }

    private void haltAfterViolation(Long accountId, ConsistencyViolationException violation) {
        log.error("Consistency violation on append, halting account {}: {}", accountId, violation.getMessage());
        try {
            accountService.halt(accountId, violation.getMessage());
        } catch (RuntimeException haltFailure) {
            log.error("Failed to halt account {} after consistency violation", accountId, haltFailure);
            violation.addSuppressed(haltFailure);
        }
    }

    /**
     * Request-shape checks. Nothing here touches the store.
     */
    void validate(Long accountId, TransactionType type, BigDecimal amount, Instant occurredAt,
                  EntryMetadata metadata) {
        if (accountId == null) {
            throw new LedgerValidationException("Account id is required");
        }
        if (type == null) {
            throw new LedgerValidationException("Transaction type is required");
        }
        if (occurredAt == null) {
            throw new LedgerValidationException("Transaction date is required");
        }
        type.validateAmount(amount);
        if (amount.stripTrailingZeros().scale() > MAX_DECIMAL_PLACES) {
            throw new InvalidAmountException(type, amount,
                    "at most " + MAX_DECIMAL_PLACES + " decimal places");
        }
        if (!LedgerEntry.fitsAmountColumn(amount)) {
            throw new InvalidAmountException(type, amount,
                    "at most " + LedgerEntry.MAX_INTEGER_DIGITS + " integer digits");
        }

        requireMaxLength("reference", metadata.getReference(), EntryMetadata.MAX_REFERENCE_LENGTH);
        requireMaxLength("description", metadata.getDescription(), EntryMetadata.MAX_DESCRIPTION_LENGTH);
        requireMaxLength("createdBy", metadata.getCreatedBy(), EntryMetadata.MAX_CREATED_BY_LENGTH);

        LocalDate dueDate = metadata.getDueDate();
        if (dueDate != null) {
            if (!type.carriesDueDate()) {
                throw new LedgerValidationException(type + " entries cannot carry a due date");
            }
            LocalDate transactionDate = LocalDate.ofInstant(occurredAt, clock.getZone());
            if (dueDate.isBefore(transactionDate)) {
                throw new LedgerValidationException(String.format(
                        "Due date %s is before the transaction date %s", dueDate, transactionDate));
            }
        }
        if (metadata.isAllowBackorder() && type.getLedger() != LedgerKind.INVENTORY) {
            throw new LedgerValidationException("Backorder override applies to inventory movements only");
        }
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new LedgerValidationException(String.format(
                    "%s exceeds %d characters", field, max));
        }
    }
}
