package com.siteledger.service;

import com.siteledger.domain.EntryOrder;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.exception.ConcurrentLedgerModificationException;
import com.siteledger.repository.LedgerEntryRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Durable, append-only storage of ledger entries with a stable total order per account.
 *
 * The store never updates or deletes. Its only write is {@link #append(LedgerEntry)},
 * which refuses anything other than the next entry number.
 */
@Component
public class EntryStore {

    private static final Logger log = LoggerFactory.getLogger(EntryStore.class);

    static final String ENTRY_SLOT_CONSTRAINT = "uk_ledger_account_entry";

    private final LedgerEntryRepository ledgerEntryRepository;
    private final int batchSize;

    public EntryStore(LedgerEntryRepository ledgerEntryRepository,
                      @Value("${siteledger.history.batch-size:500}") int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("History batch size must be positive: " + batchSize);
        }
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.batchSize = batchSize;
    }

    /**
     * Append an entry at the end of its account's ledger.
     *
     * Callers hold the account lock. The number check and the unique key on
     * (account_id, entry_number) still turn a slipped race into a retryable failure.
     *
     * @return the entry number that was written
     * @throws ConcurrentLedgerModificationException if the entry is not exactly latest + 1
     *         or another writer took its number
     */
    public long append(LedgerEntry entry) {
        Long accountId = entry.getAccountId();
        long expected = latest(accountId).map(e -> e.getEntryNumber() + 1).orElse(1L);
        if (entry.getEntryNumber() != expected) {
            throw new ConcurrentLedgerModificationException(accountId, String.format(
                    "Entry %d is not the next entry on account %d (expected %d)",
                    entry.getEntryNumber(), accountId, expected));
        }
        try {
            LedgerEntry saved = ledgerEntryRepository.saveAndFlush(entry);
            log.debug("Appended entry {} to account {}", saved.getEntryNumber(), accountId);
            return saved.getEntryNumber();
        } catch (DataIntegrityViolationException e) {
            if (!violatesEntrySlot(e)) {
                throw e;
            }
            throw new ConcurrentLedgerModificationException(accountId, String.format(
                    "Entry %d on account %d was taken by another writer", entry.getEntryNumber(), accountId), e);
        }
    }

    /**
     * Only the (account_id, entry_number) unique key means another writer won the slot.
     * Any other integrity failure is permanent and must not be retried.
     */
    static boolean violatesEntrySlot(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            String name = null;
            if (cause instanceof ConstraintViolationException) {
                name = ((ConstraintViolationException) cause).getConstraintName();
            }
            if (mentionsEntrySlot(name) || (cause instanceof SQLException && mentionsEntrySlot(cause.getMessage()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsEntrySlot(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(ENTRY_SLOT_CONSTRAINT);
    }

    public Optional<LedgerEntry> latest(Long accountId) {
        return ledgerEntryRepository.findTopByAccountIdOrderByEntryNumberDesc(accountId);
    }

    /**
     * All entries of an account in the given order, read lazily in fixed-size slices.
     * The returned iterable is finite and can be iterated more than once; each
     * iteration starts a fresh scan.
     */
    public Iterable<LedgerEntry> listByAccount(Long accountId, EntryOrder order) {
        return () -> new SliceIterator(accountId, PageRequest.of(0, batchSize, order.getSort()));
    }

    /**
     * One page of entries matching the filter. Filter dates are whole days in {@code zone}.
     */
    public Page<LedgerEntry> page(Long accountId, HistoryFilter filter, ZoneId zone, Pageable pageable) {
        HistoryFilter effective = filter != null ? filter : HistoryFilter.none();
        Instant from = effective.getFrom() != null ? effective.getFrom().atStartOfDay(zone).toInstant() : null;
        Instant until = effective.getTo() != null ? effective.getTo().plusDays(1).atStartOfDay(zone).toInstant() : null;
        return ledgerEntryRepository.findHistory(accountId, effective.getType(), from, until,
                likePattern(effective.getSearch()), pageable);
    }

    /**
     * Case-insensitive "contains" pattern with LIKE wildcards in the text escaped by '!'.
     */
    static String likePattern(String search) {
        if (search == null) {
            return null;
        }
        String escaped = search.toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + escaped + "%";
    }

    public long count(Long accountId) {
        return ledgerEntryRepository.countByAccountId(accountId);
    }

    private final class SliceIterator implements Iterator<LedgerEntry> {

        private final Long accountId;
        private Pageable next;
        private Iterator<LedgerEntry> current = Collections.emptyIterator();

        private SliceIterator(Long accountId, Pageable first) {
            this.accountId = accountId;
            this.next = first;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && next != null) {
                Slice<LedgerEntry> slice = ledgerEntryRepository.findSliceByAccountId(accountId, next);
                current = slice.getContent().iterator();
                next = slice.hasNext() ? slice.nextPageable() : null;
            }
            return current.hasNext();
        }

        @Override
        public LedgerEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
