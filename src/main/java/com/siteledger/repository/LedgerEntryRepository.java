package com.siteledger.repository;

import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.TransactionType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for the immutable, append-only entry ledger.
 *
 * Design Notes:
 * - save() is only ever called with NEW entries (append-only), through EntryStore
 * - No delete or update operations (entries are never corrected in place)
 * - No @Transactional here (service layer manages transaction boundaries)
 * - The (account_id, entry_number) unique key rejects a second writer for the same slot
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    /**
     * Latest entry of an account in causal order. Empty for a fresh account.
     */
    Optional<LedgerEntry> findTopByAccountIdOrderByEntryNumberDesc(Long accountId);

    /**
     * One slice of an account's entries. The sort is carried by the pageable.
     * Slices skip the count query, which keeps full-history scans cheap.
     */
    Slice<LedgerEntry> findSliceByAccountId(Long accountId, Pageable pageable);

    /**
     * History page with optional filters; a null parameter disables its condition.
     * {@code until} is exclusive. {@code pattern} is a lower-case LIKE pattern that
     * uses '!' as its escape character.
     */
    @Query("SELECT e FROM LedgerEntry e WHERE e.accountId = :accountId " +
           "AND (:type IS NULL OR e.transactionType = :type) " +
           "AND (:from IS NULL OR e.occurredAt >= :from) " +
           "AND (:until IS NULL OR e.occurredAt < :until) " +
           "AND (:pattern IS NULL " +
           "     OR LOWER(e.reference) LIKE :pattern ESCAPE '!' " +
           "     OR LOWER(e.description) LIKE :pattern ESCAPE '!')")
    Page<LedgerEntry> findHistory(@Param("accountId") Long accountId,
                                  @Param("type") TransactionType type,
                                  @Param("from") Instant from,
                                  @Param("until") Instant until,
                                  @Param("pattern") String pattern,
                                  Pageable pageable);

    long countByAccountId(Long accountId);
}
