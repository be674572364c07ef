package com.siteledger.repository;

import com.siteledger.domain.Account;
import com.siteledger.domain.LedgerKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger accounts.
 *
 * The account row is the per-account serialization point for the ledger:
 * every writer takes {@link #findByIdForUpdate(Long)} before reading the latest
 * entry, so two appends to the same account can never chain from the same
 * balance. Different accounts lock different rows and never contend.
 *
 * No @Transactional here (service layer manages transaction boundaries).
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long>, AccountLockRepository {

    boolean existsByCode(String code);

    List<Account> findAllByKindOrderByIdAsc(LedgerKind kind);

    List<Account> findAllByOrderByIdAsc();

    /**
     * Ids only, for the reconciliation sweep.
     */
    @Query("SELECT a.id FROM Account a ORDER BY a.id")
    List<Long> findAllIds();

    long countByHaltedTrue();

    List<Account> findAllByHaltedTrue();
}
