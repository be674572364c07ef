package com.siteledger.repository;

import com.siteledger.domain.Account;

import java.util.Optional;

/**
 * Row lock on an account, with the lock timeout taken from configuration.
 */
public interface AccountLockRepository {

    /**
     * Find account by ID with PESSIMISTIC_WRITE lock.
     *
     * Generates SELECT ... FOR UPDATE. The lock is held until the surrounding
     * transaction commits or rolls back.
     *
     * @throws org.springframework.dao.PessimisticLockingFailureException if the lock cannot be acquired in time
     */
    Optional<Account> findByIdForUpdate(Long accountId);
}
