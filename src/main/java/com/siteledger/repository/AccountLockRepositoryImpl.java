package com.siteledger.repository;

import com.siteledger.domain.Account;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import org.springframework.beans.factory.annotation.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Fragment behind {@link AccountRepository#findByIdForUpdate(Long)}.
 *
 * The timeout travels as the standard jakarta.persistence.lock.timeout hint.
 * Dialects that cannot express it fall back to the transaction timeout set by
 * the recorder, which reads the same property.
 */
public class AccountLockRepositoryImpl implements AccountLockRepository {

    static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    @PersistenceContext
    private EntityManager entityManager;

    private final long lockTimeoutMs;

    public AccountLockRepositoryImpl(@Value("${siteledger.recorder.lock-timeout-ms:5000}") long lockTimeoutMs) {
        if (lockTimeoutMs < 0) {
            throw new IllegalArgumentException("Lock timeout cannot be negative: " + lockTimeoutMs);
        }
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public Optional<Account> findByIdForUpdate(Long accountId) {
        return Optional.ofNullable(entityManager.find(Account.class, accountId, LockModeType.PESSIMISTIC_WRITE,
                Map.of(LOCK_TIMEOUT_HINT, lockTimeoutMs)));
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }
}
