package com.siteledger.config;

import com.siteledger.domain.Account;
import com.siteledger.repository.AccountRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Health of the ledgers: DOWN while any account is halted, since a halted
 * account means an unresolved consistency violation.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private static final int MAX_LISTED = 20;

    private final AccountRepository accountRepository;

    public LedgerHealthIndicator(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    public Health health() {
        try {
            long halted = accountRepository.countByHaltedTrue();
            if (halted == 0) {
                return Health.up()
                        .withDetail("haltedAccounts", 0)
                        .build();
            }
            List<Long> ids = accountRepository.findAllByHaltedTrue().stream()
                    .map(Account::getId)
                    .limit(MAX_LISTED)
                    .collect(Collectors.toList());
            return Health.down()
                    .withDetail("haltedAccounts", halted)
                    .withDetail("haltedAccountIds", ids)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
