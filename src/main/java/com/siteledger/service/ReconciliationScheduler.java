package com.siteledger.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background reconciliation of every account.
 * Cron from siteledger.reconciliation.cron; "-" disables the job.
 */
@Component
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final ReconciliationService reconciliationService;
    private final AccountService accountService;

    public ReconciliationScheduler(ReconciliationService reconciliationService, AccountService accountService) {
        this.reconciliationService = reconciliationService;
        this.accountService = accountService;
    }

    @Scheduled(cron = "${siteledger.reconciliation.cron:0 0 2 * * *}")
    public void reconcileAllAccounts() {
        log.info("=== Scheduled Job: Ledger Reconciliation ===");
        List<Long> accountIds = accountService.findAllIds();
        int inconsistent = 0;
        int failed = 0;
        for (Long accountId : accountIds) {
            try {
                if (!reconciliationService.reconcile(accountId).isConsistent()) {
                    inconsistent++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Error reconciling account {}", accountId, e);
            }
        }
        log.info("Reconciliation finished: accounts={}, inconsistent={}, failed={}",
                accountIds.size(), inconsistent, failed);
    }
}
