package com.siteledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the Site Ledger engine.
 * Supplier and inventory ledgers on one append-only protocol.
 *
 * @EnableTransactionManagement is declared explicitly so that transaction
 * support for the ledger write path is never accidentally disabled.
 */
@SpringBootApplication
@EnableTransactionManagement
public class SiteLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteLedgerApplication.class, args);
    }

}
