package com.siteledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Ledger-wide beans.
 *
 * The clock carries the ledger's time zone: "today" for overdue checks and the
 * date of a transaction for payment terms are both taken in this zone.
 */
@Configuration
@EnableScheduling
public class LedgerConfig {

    @Bean
    public Clock ledgerClock(@Value("${siteledger.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
