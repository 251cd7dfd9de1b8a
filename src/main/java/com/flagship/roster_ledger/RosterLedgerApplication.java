package com.flagship.roster_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Roster ledger service.
 *
 * Owns the league roster ledger (which team holds which player), executes
 * add/drop moves against it and resolves waiver claims in priority order.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class RosterLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RosterLedgerApplication.class, args);
    }
}
