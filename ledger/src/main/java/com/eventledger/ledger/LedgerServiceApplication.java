package com.eventledger.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Ledger Service Entry Point
 *
 * Accounts whose money movements can be recorded in the past, edited and deleted,
 * with every later balance replayed in the same transaction.
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication
@EnableKafka
@ComponentScan(basePackages = {"com.eventledger.ledger", "com.eventledger.core"})
@EntityScan("com.eventledger.core.store.jpa")
@EnableJpaRepositories("com.eventledger.core.store.jpa")
public class LedgerServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
    }
}
