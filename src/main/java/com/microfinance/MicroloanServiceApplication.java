package com.microfinance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Microfinance loan back office.
 *
 * Owns the loan fee and schedule engine, the loan lifecycle, the collection and
 * distribution ledgers and the financial metric event store.
 *
 * Architecture:
 * - Ledger mutations and their metric intents commit together (transactional outbox)
 * - A scheduled relay applies metric intents and publishes them to Kafka
 * - Field collections can also arrive as Kafka messages (manual ack, DLQ)
 * - Optimistic locking with retry on the loan ledger
 * - Full metric recalculation as the repair path
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class MicroloanServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MicroloanServiceApplication.class, args);
    }
}
