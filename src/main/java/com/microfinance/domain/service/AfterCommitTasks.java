package com.microfinance.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Runs best-effort side effects once the current transaction has committed.
 *
 * A failing task is logged and dropped; it never affects the committed ledger
 * write. Without an active transaction the task runs immediately.
 */
@Slf4j
@Component
public class AfterCommitTasks {

    public void run(String description, Runnable task) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    execute(description, task);
                }
            });
        } else {
            execute(description, task);
        }
    }

    private void execute(String description, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Side effect '{}' failed: {}", description, e.getMessage(), e);
        }
    }
}
