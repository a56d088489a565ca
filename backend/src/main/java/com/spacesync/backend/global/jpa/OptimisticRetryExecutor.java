package com.spacesync.backend.global.jpa;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs a unit of work in its own transaction and replays it when the commit loses an optimistic
 * version race. Each attempt re-reads its rows, so the work must be free of side effects outside
 * the transaction.
 */
@Component
public class OptimisticRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(OptimisticRetryExecutor.class);

    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public OptimisticRetryExecutor(
            @Qualifier("requiresNewTransactionTemplate") TransactionTemplate transactionTemplate,
            @Value("${app.space.recompute-max-attempts:5}") int maxAttempts
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("recompute-max-attempts must be >= 1");
        }
        this.transactionTemplate = transactionTemplate;
        this.maxAttempts = maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        OptimisticLockingFailureException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (OptimisticLockingFailureException ex) {
                last = ex;
                log.debug("Optimistic conflict on {} (attempt {}/{})", operation, attempt, maxAttempts);
            }
        }
        log.warn("[ALERT] {} still conflicting after {} attempts", operation, maxAttempts);
        throw last;
    }
}
