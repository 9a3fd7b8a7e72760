package com.gpsr.registry.store;

import com.gpsr.registry.error.ConflictException;
import com.gpsr.registry.metrics.MetricsService;
import com.gpsr.registry.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs store transactions and owns the retry-on-conflict discipline.
 *
 * <p>{@link #execute} runs a transaction once. {@link #executeWithRetry} re-runs the
 * whole transaction when it fails on a unique constraint or on a row another
 * transaction changed underneath it, so every attempt re-derives the values that may
 * have changed (the max version number, a source that another caller just created,
 * the current state of a claim). Any other failure propagates immediately. In both
 * cases a conflict that escapes is reported as a {@link ConflictException}.</p>
 */
public class TransactionRunner {
    private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

    private final RegistryStore store;
    private final RetryConfig config;
    private final MetricsService metrics;

    public TransactionRunner(RegistryStore store) {
        this(store, RetryConfig.defaults(), new NoOpMetricsService());
    }

    public TransactionRunner(RegistryStore store, RetryConfig config, MetricsService metrics) {
        this.store = store;
        this.config = config;
        this.metrics = metrics;
    }

    public RegistryStore getStore() {
        return store;
    }

    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Runs read-only work.
     */
    public <R> R read(TransactionWork<R> work) {
        return store.read(work);
    }

    /**
     * Runs the work in a single transaction without retrying.
     */
    public <R> R execute(String operation, TransactionWork<R> work) {
        try {
            return store.inTransaction(work);
        } catch (TransactionConflictException e) {
            log.warn("store.conflict operation={} constraint={} key={}", operation, e.getConstraint(), e.getKey());
            metrics.incrementConflictExhausted(operation);
            throw new ConflictException("Concurrent modification during " + operation + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs the work in a transaction, retrying the whole transaction on a
     * {@link TransactionConflictException} with exponential backoff.
     *
     * @throws ConflictException when every attempt hit a conflict
     */
    public <R> R executeWithRetry(String operation, TransactionWork<R> work) {
        TransactionConflictException lastConflict = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                R result = store.inTransaction(work);
                if (attempt > 1) {
                    log.debug("store.retry.succeeded operation={} attempt={}", operation, attempt);
                }
                return result;
            } catch (TransactionConflictException e) {
                lastConflict = e;
                log.warn("store.conflict operation={} attempt={}/{} constraint={}",
                        operation, attempt, config.maxAttempts(), e.getConstraint());
                if (attempt < config.maxAttempts()) {
                    metrics.incrementConflictRetry(operation);
                    sleep(config.backoffAfterAttempt(attempt));
                }
            }
        }
        metrics.incrementConflictExhausted(operation);
        throw new ConflictException("Concurrent modification during " + operation
                + " persisted after " + config.maxAttempts() + " attempts", lastConflict);
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Interrupted while backing off from a conflict", e);
        }
    }
}
