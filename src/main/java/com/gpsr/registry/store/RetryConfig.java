package com.gpsr.registry.store;

/**
 * Configuration of the retry-on-conflict strategy.
 *
 * @param maxAttempts      total attempts, including the first one
 * @param initialBackoffMs delay before the second attempt
 * @param multiplier       backoff growth factor between attempts
 */
public record RetryConfig(int maxAttempts, long initialBackoffMs, double multiplier) {

    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initialBackoffMs must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default configuration: 3 attempts, 20ms initial backoff, doubling.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, 20, 2.0);
    }

    /**
     * Returns the delay to wait after the given failed attempt (1-based).
     */
    public long backoffAfterAttempt(int attempt) {
        return (long) (initialBackoffMs * Math.pow(multiplier, attempt - 1));
    }
}
