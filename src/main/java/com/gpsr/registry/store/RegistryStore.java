package com.gpsr.registry.store;

/**
 * Transactional key-value store with unique constraints, the persistence seam of
 * the registry. Implementations must provide atomic commit: either every write of
 * a transaction becomes visible, or none does.
 */
public interface RegistryStore {

    /**
     * Runs the work in a new transaction and commits it. If the work throws, or the
     * commit detects a constraint violation, nothing is written and the exception
     * propagates.
     */
    <R> R inTransaction(TransactionWork<R> work);

    /**
     * Runs read-only work. Writes attempted here are committed like any other
     * transaction, so callers should only read.
     */
    default <R> R read(TransactionWork<R> work) {
        return inTransaction(work);
    }
}
