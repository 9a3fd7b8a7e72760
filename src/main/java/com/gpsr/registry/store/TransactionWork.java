package com.gpsr.registry.store;

/**
 * Work executed inside a single store transaction.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface TransactionWork<R> {

    R execute(Transaction tx);
}
