package com.gpsr.registry.store;

/**
 * Raised by the store when a write would duplicate a primary key or unique key.
 */
public class UniqueConstraintViolationException extends TransactionConflictException {

    public UniqueConstraintViolationException(String table, String constraint, Object key) {
        super("Unique constraint '" + constraint + "' violated on " + table + " for key " + key,
                table, constraint, key);
    }
}
