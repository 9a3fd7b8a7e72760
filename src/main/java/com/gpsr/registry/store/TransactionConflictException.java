package com.gpsr.registry.store;

/**
 * Raised by the store when a transaction cannot commit because of a concurrent
 * transaction. This is the signal the retry wrapper reacts to.
 */
public abstract class TransactionConflictException extends RuntimeException {

    private final String table;
    private final String constraint;
    private final Object key;

    protected TransactionConflictException(String message, String table, String constraint, Object key) {
        super(message);
        this.table = table;
        this.constraint = constraint;
        this.key = key;
    }

    public String getTable() {
        return table;
    }

    /**
     * Name of the violated constraint, {@code row_version} for a stale update.
     */
    public String getConstraint() {
        return constraint;
    }

    public Object getKey() {
        return key;
    }
}
