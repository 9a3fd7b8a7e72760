package com.gpsr.registry.store;

/**
 * Raised at commit when a row this transaction updated or deleted was changed by
 * another transaction that committed after this one read it. The first committer wins.
 */
public class StaleRowException extends TransactionConflictException {

    public static final String CONSTRAINT = "row_version";

    public StaleRowException(String table, String rowId) {
        super("Row " + rowId + " of " + table + " was modified by a concurrent transaction",
                table, CONSTRAINT, rowId);
    }
}
