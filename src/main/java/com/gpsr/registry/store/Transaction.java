package com.gpsr.registry.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A unit of work against the {@link RegistryStore}.
 *
 * <p>Reads see the latest committed state plus this transaction's own writes.
 * Writes are buffered and become visible to others only when the transaction
 * commits. Unique constraints are checked on every write and again at commit
 * against the then-committed state; a violation aborts the whole transaction.</p>
 */
public interface Transaction {

    /**
     * Returns the id of this transaction, for logging.
     */
    String id();

    <T> Optional<T> get(Table<T> table, String id);

    /**
     * Returns all visible rows matching the filter, in insertion order.
     */
    <T> List<T> find(Table<T> table, Predicate<? super T> filter);

    default <T> Optional<T> findFirst(Table<T> table, Predicate<? super T> filter) {
        return find(table, filter).stream().findFirst();
    }

    default <T> Optional<T> findMax(Table<T> table, Predicate<? super T> filter, Comparator<? super T> order) {
        return find(table, filter).stream().max(order);
    }

    default <T> boolean exists(Table<T> table, String id) {
        return get(table, id).isPresent();
    }

    /**
     * Inserts a new row.
     *
     * @throws UniqueConstraintViolationException if the primary key or a unique key is taken
     */
    <T> T insert(Table<T> table, T row);

    /**
     * Replaces an existing row with the same primary key.
     *
     * @throws com.gpsr.registry.error.NotFoundException if the row does not exist
     * @throws UniqueConstraintViolationException if a unique key is taken by another row
     */
    <T> T update(Table<T> table, T row);

    /**
     * Physically removes a row.
     *
     * @throws com.gpsr.registry.error.NotFoundException if the row does not exist
     */
    <T> T delete(Table<T> table, String id);

    /**
     * Registers an action to run once this transaction has committed. Actions of a
     * rolled-back transaction never run.
     */
    void afterCommit(Runnable action);
}
