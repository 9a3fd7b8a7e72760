package com.gpsr.registry;

import com.gpsr.registry.store.InMemoryRegistryStore;
import com.gpsr.registry.store.RegistryStore;
import com.gpsr.registry.store.Table;
import com.gpsr.registry.store.Transaction;
import com.gpsr.registry.store.TransactionWork;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Commits a competing write through the backing store right before the first armed
 * insert or update into the watched table, or right after the first armed query of it,
 * so that the race plays out deterministically.
 */
public final class RacingStore implements RegistryStore {
    private final InMemoryRegistryStore delegate;
    private final AtomicReference<Trigger> trigger = new AtomicReference<>();

    private enum Point { BEFORE_INSERT, BEFORE_UPDATE, AFTER_FIND }

    private record Trigger(Table<?> table, Point point, Runnable competitor) {
    }

    public RacingStore(InMemoryRegistryStore delegate) {
        this.delegate = delegate;
    }

    /**
     * Runs {@code competitor} once, before the next insert into {@code table}.
     */
    public void beforeInsert(Table<?> table, Runnable competitor) {
        trigger.set(new Trigger(table, Point.BEFORE_INSERT, competitor));
    }

    /**
     * Runs {@code competitor} once, before the next update of a row of {@code table}.
     */
    public void beforeUpdate(Table<?> table, Runnable competitor) {
        trigger.set(new Trigger(table, Point.BEFORE_UPDATE, competitor));
    }

    /**
     * Runs {@code competitor} once, after the next query of {@code table} has read its rows.
     */
    public void afterFind(Table<?> table, Runnable competitor) {
        trigger.set(new Trigger(table, Point.AFTER_FIND, competitor));
    }

    @Override
    public <R> R inTransaction(TransactionWork<R> work) {
        return delegate.inTransaction(tx -> work.execute(new InterceptingTransaction(tx)));
    }

    private void fire(Table<?> table, Point point) {
        Trigger armed = trigger.get();
        if (armed != null && armed.table() == table && armed.point() == point
                && trigger.compareAndSet(armed, null)) {
            armed.competitor().run();
        }
    }

    private final class InterceptingTransaction implements Transaction {
        private final Transaction tx;

        private InterceptingTransaction(Transaction tx) {
            this.tx = tx;
        }

        @Override
        public String id() {
            return tx.id();
        }

        @Override
        public <T> Optional<T> get(Table<T> table, String id) {
            return tx.get(table, id);
        }

        @Override
        public <T> List<T> find(Table<T> table, Predicate<? super T> filter) {
            List<T> rows = tx.find(table, filter);
            fire(table, Point.AFTER_FIND);
            return rows;
        }

        @Override
        public <T> T insert(Table<T> table, T row) {
            fire(table, Point.BEFORE_INSERT);
            return tx.insert(table, row);
        }

        @Override
        public <T> T update(Table<T> table, T row) {
            fire(table, Point.BEFORE_UPDATE);
            return tx.update(table, row);
        }

        @Override
        public <T> T delete(Table<T> table, String id) {
            return tx.delete(table, id);
        }

        @Override
        public void afterCommit(Runnable action) {
            tx.afterCommit(action);
        }
    }
}
