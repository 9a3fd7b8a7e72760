package com.gpsr.registry.store;

import com.gpsr.registry.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link RegistryStore}.
 * Suitable for testing and single-JVM deployments.
 *
 * <p>Transactions buffer their writes and validate them at commit against the
 * latest committed state, under a store-wide write lock. Two transactions that both
 * read the same state and insert conflicting keys therefore do not block each
 * other; the second one to commit fails with a
 * {@link UniqueConstraintViolationException}, as it would against a relational
 * database with unique indexes.</p>
 *
 * <p>Updates and deletes are checked optimistically: a transaction remembers the
 * committed row it first read, and its commit fails with a {@link StaleRowException}
 * if another transaction committed a different row under the same id in between.</p>
 */
public class InMemoryRegistryStore implements RegistryStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRegistryStore.class);

    private static final Object DELETED = new Object();

    private final Map<String, LinkedHashMap<String, Object>> committed = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong transactionCounter = new AtomicLong();

    @Override
    public <R> R inTransaction(TransactionWork<R> work) {
        InMemoryTransaction tx = new InMemoryTransaction("tx-" + transactionCounter.incrementAndGet());
        R result = work.execute(tx);
        commit(tx);
        for (Runnable action : tx.afterCommitActions) {
            action.run();
        }
        return result;
    }

    /**
     * Returns the number of committed rows in a table.
     */
    public int count(Table<?> table) {
        lock.readLock().lock();
        try {
            Map<String, Object> rows = committed.get(table.name());
            return rows != null ? rows.size() : 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void commit(InMemoryTransaction tx) {
        if (tx.pending.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, LinkedHashMap<String, Object>> entry : tx.pending.entrySet()) {
                validate(tx, tx.tables.get(entry.getKey()), entry.getValue());
            }
            for (Map.Entry<String, LinkedHashMap<String, Object>> entry : tx.pending.entrySet()) {
                LinkedHashMap<String, Object> rows = committed.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>());
                entry.getValue().forEach((id, row) -> {
                    if (row == DELETED) {
                        rows.remove(id);
                    } else {
                        rows.put(id, row);
                    }
                });
            }
            log.trace("Committed transaction {} touching {} tables", tx.id, tx.pending.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void validate(InMemoryTransaction tx, Table<?> rawTable, Map<String, Object> writes) {
        Table<T> table = (Table<T>) rawTable;
        Map<String, Object> rows = committed.getOrDefault(table.name(), new LinkedHashMap<>());
        Set<String> inserted = tx.inserted.getOrDefault(table.name(), Set.of());

        for (Map.Entry<String, Object> write : writes.entrySet()) {
            String id = write.getKey();
            if (inserted.contains(id) && rows.containsKey(id)) {
                throw new UniqueConstraintViolationException(table.name(), "primary_key", id);
            }
            if (!inserted.contains(id) && !rows.containsKey(id)) {
                throw new NotFoundException(table.resource(), id);
            }
        }

        Map<String, Object> view = new LinkedHashMap<>(rows);
        writes.forEach((id, row) -> {
            if (row == DELETED) {
                view.remove(id);
            } else {
                view.put(id, row);
            }
        });
        for (Map.Entry<String, Object> write : writes.entrySet()) {
            if (write.getValue() != DELETED) {
                checkUnique(table, write.getKey(), (T) write.getValue(), view);
            }
        }

        Map<String, Object> basis = tx.basis.getOrDefault(table.name(), Map.of());
        for (Map.Entry<String, Object> based : basis.entrySet()) {
            if (writes.containsKey(based.getKey()) && rows.get(based.getKey()) != based.getValue()) {
                throw new StaleRowException(table.name(), based.getKey());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> void checkUnique(Table<T> table, String id, T row, Map<String, Object> view) {
        for (Table.UniqueConstraint<T> constraint : table.uniqueConstraints()) {
            Object key = constraint.keyOf(row);
            if (key == null) {
                continue;
            }
            for (Map.Entry<String, Object> other : view.entrySet()) {
                if (!other.getKey().equals(id) && Objects.equals(key, constraint.keyOf((T) other.getValue()))) {
                    throw new UniqueConstraintViolationException(table.name(), constraint.name(), key);
                }
            }
        }
    }

    private final class InMemoryTransaction implements Transaction {
        private final String id;
        private final Map<String, LinkedHashMap<String, Object>> pending = new LinkedHashMap<>();
        private final Map<String, Set<String>> inserted = new HashMap<>();
        private final Map<String, Table<?>> tables = new HashMap<>();
        // committed rows as first read by this transaction, per table
        private final Map<String, Map<String, Object>> observed = new HashMap<>();
        // committed rows this transaction's updates and deletes are based on
        private final Map<String, Map<String, Object>> basis = new HashMap<>();
        private final List<Runnable> afterCommitActions = new ArrayList<>();

        private InMemoryTransaction(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> Optional<T> get(Table<T> table, String rowId) {
            Map<String, Object> writes = pending.get(table.name());
            if (writes != null && writes.containsKey(rowId)) {
                Object row = writes.get(rowId);
                return row == DELETED ? Optional.empty() : Optional.of((T) row);
            }
            Object row;
            lock.readLock().lock();
            try {
                Map<String, Object> rows = committed.get(table.name());
                row = rows != null ? rows.get(rowId) : null;
            } finally {
                lock.readLock().unlock();
            }
            if (row != null) {
                observe(table, rowId, row);
            }
            return Optional.ofNullable((T) row);
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> List<T> find(Table<T> table, Predicate<? super T> filter) {
            Map<String, Object> writes = pending.getOrDefault(table.name(), new LinkedHashMap<>());
            List<T> matches = new ArrayList<>();
            visibleRows(table).forEach((rowId, row) -> {
                if (filter.test((T) row)) {
                    if (!writes.containsKey(rowId)) {
                        observe(table, rowId, row);
                    }
                    matches.add((T) row);
                }
            });
            return matches;
        }

        @Override
        public <T> T insert(Table<T> table, T row) {
            String rowId = table.idOf(row);
            if (get(table, rowId).isPresent()) {
                throw new UniqueConstraintViolationException(table.name(), "primary_key", rowId);
            }
            write(table, rowId, row);
            inserted.computeIfAbsent(table.name(), k -> new HashSet<>()).add(rowId);
            return row;
        }

        @Override
        public <T> T update(Table<T> table, T row) {
            String rowId = table.idOf(row);
            if (get(table, rowId).isEmpty()) {
                throw new NotFoundException(table.resource(), rowId);
            }
            recordBasis(table, rowId);
            write(table, rowId, row);
            return row;
        }

        @Override
        public <T> T delete(Table<T> table, String rowId) {
            T existing = get(table, rowId).orElseThrow(() -> new NotFoundException(table.resource(), rowId));
            recordBasis(table, rowId);
            tables.put(table.name(), table);
            pending.computeIfAbsent(table.name(), k -> new LinkedHashMap<>()).put(rowId, DELETED);
            Set<String> insertedIds = inserted.get(table.name());
            if (insertedIds != null && insertedIds.remove(rowId)) {
                pending.get(table.name()).remove(rowId);
            }
            return existing;
        }

        @Override
        public void afterCommit(Runnable action) {
            afterCommitActions.add(action);
        }

        private void observe(Table<?> table, String rowId, Object row) {
            observed.computeIfAbsent(table.name(), k -> new HashMap<>()).putIfAbsent(rowId, row);
        }

        private void recordBasis(Table<?> table, String rowId) {
            Set<String> insertedIds = inserted.get(table.name());
            if (insertedIds != null && insertedIds.contains(rowId)) {
                return;
            }
            Object seen = observed.getOrDefault(table.name(), Map.of()).get(rowId);
            if (seen != null) {
                basis.computeIfAbsent(table.name(), k -> new HashMap<>()).putIfAbsent(rowId, seen);
            }
        }

        private <T> void write(Table<T> table, String rowId, T row) {
            Map<String, Object> view = visibleRows(table);
            view.put(rowId, row);
            checkUnique(table, rowId, row, view);
            tables.put(table.name(), table);
            pending.computeIfAbsent(table.name(), k -> new LinkedHashMap<>()).put(rowId, row);
        }

        private Map<String, Object> visibleRows(Table<?> table) {
            LinkedHashMap<String, Object> view;
            lock.readLock().lock();
            try {
                Map<String, Object> rows = committed.get(table.name());
                view = rows != null ? new LinkedHashMap<>(rows) : new LinkedHashMap<>();
            } finally {
                lock.readLock().unlock();
            }
            Map<String, Object> writes = pending.get(table.name());
            if (writes != null) {
                writes.forEach((rowId, row) -> {
                    if (row == DELETED) {
                        view.remove(rowId);
                    } else {
                        view.put(rowId, row);
                    }
                });
            }
            return view;
        }
    }
}
