package com.gpsr.registry.store;

import com.gpsr.registry.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryRegistryStore")
class InMemoryRegistryStoreTest {

    record Row(String id, String code, boolean flagged) {
    }

    private static final Table<Row> ROWS = Table.<Row>builder("rows", Row::id)
            .resource("Row")
            .unique("rows_code", r -> Table.key(r.code()))
            .unique("rows_one_flagged", r -> r.flagged() ? Table.key("flagged") : null)
            .build();

    private InMemoryRegistryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
    }

    @Nested
    @DisplayName("Visibility")
    class Visibility {

        @Test
        @DisplayName("Should see own uncommitted writes but hide them from other transactions")
        void readCommitted() {
            store.inTransaction(tx -> {
                tx.insert(ROWS, new Row("r1", "A", false));
                assertTrue(tx.exists(ROWS, "r1"));
                boolean visibleToOthers = store.read(other -> other.exists(ROWS, "r1"));
                assertFalse(visibleToOthers);
                return null;
            });

            boolean committed = store.read(tx -> tx.exists(ROWS, "r1"));
            assertTrue(committed);
            assertEquals(1, store.count(ROWS));
        }

        @Test
        @DisplayName("Should discard every write when the work throws")
        void rollbackOnFailure() {
            assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
                tx.insert(ROWS, new Row("r1", "A", false));
                throw new IllegalStateException("boom");
            }));

            assertEquals(0, store.count(ROWS));
        }

        @Test
        @DisplayName("Should return rows in insertion order")
        void insertionOrder() {
            store.inTransaction(tx -> {
                tx.insert(ROWS, new Row("b", "B", false));
                tx.insert(ROWS, new Row("a", "A", false));
                return null;
            });

            List<String> ids = store.read(tx -> tx.find(ROWS, r -> true)).stream().map(Row::id).toList();
            assertEquals(List.of("b", "a"), ids);
        }
    }

    @Nested
    @DisplayName("Unique constraints")
    class UniqueConstraints {

        @Test
        @DisplayName("Should reject a duplicate key inside one transaction")
        void duplicateInTransaction() {
            UniqueConstraintViolationException e = assertThrows(UniqueConstraintViolationException.class,
                    () -> store.inTransaction(tx -> {
                        tx.insert(ROWS, new Row("r1", "A", false));
                        return tx.insert(ROWS, new Row("r2", "A", false));
                    }));

            assertEquals("rows_code", e.getConstraint());
            assertEquals(0, store.count(ROWS));
        }

        @Test
        @DisplayName("Should reject the second of two racing transactions at commit")
        void racingTransactions() {
            assertThrows(UniqueConstraintViolationException.class, () -> store.inTransaction(outer -> {
                outer.insert(ROWS, new Row("r1", "A", false));
                store.inTransaction(inner -> inner.insert(ROWS, new Row("r2", "A", false)));
                return null;
            }));

            List<Row> rows = store.read(tx -> tx.find(ROWS, r -> true));
            assertEquals(1, rows.size());
            assertEquals("r2", rows.get(0).id());
        }

        @Test
        @DisplayName("Should apply a partial key only to rows it covers")
        void partialKey() {
            store.inTransaction(tx -> {
                tx.insert(ROWS, new Row("r1", "A", false));
                tx.insert(ROWS, new Row("r2", "B", false));
                tx.insert(ROWS, new Row("r3", "C", true));
                return null;
            });

            assertThrows(UniqueConstraintViolationException.class,
                    () -> store.inTransaction(tx -> tx.insert(ROWS, new Row("r4", "D", true))));
        }

        @Test
        @DisplayName("Should allow moving a key by demoting the holder first")
        void demoteThenPromote() {
            store.inTransaction(tx -> {
                tx.insert(ROWS, new Row("r1", "A", true));
                tx.insert(ROWS, new Row("r2", "B", false));
                return null;
            });

            store.inTransaction(tx -> {
                tx.update(ROWS, new Row("r1", "A", false));
                return tx.update(ROWS, new Row("r2", "B", true));
            });

            assertTrue(store.read(tx -> tx.get(ROWS, "r2")).orElseThrow().flagged());
        }
    }

    @Nested
    @DisplayName("Updates and deletes")
    class UpdatesAndDeletes {

        @Test
        @DisplayName("Should fail to update a missing row")
        void updateMissing() {
            assertThrows(NotFoundException.class,
                    () -> store.inTransaction(tx -> tx.update(ROWS, new Row("missing", "A", false))));
        }

        @Test
        @DisplayName("Should physically delete a row")
        void delete() {
            store.inTransaction(tx -> tx.insert(ROWS, new Row("r1", "A", false)));

            Row deleted = store.inTransaction(tx -> tx.delete(ROWS, "r1"));

            assertEquals("r1", deleted.id());
            assertEquals(0, store.count(ROWS));
        }

        @Test
        @DisplayName("Should fail when a row was deleted by a concurrent commit")
        void updateAfterConcurrentDelete() {
            store.inTransaction(tx -> tx.insert(ROWS, new Row("r1", "A", false)));

            assertThrows(NotFoundException.class, () -> store.inTransaction(outer -> {
                outer.update(ROWS, new Row("r1", "B", false));
                store.inTransaction(inner -> inner.delete(ROWS, "r1"));
                return null;
            }));
        }
    }

    @Nested
    @DisplayName("Concurrent updates")
    class ConcurrentUpdates {

        @BeforeEach
        void seed() {
            store.inTransaction(tx -> tx.insert(ROWS, new Row("r1", "A", false)));
        }

        @Test
        @DisplayName("Should reject an update based on a row changed by a later commit")
        void staleUpdate() {
            StaleRowException e = assertThrows(StaleRowException.class, () -> store.inTransaction(outer -> {
                Row read = outer.get(ROWS, "r1").orElseThrow();
                store.inTransaction(inner -> inner.update(ROWS, new Row("r1", "B", false)));
                return outer.update(ROWS, new Row(read.id(), read.code(), true));
            }));

            assertEquals(StaleRowException.CONSTRAINT, e.getConstraint());
            Row row = store.read(tx -> tx.get(ROWS, "r1")).orElseThrow();
            assertEquals("B", row.code());
            assertFalse(row.flagged());
        }

        @Test
        @DisplayName("Should detect a stale row read through a query")
        void staleAfterFind() {
            assertThrows(StaleRowException.class, () -> store.inTransaction(outer -> {
                Row read = outer.find(ROWS, r -> r.code().equals("A")).get(0);
                store.inTransaction(inner -> inner.update(ROWS, new Row("r1", "B", false)));
                return outer.delete(ROWS, read.id());
            }));

            assertEquals(1, store.count(ROWS));
        }

        @Test
        @DisplayName("Should accept an update when nobody else committed in between")
        void freshUpdate() {
            store.inTransaction(tx -> {
                Row read = tx.get(ROWS, "r1").orElseThrow();
                tx.update(ROWS, new Row(read.id(), "B", false));
                return tx.update(ROWS, new Row(read.id(), "C", false));
            });

            assertEquals("C", store.read(tx -> tx.get(ROWS, "r1")).orElseThrow().code());
        }

        @Test
        @DisplayName("Should ignore concurrent changes to rows that were only read")
        void readOnlyRowsDoNotConflict() {
            store.inTransaction(tx -> tx.insert(ROWS, new Row("r2", "X", false)));

            store.inTransaction(outer -> {
                outer.get(ROWS, "r2");
                store.inTransaction(inner -> inner.update(ROWS, new Row("r2", "Y", false)));
                return outer.update(ROWS, new Row("r1", "B", false));
            });

            assertEquals("B", store.read(tx -> tx.get(ROWS, "r1")).orElseThrow().code());
            assertEquals("Y", store.read(tx -> tx.get(ROWS, "r2")).orElseThrow().code());
        }
    }

    @Nested
    @DisplayName("After-commit actions")
    class AfterCommit {

        @Test
        @DisplayName("Should run actions only after a successful commit")
        void runsAfterCommit() {
            List<String> events = new ArrayList<>();

            store.inTransaction(tx -> {
                tx.insert(ROWS, new Row("r1", "A", false));
                tx.afterCommit(() -> events.add("committed"));
                assertTrue(events.isEmpty());
                return null;
            });

            assertEquals(List.of("committed"), events);
        }

        @Test
        @DisplayName("Should drop actions of a rolled-back transaction")
        void dropsOnRollback() {
            List<String> events = new ArrayList<>();
            store.inTransaction(tx -> tx.insert(ROWS, new Row("r1", "A", false)));

            assertThrows(UniqueConstraintViolationException.class, () -> store.inTransaction(tx -> {
                tx.afterCommit(() -> events.add("committed"));
                return tx.insert(ROWS, new Row("r2", "A", false));
            }));

            assertTrue(events.isEmpty());
        }
    }
}
