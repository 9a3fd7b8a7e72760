package com.gpsr.registry.audit;

import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.store.InMemoryRegistryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditService Tests")
class AuditServiceTest {

    private InMemoryRegistryStore store;
    private AuditService audit;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
        audit = new AuditService();
    }

    @Test
    @DisplayName("Should publish entries only after the transaction commits")
    void publishedOnCommit() {
        store.inTransaction(tx -> {
            audit.record(tx, AuditAction.CREATE, "Entity", "e-1", null, Map.of("legalName", "Acme"));
            assertEquals(0, audit.size());
            return null;
        });

        assertEquals(1, audit.size());
        AuditEntry entry = audit.getEntriesByAction(AuditAction.CREATE).get(0);
        assertNull(entry.previousData());
        assertEquals("Acme", entry.newData().get("legalName").asText());
    }

    @Test
    @DisplayName("Should drop entries of a rolled-back transaction")
    void droppedOnRollback() {
        assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
            audit.record(tx, AuditAction.UPDATE, "Entity", "e-1", Map.of("a", 1), Map.of("a", 2));
            throw new IllegalStateException("rollback");
        }));

        assertEquals(0, audit.size());
    }

    @Test
    @DisplayName("Should page an entity's trail newest first")
    void entityTrail() {
        Instant base = Instant.parse("2025-01-01T00:00:00Z");
        for (int i = 0; i < 3; i++) {
            audit.record(entry(AuditAction.UPDATE, "Entity", "e-1", base.plusSeconds(i)));
        }
        audit.record(entry(AuditAction.UPDATE, "Entity", "e-2", base));

        Page<AuditEntry> page = audit.getForEntity("Entity", "e-1", PageRequest.first(2));

        assertEquals(3, page.totalElements());
        assertEquals(List.of(base.plusSeconds(2), base.plusSeconds(1)),
                page.content().stream().map(AuditEntry::timestamp).toList());
        assertTrue(page.hasNext());
    }

    @Test
    @DisplayName("Should filter recent entries by action and type")
    void recent() {
        Instant base = Instant.parse("2025-01-01T00:00:00Z");
        audit.record(entry(AuditAction.CREATE, "Entity", "e-1", base));
        audit.record(entry(AuditAction.CREATE, "Brand", "b-1", base.plusSeconds(1)));
        audit.record(entry(AuditAction.DEACTIVATE, "Brand", "b-1", base.plusSeconds(2)));

        assertEquals(List.of("b-1", "b-1", "e-1"), audit.getRecent(10, null, null).stream()
                .map(AuditEntry::entityId).toList());
        assertEquals(1, audit.getRecent(10, AuditAction.CREATE, "Brand").size());
        assertEquals(AuditAction.DEACTIVATE, audit.getRecent(1, null, "Brand").get(0).action());
    }

    private static AuditEntry entry(AuditAction action, String type, String id, Instant at) {
        return AuditEntry.builder().action(action).entityType(type).entityId(id).timestamp(at).build();
    }
}
