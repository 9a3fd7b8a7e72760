package com.gpsr.registry.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only sink for audit entries.
 * Implementations provide different storage backends; the core only appends and reads.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    /**
     * Gets all entries in append order.
     */
    List<AuditEntry> findAll();

    /**
     * Gets entries for one audited row, in append order.
     */
    List<AuditEntry> findByEntity(String entityType, String entityId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
