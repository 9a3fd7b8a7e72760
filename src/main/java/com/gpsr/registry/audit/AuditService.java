package com.gpsr.registry.audit;

import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.json.SnapshotMapper;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Service for recording and querying audit entries.
 *
 * <p>Mutating operations call {@link #record(Transaction, AuditAction, String, String, Object, Object)}
 * from inside their transaction. Snapshots are taken immediately, but the entry is
 * appended to the sink only once the transaction has committed, so a rolled-back
 * write leaves no audit trail behind.</p>
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final SnapshotMapper snapshots;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this(repository, new SnapshotMapper(), Clock.systemUTC());
    }

    /**
     * @param clock stamps entries recorded through a transaction, normally the registry clock
     */
    public AuditService(AuditRepository repository, SnapshotMapper snapshots, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public AuditRepository getRepository() {
        return repository;
    }

    /**
     * Records an audit entry that is published when the transaction commits.
     *
     * @param previous state before the change, or null for creations
     * @param next     state after the change, or null for removals
     */
    public AuditEntry record(Transaction tx, AuditAction action, String entityType, String entityId,
                             Object previous, Object next) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .previousData(snapshots.toJson(previous))
                .newData(snapshots.toJson(next))
                .timestamp(clock.instant())
                .build();
        tx.afterCommit(() -> record(entry));
        return entry;
    }

    /**
     * Appends an entry to the sink directly.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} {}", entry.action(), entry.entityType(), entry.entityId());
        return entry;
    }

    /**
     * Gets the audit trail of one row, newest first.
     */
    public Page<AuditEntry> getForEntity(String entityType, String entityId, PageRequest page) {
        return Page.slice(newestFirst(repository.findByEntity(entityType, entityId)), page);
    }

    /**
     * Gets the most recent entries, optionally filtered by action and entity type.
     */
    public List<AuditEntry> getRecent(int limit, AuditAction action, String entityType) {
        return newestFirst(repository.findAll()).stream()
                .filter(e -> action == null || e.action() == action)
                .filter(e -> entityType == null || entityType.equals(e.entityType()))
                .limit(limit)
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }

    // entries appended in the same millisecond keep reverse append order
    private static List<AuditEntry> newestFirst(List<AuditEntry> entries) {
        List<AuditEntry> sorted = new ArrayList<>(entries);
        Collections.reverse(sorted);
        sorted.sort(Comparator.comparing(AuditEntry::timestamp).reversed());
        return sorted;
    }
}
