package com.gpsr.registry.version;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.logging.LogContext;
import com.gpsr.registry.source.Source;
import com.gpsr.registry.source.SourceInfo;
import com.gpsr.registry.source.SourceRegistry;
import com.gpsr.registry.store.Table;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Append-only version chains for one kind of aggregate.
 *
 * <p>Every write inserts a new {@link AggregateVersion} and repoints the aggregate's
 * {@code currentVersionId} in the same transaction. The next version number is read
 * inside the transaction; when two writers read the same maximum, the store's
 * {@code (parentId, versionNumber)} unique key rejects the second commit and the
 * whole transaction is retried, re-reading the maximum.</p>
 *
 * @param <A> the aggregate type
 */
public class VersionStore<A extends Versioned<A>> {
    private static final Logger log = LoggerFactory.getLogger(VersionStore.class);

    private static final Comparator<AggregateVersion> BY_NUMBER =
            Comparator.comparingInt(AggregateVersion::versionNumber);

    private final String aggregateType;
    private final Table<A> aggregates;
    private final Table<AggregateVersion> versions;
    private final SourceRegistry sources;
    private final RegistryContext ctx;

    public VersionStore(String aggregateType, Table<A> aggregates, Table<AggregateVersion> versions,
                        SourceRegistry sources, RegistryContext ctx) {
        this.aggregateType = aggregateType;
        this.aggregates = aggregates;
        this.versions = versions;
        this.sources = sources;
        this.ctx = ctx;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Creates the aggregate with version 1 in one transaction.
     *
     * @param originalInput raw input stored as the version's original data
     */
    public A createWithVersion(A aggregate, Object originalInput, SourceInfo sourceInfo, String changeNote) {
        Source source = sources.findOrCreate(sourceInfo);
        try (LogContext lc = LogContext.forAggregate(aggregateType, aggregate.getId(), "create")) {
            return ctx.runner().execute(aggregateType + ".create",
                    tx -> createInTransaction(tx, aggregate, originalInput, source.getId(), changeNote));
        }
    }

    /**
     * Inserts the aggregate, its first version and the audit entry into an open transaction.
     */
    public A createInTransaction(Transaction tx, A aggregate, Object originalInput, String sourceId,
                                 String changeNote) {
        Instant now = ctx.now();
        tx.insert(aggregates, aggregate);
        AggregateVersion version = AggregateVersion.create(aggregate.getId(), sourceId, 1,
                ctx.snapshots().toJson(originalInput), ctx.snapshots().toJson(aggregate.normalizedData()),
                now, changeNote);
        tx.insert(versions, version);
        A created = aggregate.withCurrentVersion(version.id(), now);
        tx.update(aggregates, created);
        ctx.audit().record(tx, AuditAction.CREATE, aggregateType, created.getId(), null, created);
        afterVersionCommit(tx, version);
        return created;
    }

    /**
     * Appends a new version produced by {@code patch} and repoints the aggregate,
     * retrying the whole transaction when the version number was taken concurrently.
     *
     * @param patch applied to the aggregate as re-read inside each attempt
     * @throws NotFoundException if the aggregate does not exist
     * @throws com.gpsr.registry.error.ConflictException if every attempt lost the race
     */
    public A updateWithNewVersion(String id, UnaryOperator<A> patch, Object originalInput,
                                  SourceInfo sourceInfo, String changeNote) {
        getById(id);
        Source source = sources.findOrCreate(sourceInfo);
        try (LogContext lc = LogContext.forAggregate(aggregateType, id, "update")) {
            return ctx.runner().executeWithRetry(aggregateType + ".update",
                    tx -> updateInTransaction(tx, id, patch, originalInput, source.getId(), changeNote));
        }
    }

    /**
     * Appends a version inside an open transaction. The caller is responsible for
     * retrying the transaction on a unique-constraint violation.
     */
    public A updateInTransaction(Transaction tx, String id, UnaryOperator<A> patch, Object originalInput,
                                 String sourceId, String changeNote) {
        A current = tx.get(aggregates, id).orElseThrow(() -> new NotFoundException(aggregateType, id));
        int nextNumber = nextVersionNumber(tx, id);
        Instant now = ctx.now();
        A patched = patch.apply(current);
        AggregateVersion version = AggregateVersion.create(id, sourceId, nextNumber,
                ctx.snapshots().toJson(originalInput), ctx.snapshots().toJson(patched.normalizedData()),
                now, changeNote);
        tx.insert(versions, version);
        A updated = patched.withCurrentVersion(version.id(), now);
        tx.update(aggregates, updated);
        ctx.audit().record(tx, AuditAction.UPDATE, aggregateType, id, current, updated);
        afterVersionCommit(tx, version);
        return updated;
    }

    /**
     * Soft-deletes the aggregate. History is kept.
     */
    public A deactivate(String id) {
        return ctx.runner().executeWithRetry(aggregateType + ".deactivate", tx -> {
            A current = tx.get(aggregates, id).orElseThrow(() -> new NotFoundException(aggregateType, id));
            A updated = current.withActive(false, ctx.now());
            tx.update(aggregates, updated);
            ctx.audit().record(tx, AuditAction.DEACTIVATE, aggregateType, id,
                    Map.of("isActive", current.isActive()), Map.of("isActive", false));
            tx.afterCommit(() -> log.info("aggregate.deactivated type={} id={}", aggregateType, id));
            return updated;
        });
    }

    public A getById(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException(aggregateType, id));
    }

    public Optional<A> findById(String id) {
        return ctx.runner().read(tx -> tx.get(aggregates, id));
    }

    /**
     * Returns the aggregate with every version, newest first.
     */
    public AggregateHistory<A> getHistory(String id) {
        return ctx.runner().read(tx -> {
            A aggregate = tx.get(aggregates, id).orElseThrow(() -> new NotFoundException(aggregateType, id));
            return new AggregateHistory<>(aggregate, versionsOf(tx, id));
        });
    }

    /**
     * Returns the versions of an aggregate, newest first.
     */
    public List<AggregateVersion> getVersions(String id) {
        return ctx.runner().read(tx -> versionsOf(tx, id));
    }

    public AggregateVersion getVersion(String id, int versionNumber) {
        return ctx.runner().read(tx -> tx.findFirst(versions,
                        v -> v.parentId().equals(id) && v.versionNumber() == versionNumber))
                .orElseThrow(() -> new NotFoundException(aggregateType + " version", id + "#" + versionNumber));
    }

    public Optional<AggregateVersion> findVersionById(String versionId) {
        return ctx.runner().read(tx -> tx.get(versions, versionId));
    }

    /**
     * Returns the version the aggregate currently points at.
     */
    public AggregateVersion getCurrentVersion(String id) {
        A aggregate = getById(id);
        String versionId = aggregate.getCurrentVersionId();
        return ctx.runner().read(tx -> tx.get(versions, versionId))
                .orElseThrow(() -> new NotFoundException(aggregateType + " version", versionId));
    }

    public List<A> list(Predicate<? super A> filter) {
        return ctx.runner().read(tx -> tx.find(aggregates, filter));
    }

    /**
     * Returns {@code max(versionNumber) + 1} for the parent as seen by the transaction.
     */
    public int nextVersionNumber(Transaction tx, String parentId) {
        return tx.findMax(versions, v -> v.parentId().equals(parentId), BY_NUMBER)
                .map(v -> v.versionNumber() + 1)
                .orElse(1);
    }

    List<AggregateVersion> versionsOf(Transaction tx, String parentId) {
        return tx.find(versions, v -> v.parentId().equals(parentId)).stream()
                .sorted(BY_NUMBER.reversed())
                .toList();
    }

    private void afterVersionCommit(Transaction tx, AggregateVersion version) {
        tx.afterCommit(() -> {
            ctx.metrics().incrementVersionCreated(aggregateType);
            log.info("version.created type={} id={} versionNumber={} sourceId={}",
                    aggregateType, version.parentId(), version.versionNumber(), version.sourceId());
        });
    }
}
