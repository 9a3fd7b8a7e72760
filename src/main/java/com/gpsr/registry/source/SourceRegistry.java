package com.gpsr.registry.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.gpsr.registry.schema.RegistrySchema.SOURCES;

/**
 * Deduplicated provenance records.
 *
 * <p>A source with an identifier is unique per {@code (type, identifier)}. Concurrent
 * callers racing to create the same source both end up with the one row that won:
 * the loser's insert fails on the unique key, and the retried transaction finds the
 * winner's row. Sources without an identifier have no dedup key and are always
 * created.</p>
 */
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final RegistryContext ctx;
    private final Cache<SourceKey, Source> cache;
    private final boolean cacheEnabled;

    public SourceRegistry(RegistryContext ctx) {
        this.ctx = ctx;
        SourceCacheConfig cacheConfig = ctx.config().sourceCache();
        this.cacheEnabled = cacheConfig.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheConfig.maxSize())
                .expireAfterWrite(Duration.ofSeconds(cacheConfig.ttlSeconds()))
                .build();
        log.debug("SourceRegistry initialized: cacheEnabled={}, cacheSize={}", cacheEnabled, cacheConfig.maxSize());
    }

    /**
     * Returns the source for {@code (type, identifier)}, creating it if needed.
     * Without an identifier a new source is always created.
     */
    public Source findOrCreate(SourceInfo info) {
        if (!info.hasIdentifier()) {
            return create(info);
        }
        SourceKey key = new SourceKey(info.sourceType(), info.sourceIdentifier());
        Optional<Source> cached = cachedLookup(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        return ctx.runner().executeWithRetry("source.findOrCreate", tx ->
                findByKey(tx, key).orElseGet(() -> insert(tx, info)));
    }

    /**
     * Creates a source unconditionally.
     */
    public Source create(SourceInfo info) {
        return ctx.runner().execute("source.create", tx -> insert(tx, info));
    }

    public Source getById(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Source", id));
    }

    public Optional<Source> findById(String id) {
        return ctx.runner().read(tx -> tx.get(SOURCES, id));
    }

    /**
     * Lists sources, newest first, optionally filtered by type.
     */
    public Page<Source> list(SourceType type, PageRequest page) {
        List<Source> sources = ctx.runner().read(tx -> tx.find(SOURCES, s -> type == null || s.getSourceType() == type));
        List<Source> sorted = sources.stream()
                .sorted(Comparator.comparing(Source::getCreatedAt).reversed())
                .toList();
        return Page.slice(sorted, ctx.page(page));
    }

    /**
     * Administrative edit of the descriptive fields. Null fields keep their value;
     * type and identifier never change. The cached copy is replaced once the edit commits.
     */
    public Source updateDetails(String id, SourceDetails details) {
        Source updated = ctx.runner().execute("source.updateDetails", tx -> {
            Source current = tx.get(SOURCES, id).orElseThrow(() -> new NotFoundException("Source", id));
            Source next = Source.builder(current)
                    .sourceName(details.sourceName() != null ? details.sourceName() : current.getSourceName())
                    .description(details.description() != null ? details.description() : current.getDescription())
                    .sourceUrl(details.sourceUrl() != null ? details.sourceUrl() : current.getSourceUrl())
                    .trustNote(details.trustNote() != null ? details.trustNote() : current.getTrustNote())
                    .updatedAt(ctx.now())
                    .build();
            tx.update(SOURCES, next);
            ctx.audit().record(tx, AuditAction.SOURCE_UPDATED, "Source", id, current, next);
            if (cacheEnabled && next.getSourceIdentifier() != null) {
                tx.afterCommit(() -> cache.put(new SourceKey(next.getSourceType(), next.getSourceIdentifier()), next));
            }
            return next;
        });
        log.info("source.updated sourceId={}", id);
        return updated;
    }

    /**
     * Fails with NotFound unless the source is visible to the transaction.
     */
    public Source requireExists(Transaction tx, String sourceId) {
        return tx.get(SOURCES, sourceId).orElseThrow(() -> new NotFoundException("Source", sourceId));
    }

    private Optional<Source> cachedLookup(SourceKey key) {
        if (!cacheEnabled) {
            return Optional.empty();
        }
        Source hit = cache.getIfPresent(key);
        if (hit != null) {
            ctx.metrics().recordSourceCacheHit();
            return Optional.of(hit);
        }
        ctx.metrics().recordSourceCacheMiss();
        return Optional.empty();
    }

    private Optional<Source> findByKey(Transaction tx, SourceKey key) {
        Optional<Source> existing = tx.findFirst(SOURCES, s ->
                s.getSourceType() == key.type() && key.identifier().equals(s.getSourceIdentifier()));
        existing.ifPresent(source -> remember(tx, key, source));
        return existing;
    }

    private Source insert(Transaction tx, SourceInfo info) {
        Instant now = ctx.now();
        Source source = Source.builder()
                .sourceType(info.sourceType())
                .sourceIdentifier(info.hasIdentifier() ? info.sourceIdentifier() : null)
                .sourceName(info.sourceName())
                .description(info.description())
                .sourceUrl(info.sourceUrl())
                .trustNote(info.trustNote())
                .createdAt(now)
                .updatedAt(now)
                .build();
        tx.insert(SOURCES, source);
        ctx.audit().record(tx, AuditAction.SOURCE_CREATED, "Source", source.getId(), null, source);
        if (source.getSourceIdentifier() != null) {
            remember(tx, new SourceKey(source.getSourceType(), source.getSourceIdentifier()), source);
        }
        tx.afterCommit(() -> log.debug("source.created sourceId={} type={}", source.getId(), source.getSourceType()));
        return source;
    }

    // a copy read before a concurrent updateDetails committed must not replace the newer row
    private void remember(Transaction tx, SourceKey key, Source source) {
        if (cacheEnabled) {
            tx.afterCommit(() -> cache.asMap().merge(key, source,
                    (cached, candidate) -> candidate.getUpdatedAt().isAfter(cached.getUpdatedAt()) ? candidate : cached));
        }
    }

    private record SourceKey(SourceType type, String identifier) {
    }
}
