package com.gpsr.registry;

import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditRepository;
import com.gpsr.registry.audit.AuditService;
import com.gpsr.registry.audit.InMemoryAuditRepository;
import com.gpsr.registry.config.RegistryConfig;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.json.SnapshotMapper;
import com.gpsr.registry.metrics.MetricsService;
import com.gpsr.registry.metrics.NoOpMetricsService;
import com.gpsr.registry.normalize.Normalizer;
import com.gpsr.registry.store.InMemoryRegistryStore;
import com.gpsr.registry.store.RegistryStore;
import com.gpsr.registry.store.TransactionRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Collaborators shared by every registry service.
 *
 * @param clock source of every timestamp the services write
 */
public record RegistryContext(
        TransactionRunner runner,
        AuditService audit,
        MetricsService metrics,
        RegistryConfig config,
        SnapshotMapper snapshots,
        Normalizer normalizer,
        Clock clock
) {
    public RegistryContext {
        Objects.requireNonNull(runner, "runner is required");
        Objects.requireNonNull(audit, "audit is required");
        Objects.requireNonNull(metrics, "metrics is required");
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(snapshots, "snapshots is required");
        Objects.requireNonNull(normalizer, "normalizer is required");
        Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Context over the given store with default configuration and no metrics.
     */
    public static RegistryContext of(RegistryStore store) {
        return of(store, RegistryConfig.defaults(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public static RegistryContext of(RegistryStore store, RegistryConfig config, MetricsService metrics,
                                     Clock clock) {
        return of(store, config, metrics, clock, new InMemoryAuditRepository());
    }

    /**
     * Context whose audit trail is appended to the given repository.
     */
    public static RegistryContext of(RegistryStore store, RegistryConfig config, MetricsService metrics,
                                     Clock clock, AuditRepository auditRepository) {
        SnapshotMapper snapshots = new SnapshotMapper();
        return of(store, config, metrics, clock, new AuditService(auditRepository, snapshots, clock), snapshots);
    }

    public static RegistryContext of(RegistryStore store, RegistryConfig config, MetricsService metrics,
                                     Clock clock, AuditService audit, SnapshotMapper snapshots) {
        return new RegistryContext(
                new TransactionRunner(store, config.retry(), metrics),
                audit,
                metrics,
                config,
                snapshots,
                new Normalizer(),
                clock);
    }

    public static RegistryContext inMemory() {
        return of(new InMemoryRegistryStore());
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Applies the configured default and maximum page size. A null request
     * means the first page.
     */
    public PageRequest page(PageRequest requested) {
        if (requested == null) {
            return PageRequest.first(config.defaultPageLimit());
        }
        return requested.capped(config.maxPageLimit());
    }

    public int confidenceOrDefault(Integer confidence) {
        int value = confidence != null ? confidence : config.defaultConfidence();
        if (value < 0 || value > 100) {
            throw ValidationException.forField("Invalid confidence", "confidence",
                    "must be between 0 and 100");
        }
        return value;
    }
}
