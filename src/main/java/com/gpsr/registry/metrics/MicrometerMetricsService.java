package com.gpsr.registry.metrics;

import com.gpsr.registry.claim.ClaimStatus;
import com.gpsr.registry.responsibility.ResolutionMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code registry.version.created}: Counter (tag: aggregateType)</li>
 *   <li>{@code registry.conflict.retry}: Counter (tag: operation)</li>
 *   <li>{@code registry.conflict.exhausted}: Counter (tag: operation)</li>
 *   <li>{@code registry.claim.transition}: Counter (tag: status)</li>
 *   <li>{@code registry.responsibility.resolution.duration}: Timer (tag: mode)</li>
 *   <li>{@code registry.duplicates.candidates}: DistributionSummary</li>
 *   <li>{@code registry.source.cache.hit} / {@code registry.source.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary duplicateCandidatesSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.duplicateCandidatesSummary = DistributionSummary.builder("registry.duplicates.candidates")
                .description("Number of duplicate candidates found per lookup")
                .register(registry);
        this.cacheHitCounter = Counter.builder("registry.source.cache.hit")
                .description("Number of source lookup cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("registry.source.cache.miss")
                .description("Number of source lookup cache misses")
                .register(registry);
    }

    @Override
    public void incrementVersionCreated(String aggregateType) {
        counter("registry.version.created", "Number of aggregate versions created",
                "aggregateType", aggregateType).increment();
    }

    @Override
    public void incrementConflictRetry(String operation) {
        counter("registry.conflict.retry", "Number of transactions retried after a unique conflict",
                "operation", operation).increment();
    }

    @Override
    public void incrementConflictExhausted(String operation) {
        counter("registry.conflict.exhausted", "Number of operations that ended in a conflict",
                "operation", operation).increment();
    }

    @Override
    public void incrementClaimTransition(ClaimStatus status) {
        counter("registry.claim.transition", "Number of claims entering a status",
                "status", status.name()).increment();
    }

    @Override
    public void recordResolutionDuration(ResolutionMode mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(mode.name(), k ->
                Timer.builder("registry.responsibility.resolution.duration")
                        .description("Duration of responsibility resolution")
                        .tag("mode", mode.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordDuplicateCandidates(int count) {
        duplicateCandidatesSummary.record(count);
    }

    @Override
    public void recordSourceCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordSourceCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
