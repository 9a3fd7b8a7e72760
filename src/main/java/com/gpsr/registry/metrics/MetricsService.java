package com.gpsr.registry.metrics;

import com.gpsr.registry.claim.ClaimStatus;
import com.gpsr.registry.responsibility.ResolutionMode;

import java.time.Duration;

/**
 * Interface for recording registry metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void incrementVersionCreated(String aggregateType);

    void incrementConflictRetry(String operation);

    void incrementConflictExhausted(String operation);

    void incrementClaimTransition(ClaimStatus status);

    void recordResolutionDuration(ResolutionMode mode, Duration duration);

    void recordDuplicateCandidates(int count);

    void recordSourceCacheHit();

    void recordSourceCacheMiss();
}
