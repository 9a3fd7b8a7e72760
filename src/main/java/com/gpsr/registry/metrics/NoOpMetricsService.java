package com.gpsr.registry.metrics;

import com.gpsr.registry.claim.ClaimStatus;
import com.gpsr.registry.responsibility.ResolutionMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementVersionCreated(String aggregateType) {
    }

    @Override
    public void incrementConflictRetry(String operation) {
    }

    @Override
    public void incrementConflictExhausted(String operation) {
    }

    @Override
    public void incrementClaimTransition(ClaimStatus status) {
    }

    @Override
    public void recordResolutionDuration(ResolutionMode mode, Duration duration) {
    }

    @Override
    public void recordDuplicateCandidates(int count) {
    }

    @Override
    public void recordSourceCacheHit() {
    }

    @Override
    public void recordSourceCacheMiss() {
    }
}
