package com.gpsr.registry.metrics;

import com.gpsr.registry.claim.ClaimStatus;
import com.gpsr.registry.responsibility.ResolutionMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.incrementVersionCreated("Entity");
                noOp.incrementConflictRetry("Entity.update");
                noOp.incrementConflictExhausted("Entity.update");
                noOp.incrementClaimTransition(ClaimStatus.ACCEPTED);
                noOp.recordResolutionDuration(ResolutionMode.CURRENT, Duration.ofMillis(3));
                noOp.recordDuplicateCandidates(2);
                noOp.recordSourceCacheHit();
                noOp.recordSourceCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count versions per aggregate type")
        void versionCreated() {
            metrics.incrementVersionCreated("Entity");
            metrics.incrementVersionCreated("Entity");
            metrics.incrementVersionCreated("Brand");

            Counter entity = registry.find("registry.version.created").tag("aggregateType", "Entity").counter();
            Counter brand = registry.find("registry.version.created").tag("aggregateType", "Brand").counter();

            assertNotNull(entity);
            assertEquals(2.0, entity.count());
            assertNotNull(brand);
            assertEquals(1.0, brand.count());
        }

        @Test
        @DisplayName("Should count retries and exhausted conflicts separately")
        void conflicts() {
            metrics.incrementConflictRetry("SafetyInfo.add");
            metrics.incrementConflictRetry("SafetyInfo.add");
            metrics.incrementConflictExhausted("SafetyInfo.add");

            assertEquals(2.0, registry.find("registry.conflict.retry").tag("operation", "SafetyInfo.add")
                    .counter().count());
            assertEquals(1.0, registry.find("registry.conflict.exhausted").tag("operation", "SafetyInfo.add")
                    .counter().count());
        }

        @Test
        @DisplayName("Should count claim transitions by status")
        void claimTransitions() {
            metrics.incrementClaimTransition(ClaimStatus.ACCEPTED);
            metrics.incrementClaimTransition(ClaimStatus.REJECTED);

            assertEquals(1.0, registry.find("registry.claim.transition").tag("status", "ACCEPTED")
                    .counter().count());
        }

        @Test
        @DisplayName("Should time resolutions per mode")
        void resolutionDuration() {
            metrics.recordResolutionDuration(ResolutionMode.CURRENT, Duration.ofMillis(5));
            metrics.recordResolutionDuration(ResolutionMode.CURRENT, Duration.ofMillis(7));
            metrics.recordResolutionDuration(ResolutionMode.HISTORICAL, Duration.ofMillis(9));

            Timer current = registry.find("registry.responsibility.resolution.duration")
                    .tag("mode", "CURRENT").timer();

            assertNotNull(current);
            assertEquals(2, current.count());
        }

        @Test
        @DisplayName("Should summarize duplicate candidate counts")
        void duplicateCandidates() {
            metrics.recordDuplicateCandidates(0);
            metrics.recordDuplicateCandidates(4);

            DistributionSummary summary = registry.find("registry.duplicates.candidates").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(4.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count source cache hits and misses")
        void sourceCache() {
            metrics.recordSourceCacheHit();
            metrics.recordSourceCacheMiss();
            metrics.recordSourceCacheMiss();

            assertEquals(1.0, registry.find("registry.source.cache.hit").counter().count());
            assertEquals(2.0, registry.find("registry.source.cache.miss").counter().count());
        }
    }
}
