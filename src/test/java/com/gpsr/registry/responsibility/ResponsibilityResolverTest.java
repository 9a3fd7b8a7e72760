package com.gpsr.registry.responsibility;

import com.gpsr.registry.RacingStore;
import com.gpsr.registry.TestRegistry;
import com.gpsr.registry.config.RegistryConfig;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.entity.RoleType;
import com.gpsr.registry.error.ConflictException;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.metrics.MetricsService;
import com.gpsr.registry.metrics.NoOpMetricsService;
import com.gpsr.registry.product.Product;
import com.gpsr.registry.source.Source;
import com.gpsr.registry.source.SourceType;
import com.gpsr.registry.store.InMemoryRegistryStore;
import com.gpsr.registry.store.UniqueConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.gpsr.registry.schema.RegistrySchema.RESPONSIBILITIES;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ResponsibilityResolver")
class ResponsibilityResolverTest {

    private final MetricsService metrics = mock(MetricsService.class);

    private TestRegistry fixture;
    private ResponsibilityResolver resolver;
    private Product product;
    private Entity entityA;
    private Entity entityB;
    private Source source;

    @BeforeEach
    void setUp() {
        fixture = new TestRegistry(metrics);
        resolver = fixture.registry.responsibilities();
        product = fixture.product(fixture.brand("Acme Toys").getId(), "Wooden train");
        entityA = fixture.entity("Alpha Manufacturing", "PL");
        entityB = fixture.entity("Beta Manufacturing", "PL");
        source = fixture.source(SourceType.PRODUCT_LABEL, "label-photo-1");
    }

    private ProductResponsibility assign(Entity entity, RoleType role, int confidence) {
        return resolver.assign(AssignResponsibility.of(product.id(), "pl", entity.getId(), role,
                source.getId(), confidence));
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("Should replace the active assignment and keep the old one as history")
        void replacesActive() {
            Instant firstAt = fixture.clock.instant();
            ProductResponsibility first = assign(entityA, RoleType.MANUFACTURER, 60);
            fixture.clock.advance(Duration.ofDays(30));
            Instant secondAt = fixture.clock.instant();
            ProductResponsibility second = assign(entityB, RoleType.MANUFACTURER, 90);

            ResolvedResponsibilities resolved = resolver.getResolved(product.id(), "PL");
            ResolvedRole manufacturer = resolved.forRole(RoleType.MANUFACTURER).orElseThrow();
            assertEquals(entityB.getId(), manufacturer.entityId());
            assertEquals("Beta Manufacturing", manufacturer.entityName());
            assertFalse(manufacturer.hasConflicts());
            assertEquals(0, resolved.conflictCount());
            assertEquals(ResolutionMode.CURRENT, resolved.resolutionMode());

            List<ProductResponsibility> history = resolver.getHistory(product.id(), "PL");
            assertEquals(2, history.size());
            assertEquals(second.id(), history.get(0).id());
            ProductResponsibility demoted = history.get(1);
            assertEquals(first.id(), demoted.id());
            assertEquals(ResponsibilityStatus.HISTORICAL, demoted.status());
            assertEquals(firstAt, demoted.validFrom());
            assertEquals(secondAt, demoted.validTo());
        }

        @Test
        @DisplayName("Should keep roles and countries independent")
        void independentKeys() {
            assign(entityA, RoleType.MANUFACTURER, 60);
            assign(entityB, RoleType.IMPORTER, 70);
            resolver.assign(AssignResponsibility.of(product.id(), "DE", entityB.getId(), RoleType.MANUFACTURER,
                    source.getId(), 80));

            ResolvedResponsibilities pl = resolver.getResolved(product.id(), "pl");

            assertEquals(List.of(RoleType.MANUFACTURER, RoleType.IMPORTER), List.copyOf(pl.responsibilities().keySet()));
            assertEquals(entityA.getId(), pl.forRole(RoleType.MANUFACTURER).orElseThrow().entityId());
            assertEquals(2, resolver.getForEntity(entityB.getId()).size());
        }

        @Test
        @DisplayName("Should validate references, confidence and window")
        void validation() {
            assertThrows(NotFoundException.class, () -> resolver.assign(AssignResponsibility.of("missing", "PL",
                    entityA.getId(), RoleType.MANUFACTURER, source.getId(), 50)));
            assertThrows(NotFoundException.class, () -> resolver.assign(AssignResponsibility.of(product.id(),
                    "PL", "missing", RoleType.MANUFACTURER, source.getId(), 50)));
            assertThrows(ValidationException.class, () -> assign(entityA, RoleType.MANUFACTURER, 150));
            Instant from = Instant.parse("2025-06-01T00:00:00Z");
            assertThrows(ValidationException.class, () -> resolver.assign(new AssignResponsibility(product.id(),
                    "PL", entityA.getId(), RoleType.MANUFACTURER, source.getId(), 50, from, from.minusSeconds(1))));
            assertTrue(resolver.getHistory(product.id(), "PL").isEmpty());
        }

        @Test
        @DisplayName("Should never store two active rows for the same key")
        void oneActivePerKey() {
            ProductResponsibility active = assign(entityA, RoleType.MANUFACTURER, 60);
            ProductResponsibility rogue = new ProductResponsibility("rogue", active.productId(), active.countryCode(),
                    entityB.getId(), active.role(), active.sourceId(), 90, ResponsibilityStatus.ACTIVE,
                    active.validFrom(), null, active.createdAt(), active.updatedAt());

            UniqueConstraintViolationException e = assertThrows(UniqueConstraintViolationException.class,
                    () -> fixture.store.inTransaction(tx -> tx.insert(RESPONSIBILITIES, rogue)));
            assertEquals("responsibilities_one_active", e.getConstraint());
        }

        @Test
        @DisplayName("Should report a conflict to the assignment that loses a race for the same key")
        void racingAssignmentConflicts() {
            InMemoryRegistryStore backing = new InMemoryRegistryStore();
            RacingStore racing = new RacingStore(backing);
            TestRegistry racingFixture = new TestRegistry(backing, racing, RegistryConfig.defaults(),
                    new NoOpMetricsService());
            ResponsibilityResolver racingResolver = racingFixture.registry.responsibilities();
            Product train = racingFixture.product(racingFixture.brand("Acme Toys").getId(), "Wooden train");
            Entity alpha = racingFixture.entity("Alpha Manufacturing", "PL");
            Entity beta = racingFixture.entity("Beta Manufacturing", "PL");
            Entity gamma = racingFixture.entity("Gamma Manufacturing", "PL");
            String sourceId = racingFixture.source(SourceType.PRODUCT_LABEL, "label-photo-1").getId();
            racingResolver.assign(AssignResponsibility.of(train.id(), "PL", alpha.getId(), RoleType.MANUFACTURER,
                    sourceId, 60));

            racing.beforeInsert(RESPONSIBILITIES, () -> racingResolver.assign(AssignResponsibility.of(train.id(),
                    "PL", gamma.getId(), RoleType.MANUFACTURER, sourceId, 70)));
            assertThrows(ConflictException.class, () -> racingResolver.assign(AssignResponsibility.of(train.id(),
                    "PL", beta.getId(), RoleType.MANUFACTURER, sourceId, 80)));

            List<ProductResponsibility> active = racingResolver.getForProduct(train.id(), "PL",
                    RoleType.MANUFACTURER, ResponsibilityStatus.ACTIVE);
            assertEquals(1, active.size());
            assertEquals(gamma.getId(), active.get(0).entityId());
            assertEquals(2, racingResolver.getHistory(train.id(), "PL").size());
        }

        @Test
        @DisplayName("Should leave exactly one active row after parallel assignments")
        void parallelAssignments() throws Exception {
            List<Entity> candidates = List.of(entityA, entityB, fixture.entity("Gamma Manufacturing", "PL"),
                    fixture.entity("Delta Manufacturing", "PL"));
            ExecutorService pool = Executors.newFixedThreadPool(candidates.size());
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ProductResponsibility>> futures = new ArrayList<>();
            try {
                for (Entity candidate : candidates) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return assign(candidate, RoleType.MANUFACTURER, 60);
                    }));
                }
                start.countDown();
                int succeeded = 0;
                for (Future<ProductResponsibility> future : futures) {
                    try {
                        future.get(30, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(ConflictException.class, e.getCause());
                    }
                }

                List<ProductResponsibility> rows = resolver.getHistory(product.id(), "PL");
                assertTrue(succeeded >= 1);
                assertEquals(succeeded, rows.size());
                assertEquals(1, rows.stream().filter(ProductResponsibility::isActive).count());
                assertEquals(succeeded - 1, rows.stream()
                        .filter(r -> r.status() == ResponsibilityStatus.HISTORICAL)
                        .count());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should drop a disputed row from the current view")
        void dispute() {
            ProductResponsibility active = assign(entityA, RoleType.MANUFACTURER, 60);

            ProductResponsibility disputed = resolver.dispute(active.id(), "Label shows another company");

            assertEquals(ResponsibilityStatus.DISPUTED, disputed.status());
            assertTrue(resolver.getResolved(product.id(), "PL").responsibilities().isEmpty());
            assertEquals(1, resolver.getForProduct(product.id(), "PL", null, ResponsibilityStatus.DISPUTED).size());
            assertThrows(NotFoundException.class, () -> resolver.dispute("missing", null));
        }
    }

    @Nested
    @DisplayName("Historical resolution")
    class Historical {

        @Test
        @DisplayName("Should resolve the assignment that was valid at the given date")
        void validOnDate() {
            Instant firstAt = fixture.clock.instant();
            assign(entityA, RoleType.MANUFACTURER, 60);
            fixture.clock.advance(Duration.ofDays(30));
            Instant secondAt = fixture.clock.instant();
            assign(entityB, RoleType.MANUFACTURER, 90);

            ResolvedResponsibilities before = resolver.getResolved(product.id(), "PL",
                    firstAt.plus(Duration.ofDays(10)));
            ResolvedResponsibilities after = resolver.getResolved(product.id(), "PL", secondAt);

            assertEquals(ResolutionMode.HISTORICAL, before.resolutionMode());
            assertEquals(entityA.getId(), before.forRole(RoleType.MANUFACTURER).orElseThrow().entityId());
            assertEquals(10, before.forRole(RoleType.MANUFACTURER).orElseThrow().dataFreshnessDays());
            assertEquals(entityB.getId(), after.forRole(RoleType.MANUFACTURER).orElseThrow().entityId());
            assertTrue(resolver.getResolved(product.id(), "PL", firstAt.minusSeconds(1))
                    .responsibilities().isEmpty());
        }

        @Test
        @DisplayName("Should flag overlapping candidates and pick the most confident")
        void overlappingCandidates() {
            ProductResponsibility disputed = assign(entityA, RoleType.MANUFACTURER, 95);
            resolver.dispute(disputed.id(), null);
            fixture.tick();
            assign(entityB, RoleType.MANUFACTURER, 70);
            Instant target = fixture.clock.instant().plus(Duration.ofDays(1));

            ResolvedResponsibilities resolved = resolver.getResolved(product.id(), "PL", target);

            ResolvedRole manufacturer = resolved.forRole(RoleType.MANUFACTURER).orElseThrow();
            assertTrue(manufacturer.hasConflicts());
            assertEquals(2, manufacturer.candidateCount());
            assertEquals(entityA.getId(), manufacturer.entityId());
            assertEquals(1, resolved.conflictCount());
        }

        @Test
        @DisplayName("Should prefer the newer validFrom on a confidence tie")
        void tieBreakOnValidFrom() {
            ProductResponsibility older = new ProductResponsibility("older", "p", "PL", "a", RoleType.IMPORTER, "s",
                    50, ResponsibilityStatus.HISTORICAL, Instant.parse("2024-01-01T00:00:00Z"), null,
                    Instant.parse("2024-01-01T00:00:00Z"), null);
            ProductResponsibility newer = new ProductResponsibility("newer", "p", "PL", "b", RoleType.IMPORTER, "s",
                    50, ResponsibilityStatus.ACTIVE, Instant.parse("2024-06-01T00:00:00Z"), null,
                    Instant.parse("2024-01-01T00:00:00Z"), null);

            assertEquals("newer", List.of(older, newer).stream().min(ResponsibilityResolver.WINNER_ORDER)
                    .orElseThrow().id());
        }
    }

    @Test
    @DisplayName("Should report data freshness in whole days and record the duration")
    void freshnessAndMetrics() {
        assign(entityA, RoleType.MANUFACTURER, 60);
        fixture.clock.advance(Duration.ofDays(12).plusHours(20));

        ResolvedResponsibilities resolved = resolver.getResolved(product.id(), "PL");

        assertEquals(12, resolved.forRole(RoleType.MANUFACTURER).orElseThrow().dataFreshnessDays());
        verify(metrics).recordResolutionDuration(eq(ResolutionMode.CURRENT), any(Duration.class));
    }
}
