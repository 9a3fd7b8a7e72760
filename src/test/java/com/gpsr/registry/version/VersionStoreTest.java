package com.gpsr.registry.version;

import com.gpsr.registry.RacingStore;
import com.gpsr.registry.TestRegistry;
import com.gpsr.registry.config.RegistryConfig;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.entity.EntityInput;
import com.gpsr.registry.entity.EntityService;
import com.gpsr.registry.error.ConflictException;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.metrics.NoOpMetricsService;
import com.gpsr.registry.source.SourceCacheConfig;
import com.gpsr.registry.source.SourceInfo;
import com.gpsr.registry.source.SourceType;
import com.gpsr.registry.store.InMemoryRegistryStore;
import com.gpsr.registry.store.RetryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.ENTITY_VERSIONS;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VersionStore")
class VersionStoreTest {

    private static final SourceInfo COMMUNITY = SourceInfo.of(SourceType.COMMUNITY, "forum-thread-1");

    @Nested
    @DisplayName("Version chain")
    class VersionChain {

        private final TestRegistry fixture = new TestRegistry();
        private final EntityService entities = fixture.registry.entities();

        @Test
        @DisplayName("Should keep version 1 intact after an update")
        void historyKeepsOriginal() {
            Entity created = entities.create(EntityInput.of("Acme GmbH", "DE").withAddress("Alte Str. 1", "Berlin"),
                    COMMUNITY);
            String v1 = created.getCurrentVersionId();
            fixture.tick();

            Entity updated = entities.update(created.getId(),
                    new EntityInput(null, "Neue Str. 2", null, null, null, null, null, null, null, null),
                    COMMUNITY, "moved");

            AggregateHistory<Entity> history = entities.getWithHistory(created.getId());
            assertEquals(2, history.versions().size());
            assertEquals(2, history.versions().get(0).versionNumber());
            assertEquals(updated.getCurrentVersionId(), history.versions().get(0).id());
            assertNotEquals(v1, updated.getCurrentVersionId());

            AggregateVersion first = entities.versions().getVersion(created.getId(), 1);
            assertEquals(v1, first.id());
            assertEquals("Alte Str. 1", first.originalData().get("address").asText());
            assertEquals("Neue Str. 2", history.versions().get(0).normalizedData().get("address").asText());
            assertEquals("moved", history.versions().get(0).changeNote());
        }

        @Test
        @DisplayName("Should attribute every version to its source")
        void sourceAttribution() {
            Entity created = entities.create(EntityInput.of("Acme GmbH", "DE"), COMMUNITY);
            SourceInfo registry = SourceInfo.of(SourceType.OFFICIAL_REGISTRY, "KRS-0000123");
            entities.update(created.getId(), EntityInput.of(null, "PL"), registry, null);

            List<AggregateVersion> versions = entities.versions().getVersions(created.getId());
            String registrySourceId = fixture.registry.sources().findOrCreate(registry).getId();
            assertEquals(registrySourceId, versions.get(0).sourceId());
            assertNotEquals(registrySourceId, versions.get(1).sourceId());
        }

        @Test
        @DisplayName("Should point at the current version")
        void currentVersion() {
            Entity created = entities.create(EntityInput.of("Acme", "DE"), COMMUNITY);
            Entity updated = entities.update(created.getId(), EntityInput.of("Acme Two", null), COMMUNITY, null);

            AggregateVersion current = entities.versions().getCurrentVersion(created.getId());

            assertEquals(updated.getCurrentVersionId(), current.id());
            assertEquals(2, current.versionNumber());
        }

        @Test
        @DisplayName("Should fail for an unknown aggregate or version")
        void notFound() {
            Entity created = entities.create(EntityInput.of("Acme", "DE"), COMMUNITY);

            assertThrows(NotFoundException.class,
                    () -> entities.update("missing", EntityInput.of("X", null), COMMUNITY, null));
            assertThrows(NotFoundException.class, () -> entities.versions().getVersion(created.getId(), 7));
            assertThrows(NotFoundException.class, () -> entities.getWithHistory("missing"));
        }

        @Test
        @DisplayName("Should not create a version when deactivating")
        void deactivateKeepsHistory() {
            Entity created = entities.create(EntityInput.of("Acme", "DE"), COMMUNITY);

            Entity deactivated = entities.deactivate(created.getId());

            assertFalse(deactivated.isActive());
            assertEquals(created.getCurrentVersionId(), deactivated.getCurrentVersionId());
            assertEquals(1, entities.versions().getVersions(created.getId()).size());
        }
    }

    @Nested
    @DisplayName("Concurrent writers")
    class ConcurrentWriters {

        @Test
        @DisplayName("Should retry with the next number when another writer took it")
        void loserRetriesWithNextNumber() {
            InMemoryRegistryStore backing = new InMemoryRegistryStore();
            RacingStore racing = new RacingStore(backing);
            TestRegistry fixture = new TestRegistry(backing, racing, RegistryConfig.defaults(),
                    new NoOpMetricsService());
            EntityService entities = fixture.registry.entities();
            Entity created = entities.create(EntityInput.of("Acme", "DE"), COMMUNITY);
            for (int i = 0; i < 3; i++) {
                entities.update(created.getId(), EntityInput.of("Acme " + i, null), COMMUNITY, null);
            }

            racing.beforeInsert(ENTITY_VERSIONS, () -> entities.update(created.getId(), EntityInput.of("Competitor", null), COMMUNITY,
                    "competitor"));
            Entity result = entities.update(created.getId(), EntityInput.of("Retried", null), COMMUNITY, "retried");

            List<AggregateVersion> versions = entities.versions().getVersions(created.getId());
            assertEquals(List.of(6, 5, 4, 3, 2, 1), versions.stream().map(AggregateVersion::versionNumber).toList());
            assertEquals("competitor", versions.get(1).changeNote());
            assertEquals("retried", versions.get(0).changeNote());
            assertEquals(versions.get(0).id(), result.getCurrentVersionId());
            assertEquals("Retried", entities.getById(created.getId()).getNormalizedName());
        }

        @Test
        @DisplayName("Should keep version numbers gapless under parallel updates")
        void parallelUpdates() throws Exception {
            RegistryConfig config = new RegistryConfig(new RetryConfig(50, 1, 1.0), SourceCacheConfig.defaults(),
                    8, 50, 20, 100);
            TestRegistry fixture = new TestRegistry(new InMemoryRegistryStore(), config, new NoOpMetricsService());
            EntityService entities = fixture.registry.entities();
            Entity created = entities.create(EntityInput.of("Acme", "DE"), COMMUNITY);

            int writers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Entity>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < writers; i++) {
                    String name = "Writer " + i;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return entities.update(created.getId(), EntityInput.of(name, null), COMMUNITY, null);
                    }));
                }
                start.countDown();
                int succeeded = 0;
                for (Future<Entity> future : futures) {
                    try {
                        future.get(30, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(ConflictException.class, e.getCause());
                    }
                }

                List<Integer> numbers = entities.versions().getVersions(created.getId()).stream()
                        .map(AggregateVersion::versionNumber)
                        .toList();
                List<Integer> expected = IntStream.rangeClosed(1, succeeded + 1).boxed()
                        .sorted((a, b) -> b - a)
                        .toList();
                assertEquals(expected, numbers);
                assertEquals(entities.versions().getVersion(created.getId(), succeeded + 1).id(),
                        entities.getById(created.getId()).getCurrentVersionId());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should keep the newest version when deactivating races an update")
        void deactivateRacesUpdate() {
            InMemoryRegistryStore backing = new InMemoryRegistryStore();
            RacingStore racing = new RacingStore(backing);
            TestRegistry fixture = new TestRegistry(backing, racing, RegistryConfig.defaults(),
                    new NoOpMetricsService());
            EntityService entities = fixture.registry.entities();
            Entity created = entities.create(EntityInput.of("Acme", "DE"), COMMUNITY);

            racing.beforeUpdate(ENTITIES, () -> entities.update(created.getId(), EntityInput.of("Renamed", null),
                    COMMUNITY, "renamed"));
            Entity deactivated = entities.deactivate(created.getId());

            Entity stored = entities.getById(created.getId());
            AggregateVersion newest = entities.versions().getVersions(created.getId()).get(0);
            assertEquals(2, newest.versionNumber());
            assertEquals(newest.id(), stored.getCurrentVersionId());
            assertEquals("Renamed", stored.getNormalizedName());
            assertFalse(stored.isActive());
            assertEquals(stored.getCurrentVersionId(), deactivated.getCurrentVersionId());
        }
    }
}
