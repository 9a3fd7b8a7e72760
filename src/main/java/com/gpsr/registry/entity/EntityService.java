package com.gpsr.registry.entity;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.logging.LogContext;
import com.gpsr.registry.normalize.Normalizer;
import com.gpsr.registry.source.Source;
import com.gpsr.registry.source.SourceInfo;
import com.gpsr.registry.source.SourceRegistry;
import com.gpsr.registry.version.AggregateHistory;
import com.gpsr.registry.version.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.ENTITY_ROLES;
import static com.gpsr.registry.schema.RegistrySchema.ENTITY_VERSIONS;

/**
 * Creates, versions and queries regulatory entities.
 *
 * <p>Every write is normalized first; the raw input is kept as the version's
 * original data and the normalized state as its normalized data.</p>
 */
public class EntityService {
    private static final Logger log = LoggerFactory.getLogger(EntityService.class);

    public static final String AGGREGATE_TYPE = "Entity";

    private final RegistryContext ctx;
    private final SourceRegistry sources;
    private final VersionStore<Entity> versions;
    private final Normalizer normalizer;

    public EntityService(RegistryContext ctx, SourceRegistry sources) {
        this.ctx = ctx;
        this.sources = sources;
        this.versions = new VersionStore<>(AGGREGATE_TYPE, ENTITIES, ENTITY_VERSIONS, sources, ctx);
        this.normalizer = ctx.normalizer();
    }

    /**
     * Creates an entity with version 1 and, when the input names one, its first role.
     */
    public Entity create(EntityInput input, SourceInfo sourceInfo) {
        validateForCreate(input);
        Instant now = ctx.now();
        Entity entity = Entity.builder()
                .name(input.name().trim())
                .normalizedName(normalizer.name(input.name()))
                .address(normalizer.address(input.address()))
                .city(trimToNull(input.city()))
                .country(normalizer.country(input.country()))
                .vatId(normalizer.vatId(input.vatId()))
                .email(normalizer.email(input.email()))
                .phone(normalizer.phone(input.phone()))
                .website(normalizer.website(input.website()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        Source source = sources.findOrCreate(sourceInfo);
        try (LogContext lc = LogContext.forAggregate(AGGREGATE_TYPE, entity.getId(), "create")) {
            Entity created = ctx.runner().execute("Entity.create", tx -> {
                Entity result = versions.createInTransaction(tx, entity, input, source.getId(), null);
                if (input.role() != null) {
                    EntityRole role = new EntityRole(UUID.randomUUID().toString(), result.getId(), input.role(),
                            input.marketContext(), null, now, null, true, now);
                    tx.insert(ENTITY_ROLES, role);
                }
                return result;
            });
            log.info("entity.created name='{}' country={}", created.getNormalizedName(), created.getCountry());
            return created;
        }
    }

    /**
     * Appends a version with the non-null fields of the input applied.
     */
    public Entity update(String id, EntityInput input, SourceInfo sourceInfo, String changeNote) {
        if (input.name() != null && input.name().isBlank()) {
            throw ValidationException.forField("Invalid entity", "name", "must not be blank");
        }
        return versions.updateWithNewVersion(id, current -> applyPatch(current, input), input, sourceInfo,
                changeNote);
    }

    public Entity getById(String id) {
        return versions.getById(id);
    }

    public Optional<Entity> findById(String id) {
        return versions.findById(id);
    }

    /**
     * Returns the entity with its full version chain, newest first.
     */
    public AggregateHistory<Entity> getWithHistory(String id) {
        return versions.getHistory(id);
    }

    public VersionStore<Entity> versions() {
        return versions;
    }

    /**
     * Lists entities ordered by normalized name.
     */
    public Page<Entity> list(EntityQuery query, PageRequest page) {
        String search = query.search() != null ? query.search().toLowerCase(Locale.ROOT) : null;
        String country = query.country() != null ? normalizer.country(query.country()) : null;
        Set<String> withRole = query.role() != null ? entitiesWithActiveRole(query.role()) : null;

        List<Entity> matches = versions.list(e ->
                        e.isActive() == query.activeOnly()
                                && (search == null || e.getNormalizedName().toLowerCase(Locale.ROOT).contains(search))
                                && (country == null || country.equals(e.getCountry()))
                                && (withRole == null || withRole.contains(e.getId())))
                .stream()
                .sorted(Comparator.comparing(Entity::getNormalizedName))
                .toList();
        return Page.slice(matches, ctx.page(page));
    }

    /**
     * Adds a role to an entity.
     *
     * @param validFrom null for now
     */
    public EntityRole addRole(String entityId, RoleType roleType, String marketContext, String productScope,
                              Instant validFrom, Instant validTo) {
        return ctx.runner().execute("Entity.addRole", tx -> {
            if (!tx.exists(ENTITIES, entityId)) {
                throw new NotFoundException(AGGREGATE_TYPE, entityId);
            }
            Instant now = ctx.now();
            Instant from = validFrom != null ? validFrom : now;
            if (validTo != null && !validTo.isAfter(from)) {
                throw ValidationException.forField("Invalid role", "validTo", "must be after validFrom");
            }
            EntityRole role = new EntityRole(UUID.randomUUID().toString(), entityId, roleType, marketContext,
                    productScope, from, validTo, true, now);
            tx.insert(ENTITY_ROLES, role);
            ctx.audit().record(tx, AuditAction.ADD_ROLE, "EntityRole", role.id(), null, role);
            return role;
        });
    }

    /**
     * Active, open-ended roles of an entity, newest first.
     */
    public List<EntityRole> getRoles(String entityId) {
        return ctx.runner().read(tx -> tx.find(ENTITY_ROLES,
                        r -> r.entityId().equals(entityId) && r.active() && r.validTo() == null))
                .stream()
                .sorted(Comparator.comparing(EntityRole::createdAt).reversed())
                .toList();
    }

    public Entity deactivate(String id) {
        return versions.deactivate(id);
    }

    private Entity applyPatch(Entity current, EntityInput input) {
        Entity.Builder builder = Entity.builder(current);
        if (input.name() != null) {
            builder.name(input.name().trim()).normalizedName(normalizer.name(input.name()));
        }
        if (input.country() != null) {
            builder.country(normalizer.country(input.country()));
        }
        if (input.address() != null) {
            builder.address(normalizer.address(input.address()));
        }
        if (input.city() != null) {
            builder.city(trimToNull(input.city()));
        }
        if (input.vatId() != null) {
            builder.vatId(normalizer.vatId(input.vatId()));
        }
        if (input.email() != null) {
            builder.email(normalizer.email(input.email()));
        }
        if (input.phone() != null) {
            builder.phone(normalizer.phone(input.phone()));
        }
        if (input.website() != null) {
            builder.website(normalizer.website(input.website()));
        }
        return builder.build();
    }

    private Set<String> entitiesWithActiveRole(RoleType role) {
        return ctx.runner().read(tx -> tx.find(ENTITY_ROLES, r -> r.roleType() == role && r.active()))
                .stream()
                .map(EntityRole::entityId)
                .collect(Collectors.toSet());
    }

    private static void validateForCreate(EntityInput input) {
        if (input.name() == null || input.name().isBlank()) {
            throw ValidationException.forField("Invalid entity", "name", "is required");
        }
        if (input.country() == null || input.country().isBlank()) {
            throw ValidationException.forField("Invalid entity", "country", "is required");
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
