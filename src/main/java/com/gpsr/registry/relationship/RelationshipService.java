package com.gpsr.registry.relationship;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.RELATIONSHIPS;
import static com.gpsr.registry.schema.RegistrySchema.SOURCES;

/**
 * Corporate structure between entities. Edges are ended, never deleted.
 */
public class RelationshipService {
    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    public static final String RESOURCE = "EntityRelationship";
    public static final int DEFAULT_MAX_DEPTH = 10;

    private final RegistryContext ctx;

    public RelationshipService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Links two existing, distinct entities.
     *
     * @throws NotFoundException   if either entity or the given source does not exist
     * @throws ValidationException on a self-reference or an out-of-range confidence
     */
    public EntityRelationship create(CreateRelationship request) {
        int confidence = ctx.confidenceOrDefault(request.confidence());
        EntityRelationship created = ctx.runner().execute("relationship.create", tx -> {
            if (!tx.exists(ENTITIES, request.fromEntityId())) {
                throw new NotFoundException("From entity", request.fromEntityId());
            }
            if (!tx.exists(ENTITIES, request.toEntityId())) {
                throw new NotFoundException("To entity", request.toEntityId());
            }
            if (request.fromEntityId().equals(request.toEntityId())) {
                throw new ValidationException("Cannot create relationship to self");
            }
            if (request.sourceId() != null && !tx.exists(SOURCES, request.sourceId())) {
                throw new NotFoundException("Source", request.sourceId());
            }
            Instant now = ctx.now();
            EntityRelationship relationship = new EntityRelationship(UUID.randomUUID().toString(),
                    request.fromEntityId(), request.toEntityId(), request.relationType(),
                    request.validFrom() != null ? request.validFrom() : now, request.validTo(),
                    request.sourceId(), confidence, request.notes(), true, now);
            tx.insert(RELATIONSHIPS, relationship);
            ctx.audit().record(tx, AuditAction.RELATIONSHIP_CREATED, RESOURCE, relationship.id(), null,
                    relationship);
            return relationship;
        });
        log.info("relationship.created id={} from={} type={} to={}", created.id(), created.fromEntityId(),
                created.relationType(), created.toEntityId());
        return created;
    }

    /**
     * Active outgoing edges of an entity, by relation type.
     *
     * @param relationType null for every type
     */
    public List<EntityRelationship> getRelationsFrom(String entityId, RelationType relationType) {
        return active(r -> r.fromEntityId().equals(entityId), relationType);
    }

    /**
     * Active incoming edges of an entity, by relation type.
     *
     * @param relationType null for every type
     */
    public List<EntityRelationship> getRelationsTo(String entityId, RelationType relationType) {
        return active(r -> r.toEntityId().equals(entityId), relationType);
    }

    /**
     * Every active neighbour of an entity grouped by relation type, outgoing edges first.
     */
    public Map<RelationType, List<RelatedEntity>> getCorporateGraph(String entityId) {
        return ctx.runner().read(tx -> {
            Map<RelationType, List<RelatedEntity>> graph = new EnumMap<>(RelationType.class);
            for (EntityRelationship r : getRelationsFrom(entityId, null)) {
                graph.computeIfAbsent(r.relationType(), k -> new ArrayList<>()).add(new RelatedEntity(
                        r.toEntityId(), nameOf(tx, r.toEntityId()), RelatedEntity.Direction.OUTGOING,
                        r.confidence(), 1));
            }
            for (EntityRelationship r : getRelationsTo(entityId, null)) {
                graph.computeIfAbsent(r.relationType(), k -> new ArrayList<>()).add(new RelatedEntity(
                        r.fromEntityId(), nameOf(tx, r.fromEntityId()), RelatedEntity.Direction.INCOMING,
                        r.confidence(), 1));
            }
            return graph;
        });
    }

    /**
     * Ends a relationship: sets its end date and marks it inactive.
     *
     * @param endDate null for now
     */
    public EntityRelationship end(String relationshipId, Instant endDate) {
        EntityRelationship ended = ctx.runner().execute("relationship.end", tx -> {
            EntityRelationship current = tx.get(RELATIONSHIPS, relationshipId)
                    .orElseThrow(() -> new NotFoundException("Relationship", relationshipId));
            EntityRelationship updated = current.ended(endDate != null ? endDate : ctx.now());
            tx.update(RELATIONSHIPS, updated);
            ctx.audit().record(tx, AuditAction.RELATIONSHIP_ENDED, RESOURCE, relationshipId, current, updated);
            return updated;
        });
        log.info("relationship.ended id={} validTo={}", relationshipId, ended.validTo());
        return ended;
    }

    public List<RelatedEntity> getParentChain(String entityId) {
        return getParentChain(entityId, DEFAULT_MAX_DEPTH);
    }

    /**
     * Walks active {@code SUBSIDIARY_OF} edges upwards. Stops at {@code maxDepth}
     * levels or when an entity repeats.
     */
    public List<RelatedEntity> getParentChain(String entityId, int maxDepth) {
        return ctx.runner().read(tx -> {
            List<RelatedEntity> chain = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            visited.add(entityId);
            String currentId = entityId;
            for (int level = 1; level <= maxDepth; level++) {
                String childId = currentId;
                Optional<EntityRelationship> parent = tx.findFirst(RELATIONSHIPS, r -> r.active()
                        && r.relationType() == RelationType.SUBSIDIARY_OF
                        && r.fromEntityId().equals(childId));
                if (parent.isEmpty() || !visited.add(parent.get().toEntityId())) {
                    break;
                }
                EntityRelationship edge = parent.get();
                chain.add(new RelatedEntity(edge.toEntityId(), nameOf(tx, edge.toEntityId()),
                        RelatedEntity.Direction.OUTGOING, edge.confidence(), level));
                currentId = edge.toEntityId();
            }
            return chain;
        });
    }

    private List<EntityRelationship> active(Predicate<EntityRelationship> side, RelationType relationType) {
        return ctx.runner().read(tx -> tx.find(RELATIONSHIPS, r -> r.active()
                        && (relationType == null || r.relationType() == relationType)
                        && side.test(r)))
                .stream()
                .sorted(Comparator.comparing(EntityRelationship::relationType))
                .toList();
    }

    private static String nameOf(Transaction tx, String entityId) {
        return tx.get(ENTITIES, entityId).map(Entity::getNormalizedName).orElse(null);
    }
}
