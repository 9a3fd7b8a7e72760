package com.gpsr.registry.identifier;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.IDENTIFIERS;
import static com.gpsr.registry.schema.RegistrySchema.SOURCES;

/**
 * Global index of entity identifiers, used for lookup and duplicate detection.
 *
 * <p>{@code (type, value)} is unique across all entities. Adding an identifier that
 * another entity already holds is reported as a validation error naming that entity;
 * it is the duplicate signal and is never merged silently.</p>
 */
public class IdentifierService {
    private static final Logger log = LoggerFactory.getLogger(IdentifierService.class);

    public static final String RESOURCE = "EntityIdentifier";

    private final RegistryContext ctx;

    public IdentifierService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Attaches an identifier to an entity, or refreshes it when the entity already
     * holds it. Setting an identifier primary demotes the entity's other primary
     * identifier of the same type in the same transaction.
     *
     * @throws NotFoundException   if the entity or source does not exist
     * @throws ValidationException if another entity holds the identifier
     */
    public EntityIdentifier addIdentifier(String entityId, AddIdentifier request) {
        String value = ctx.normalizer().identifierValue(request.value());
        if (value.isEmpty()) {
            throw ValidationException.forField("Invalid identifier", "value", "must not be blank");
        }
        String country = ctx.normalizer().country(request.countryCode());
        EntityIdentifier result = ctx.runner().execute("identifier.add", tx -> {
            if (!tx.exists(ENTITIES, entityId)) {
                throw new NotFoundException("Entity", entityId);
            }
            if (!tx.exists(SOURCES, request.sourceId())) {
                throw new NotFoundException("Source", request.sourceId());
            }
            Instant now = ctx.now();
            Optional<EntityIdentifier> existing = findByTypeAndValue(tx, request.type(), value);
            if (existing.isPresent() && !existing.get().entityId().equals(entityId)) {
                throw duplicateOf(tx, existing.get());
            }
            if (existing.isPresent()) {
                EntityIdentifier current = existing.get();
                boolean primary = request.primary() != null ? request.primary() : current.primary();
                if (primary) {
                    demoteOtherPrimaries(tx, entityId, request.type(), current.id(), now);
                }
                EntityIdentifier updated = new EntityIdentifier(current.id(), entityId, current.type(), value,
                        country != null ? country : current.countryCode(), request.sourceId(), primary,
                        current.createdAt(), now);
                tx.update(IDENTIFIERS, updated);
                ctx.audit().record(tx, AuditAction.IDENTIFIER_UPDATED, RESOURCE, updated.id(), current, updated);
                return updated;
            }
            boolean primary = Boolean.TRUE.equals(request.primary());
            if (primary) {
                demoteOtherPrimaries(tx, entityId, request.type(), null, now);
            }
            EntityIdentifier created = new EntityIdentifier(UUID.randomUUID().toString(), entityId, request.type(),
                    value, country, request.sourceId(), primary, now, now);
            tx.insert(IDENTIFIERS, created);
            ctx.audit().record(tx, AuditAction.IDENTIFIER_ADDED, RESOURCE, created.id(), null, created);
            return created;
        });
        log.info("identifier.added entityId={} identifier={} primary={}", entityId, result.label(), result.primary());
        return result;
    }

    /**
     * Finds the entity holding an identifier.
     */
    public Optional<Entity> findByIdentifier(IdentifierType type, String value) {
        String normalized = ctx.normalizer().identifierValue(value);
        return ctx.runner().read(tx -> findByTypeAndValue(tx, type, normalized)
                .flatMap(identifier -> tx.get(ENTITIES, identifier.entityId())));
    }

    /**
     * Identifiers of an entity, primary ones first, then by type.
     */
    public List<EntityIdentifier> getForEntity(String entityId) {
        return ctx.runner().read(tx -> tx.find(IDENTIFIERS, i -> i.entityId().equals(entityId)))
                .stream()
                .sorted(Comparator.comparing(EntityIdentifier::primary).reversed()
                        .thenComparing(EntityIdentifier::type))
                .toList();
    }

    /**
     * Identifiers whose value contains the pattern, by value.
     *
     * @param type null for every type
     */
    public List<EntityIdentifier> search(String pattern, IdentifierType type, int limit) {
        String fragment = ctx.normalizer().identifierValue(pattern);
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        return ctx.runner().read(tx -> tx.find(IDENTIFIERS, i -> (type == null || i.type() == type)
                        && i.value().contains(fragment)))
                .stream()
                .sorted(Comparator.comparing(EntityIdentifier::value))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Physically removes an identifier. The audit entry keeps the removed row.
     */
    public EntityIdentifier removeIdentifier(String identifierId) {
        EntityIdentifier removed = ctx.runner().execute("identifier.remove", tx -> {
            EntityIdentifier deleted = tx.delete(IDENTIFIERS, identifierId);
            ctx.audit().record(tx, AuditAction.IDENTIFIER_REMOVED, RESOURCE, identifierId, deleted, null);
            return deleted;
        });
        log.info("identifier.removed entityId={} identifier={}", removed.entityId(), removed.label());
        return removed;
    }

    /**
     * Other entities holding an identifier of the same type whose value contains the
     * last N characters of one of this entity's identifiers, N being the configured
     * suffix length. This tolerates differing country prefixes and is approximate.
     */
    public List<DuplicateCandidate> findDuplicateCandidates(String entityId) {
        int suffixLength = ctx.config().duplicateSuffixLength();
        List<DuplicateCandidate> candidates = ctx.runner().read(tx -> {
            if (!tx.exists(ENTITIES, entityId)) {
                throw new NotFoundException("Entity", entityId);
            }
            Map<String, List<String>> matches = new LinkedHashMap<>();
            for (EntityIdentifier own : tx.find(IDENTIFIERS, i -> i.entityId().equals(entityId))) {
                String suffix = suffixOf(own.value(), suffixLength);
                for (EntityIdentifier other : tx.find(IDENTIFIERS, i -> i.type() == own.type()
                        && !i.entityId().equals(entityId)
                        && i.value().contains(suffix))) {
                    matches.computeIfAbsent(other.entityId(), k -> new ArrayList<>()).add(other.label());
                }
            }
            List<DuplicateCandidate> result = new ArrayList<>(matches.size());
            matches.forEach((candidateId, labels) -> {
                Optional<Entity> candidate = tx.get(ENTITIES, candidateId);
                result.add(new DuplicateCandidate(candidateId,
                        candidate.map(Entity::getNormalizedName).orElse(null),
                        candidate.map(Entity::getCountry).orElse(null),
                        labels.stream().distinct().toList()));
            });
            return result;
        });
        ctx.metrics().recordDuplicateCandidates(candidates.size());
        log.debug("identifier.duplicates entityId={} candidates={}", entityId, candidates.size());
        return candidates;
    }

    static String suffixOf(String value, int length) {
        return value.length() <= length ? value : value.substring(value.length() - length);
    }

    private static Optional<EntityIdentifier> findByTypeAndValue(Transaction tx, IdentifierType type, String value) {
        return tx.findFirst(IDENTIFIERS, i -> i.type() == type && i.value().equals(value));
    }

    private void demoteOtherPrimaries(Transaction tx, String entityId, IdentifierType type, String keepId,
                                      Instant now) {
        for (EntityIdentifier other : tx.find(IDENTIFIERS, i -> i.entityId().equals(entityId)
                && i.type() == type && i.primary() && !i.id().equals(keepId))) {
            tx.update(IDENTIFIERS, other.withPrimary(false, now));
        }
    }

    private static ValidationException duplicateOf(Transaction tx, EntityIdentifier held) {
        String holderName = tx.get(ENTITIES, held.entityId()).map(Entity::getNormalizedName).orElse("unknown");
        String message = "Identifier " + held.label() + " already assigned to entity \"" + holderName
                + "\" (" + held.entityId() + ")";
        return new ValidationException(message, Map.of("value", List.of(message)));
    }
}
