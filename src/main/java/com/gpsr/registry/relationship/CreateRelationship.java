package com.gpsr.registry.relationship;

import java.time.Instant;
import java.util.Objects;

/**
 * Request to link two entities.
 *
 * @param sourceId   optional provenance
 * @param confidence null for the configured default
 */
public record CreateRelationship(
        String fromEntityId,
        String toEntityId,
        RelationType relationType,
        Instant validFrom,
        Instant validTo,
        String sourceId,
        Integer confidence,
        String notes
) {
    public CreateRelationship {
        Objects.requireNonNull(fromEntityId, "fromEntityId is required");
        Objects.requireNonNull(toEntityId, "toEntityId is required");
        Objects.requireNonNull(relationType, "relationType is required");
    }

    public static CreateRelationship of(String fromEntityId, RelationType relationType, String toEntityId) {
        return new CreateRelationship(fromEntityId, toEntityId, relationType, null, null, null, null, null);
    }
}
