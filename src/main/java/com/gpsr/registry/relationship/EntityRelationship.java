package com.gpsr.registry.relationship;

import java.time.Instant;
import java.util.Objects;

public record EntityRelationship(
        String id,
        String fromEntityId,
        String toEntityId,
        RelationType relationType,
        Instant validFrom,
        Instant validTo,
        String sourceId,
        int confidence,
        String notes,
        boolean active,
        Instant createdAt
) {
    public EntityRelationship {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(fromEntityId, "fromEntityId is required");
        Objects.requireNonNull(toEntityId, "toEntityId is required");
        Objects.requireNonNull(relationType, "relationType is required");
        Objects.requireNonNull(validFrom, "validFrom is required");
    }

    public EntityRelationship ended(Instant endDate) {
        return new EntityRelationship(id, fromEntityId, toEntityId, relationType, validFrom, endDate, sourceId,
                confidence, notes, false, createdAt);
    }
}
