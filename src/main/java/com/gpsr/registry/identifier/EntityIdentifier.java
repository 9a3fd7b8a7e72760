package com.gpsr.registry.identifier;

import java.time.Instant;
import java.util.Objects;

/**
 * An official identifier held by an entity. {@code (type, value)} is unique across
 * the registry, so the same identifier can never be attached to two entities.
 *
 * @param value   normalized: trimmed and upper case
 * @param primary at most one primary identifier per entity and type
 */
public record EntityIdentifier(
        String id,
        String entityId,
        IdentifierType type,
        String value,
        String countryCode,
        String sourceId,
        boolean primary,
        Instant createdAt,
        Instant updatedAt
) {
    public EntityIdentifier {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
    }

    /**
     * Display form used in duplicate reports, e.g. {@code VAT_EU:PL1234567890}.
     */
    public String label() {
        return type + ":" + value;
    }

    public EntityIdentifier withPrimary(boolean newPrimary, Instant now) {
        return new EntityIdentifier(id, entityId, type, value, countryCode, sourceId, newPrimary, createdAt, now);
    }
}
