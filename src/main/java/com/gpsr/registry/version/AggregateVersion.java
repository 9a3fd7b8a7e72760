package com.gpsr.registry.version;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable, source-attributed version of an aggregate.
 *
 * @param parentId       id of the aggregate this version belongs to
 * @param versionNumber  1-based, strictly increasing per parent
 * @param originalData   raw input snapshot as submitted
 * @param normalizedData derived snapshot after normalization
 */
public record AggregateVersion(
        String id,
        String parentId,
        String sourceId,
        int versionNumber,
        JsonNode originalData,
        JsonNode normalizedData,
        Instant capturedAt,
        String changeNote
) {
    public AggregateVersion {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(parentId, "parentId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(capturedAt, "capturedAt is required");
        if (versionNumber < 1) {
            throw new IllegalArgumentException("versionNumber must be >= 1");
        }
    }

    public static AggregateVersion create(String parentId, String sourceId, int versionNumber,
                                          JsonNode originalData, JsonNode normalizedData,
                                          Instant capturedAt, String changeNote) {
        return new AggregateVersion(UUID.randomUUID().toString(), parentId, sourceId, versionNumber,
                originalData, normalizedData, capturedAt, changeNote);
    }
}
