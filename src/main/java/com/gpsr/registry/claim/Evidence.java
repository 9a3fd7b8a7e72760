package com.gpsr.registry.claim;

import java.time.Instant;
import java.util.Objects;

/**
 * Supporting material attached to a claim.
 *
 * @param contentHash SHA-256 hex digest of {@code content}, when content is present
 */
public record Evidence(
        String id,
        String claimId,
        EvidenceType type,
        String url,
        String content,
        String contentHash,
        Instant createdAt
) {
    public Evidence {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(claimId, "claimId is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }
}
