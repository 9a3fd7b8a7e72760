package com.gpsr.registry.version;

import java.time.Instant;
import java.util.Objects;

/**
 * A verification statement about one entity version. Several records may exist
 * for the same version; the newest one is the effective status.
 */
public record VerificationRecord(
        String id,
        String versionId,
        VerificationStatus status,
        String verifiedBy,
        String verificationMethod,
        String notes,
        String evidenceUrl,
        Instant verifiedAt,
        Instant expiresAt
) {
    public VerificationRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(versionId, "versionId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(verifiedAt, "verifiedAt is required");
    }
}
