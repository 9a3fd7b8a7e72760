package com.gpsr.registry.claim;

import java.util.Objects;

/**
 * Evidence as submitted with a claim.
 */
public record EvidenceInput(EvidenceType type, String url, String content, String contentHash) {

    public EvidenceInput {
        Objects.requireNonNull(type, "type is required");
    }

    public static EvidenceInput url(EvidenceType type, String url) {
        return new EvidenceInput(type, url, null, null);
    }

    public static EvidenceInput text(String content) {
        return new EvidenceInput(EvidenceType.TEXT_SNAPSHOT, null, content, null);
    }
}
