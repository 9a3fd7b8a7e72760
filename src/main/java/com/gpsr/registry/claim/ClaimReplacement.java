package com.gpsr.registry.claim;

import java.util.List;
import java.util.Objects;

/**
 * The new value that supersedes an open claim. Subject and attribute are taken
 * from the claim being replaced.
 */
public record ClaimReplacement(String value, String sourceId, Integer confidence, List<EvidenceInput> evidence) {

    public ClaimReplacement {
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static ClaimReplacement of(String value, String sourceId, int confidence) {
        return new ClaimReplacement(value, sourceId, confidence, List.of());
    }
}
