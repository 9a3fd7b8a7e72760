package com.gpsr.registry.claim;

import java.util.List;
import java.util.Objects;

/**
 * A new claim with its evidence.
 *
 * @param confidence null for the configured default
 */
public record ClaimSubmission(
        ClaimSubject subject,
        String subjectId,
        String attribute,
        String value,
        String sourceId,
        Integer confidence,
        List<EvidenceInput> evidence
) {
    public ClaimSubmission {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(attribute, "attribute is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static ClaimSubmission of(ClaimSubject subject, String subjectId, String attribute, String value,
                                     String sourceId, int confidence) {
        return new ClaimSubmission(subject, subjectId, attribute, value, sourceId, confidence, List.of());
    }

    public ClaimSubmission withEvidence(EvidenceInput... items) {
        return new ClaimSubmission(subject, subjectId, attribute, value, sourceId, confidence, List.of(items));
    }
}
