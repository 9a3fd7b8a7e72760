package com.gpsr.registry.claim;

import java.util.List;
import java.util.Optional;

/**
 * Best known value of one attribute of a subject, derived from accepted claims.
 * Conflicting accepted values are reported, never merged.
 *
 * @param winner          highest ranked accepted claim, empty when none is accepted
 * @param acceptedClaims  every accepted claim, best first
 * @param hasConflicts    true when accepted claims disagree on the value
 * @param openClaimCount  claims still PROPOSED or DISPUTED for this attribute
 */
public record AttributeResolution(
        ClaimSubject subject,
        String subjectId,
        String attribute,
        Optional<Claim> winner,
        List<Claim> acceptedClaims,
        boolean hasConflicts,
        int openClaimCount
) {
    public AttributeResolution {
        acceptedClaims = List.copyOf(acceptedClaims);
    }

    public Optional<String> value() {
        return winner.map(Claim::getValue);
    }
}
