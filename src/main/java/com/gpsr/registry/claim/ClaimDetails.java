package com.gpsr.registry.claim;

import java.util.List;

/**
 * A claim with its evidence.
 */
public record ClaimDetails(Claim claim, List<Evidence> evidence) {

    public ClaimDetails {
        evidence = List.copyOf(evidence);
    }
}
