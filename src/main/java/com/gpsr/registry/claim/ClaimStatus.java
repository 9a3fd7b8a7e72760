package com.gpsr.registry.claim;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a claim.
 *
 * <pre>
 * PROPOSED -> ACCEPTED | REJECTED | DISPUTED | SUPERSEDED
 * DISPUTED -> ACCEPTED | REJECTED | SUPERSEDED
 * </pre>
 * ACCEPTED, REJECTED and SUPERSEDED are terminal.
 */
public enum ClaimStatus {
    PROPOSED,
    ACCEPTED,
    REJECTED,
    DISPUTED,
    SUPERSEDED;

    public boolean canTransitionTo(ClaimStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /**
     * Open claims still await a reviewer decision.
     */
    public boolean isOpen() {
        return this == PROPOSED || this == DISPUTED;
    }

    private Set<ClaimStatus> allowedTargets() {
        return switch (this) {
            case PROPOSED -> EnumSet.of(ACCEPTED, REJECTED, DISPUTED, SUPERSEDED);
            case DISPUTED -> EnumSet.of(ACCEPTED, REJECTED, SUPERSEDED);
            case ACCEPTED, REJECTED, SUPERSEDED -> EnumSet.noneOf(ClaimStatus.class);
        };
    }
}
