package com.gpsr.registry.version;

/**
 * Verification state attached to a specific version of an entity.
 */
public enum VerificationStatus {
    UNVERIFIED,
    COMMUNITY_CONFIRMED,
    PRIMARY_CONFIRMED,
    HISTORICAL,
    DISPUTED,
    OUTDATED
}
