package com.gpsr.registry.relationship;

/**
 * Corporate structure edges, read as {@code from RELATION to}.
 */
public enum RelationType {
    PARENT_OF,
    SUBSIDIARY_OF,
    ACQUIRED_BY,
    MERGED_INTO,
    SUCCEEDED_BY,
    AUTHORIZED_REP_FOR,
    DISTRIBUTION_PARTNER
}
