package com.gpsr.registry.audit;

/**
 * Types of auditable actions in the registry.
 */
public enum AuditAction {
    CREATE,
    UPDATE,
    DEACTIVATE,
    ADD_ROLE,
    LINK_BRAND,
    SOURCE_CREATED,
    SOURCE_UPDATED,
    VERIFICATION_ADDED,
    CLAIM_SUBMITTED,
    CLAIM_ACCEPTED,
    CLAIM_REJECTED,
    CLAIM_DISPUTED,
    CLAIM_SUPERSEDED,
    EVIDENCE_ADDED,
    RESPONSIBILITY_ASSIGNED,
    RESPONSIBILITY_DEMOTED,
    RESPONSIBILITY_DISPUTED,
    IDENTIFIER_ADDED,
    IDENTIFIER_UPDATED,
    IDENTIFIER_REMOVED,
    RELATIONSHIP_CREATED,
    RELATIONSHIP_ENDED,
    CONTACT_CREATED,
    CONTACT_CONFIRMED,
    CONTACT_DEACTIVATED,
    CONTACT_REMOVED,
    ADDRESS_CREATED,
    ADDRESS_UPDATED,
    ADDRESS_REMOVED
}
