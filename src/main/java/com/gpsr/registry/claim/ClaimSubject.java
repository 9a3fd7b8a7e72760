package com.gpsr.registry.claim;

/**
 * Kind of row a claim is about. Together with the subject id this forms a tagged
 * reference that is checked for existence when the claim is written.
 */
public enum ClaimSubject {
    ENTITY,
    BRAND,
    PRODUCT,
    RESPONSIBILITY,
    CONTACT,
    ADDRESS
}
