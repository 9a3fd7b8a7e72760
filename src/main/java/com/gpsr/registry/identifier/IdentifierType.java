package com.gpsr.registry.identifier;

/**
 * Kinds of official identifiers an entity can hold.
 */
public enum IdentifierType {
    VAT_EU,
    EORI,
    LEI,
    DUNS,
    KRS,
    NIP,
    REGON,
    GLN,
    COMPANY_REGISTER
}
