package com.gpsr.registry.identifier;

import java.util.List;

/**
 * Another entity that holds identifiers resembling those of the entity under review.
 *
 * @param matchedIdentifiers labels of the candidate's matching identifiers, e.g. {@code VAT_EU:DE1234567890}
 */
public record DuplicateCandidate(String entityId, String entityName, String country, List<String> matchedIdentifiers) {

    public DuplicateCandidate {
        matchedIdentifiers = List.copyOf(matchedIdentifiers);
    }
}
