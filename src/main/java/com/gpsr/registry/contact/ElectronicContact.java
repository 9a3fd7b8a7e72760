package com.gpsr.registry.contact;

import java.time.Instant;
import java.util.Objects;

/**
 * An electronic contact point of an entity or a brand. Direct communication is
 * considered confirmed once someone has reached the owner through it.
 */
public record ElectronicContact(
        String id,
        ContactOwnerType ownerType,
        String ownerId,
        ContactType contactType,
        String value,
        String label,
        String languageCode,
        boolean forSafetyIssues,
        boolean forConsumerComplaints,
        boolean publicContact,
        boolean directCommunicationConfirmed,
        String confirmationMethod,
        String confirmedBy,
        Instant confirmedAt,
        boolean active,
        Instant createdAt
) {
    public ElectronicContact {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(ownerType, "ownerType is required");
        Objects.requireNonNull(ownerId, "ownerId is required");
        Objects.requireNonNull(contactType, "contactType is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public ElectronicContact confirmed(String method, String by, Instant at) {
        return new ElectronicContact(id, ownerType, ownerId, contactType, value, label, languageCode,
                forSafetyIssues, forConsumerComplaints, publicContact, true, method, by, at, active, createdAt);
    }

    public ElectronicContact deactivated() {
        return new ElectronicContact(id, ownerType, ownerId, contactType, value, label, languageCode,
                forSafetyIssues, forConsumerComplaints, publicContact, directCommunicationConfirmed,
                confirmationMethod, confirmedBy, confirmedAt, false, createdAt);
    }
}
