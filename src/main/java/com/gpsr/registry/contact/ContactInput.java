package com.gpsr.registry.contact;

import java.util.Objects;

/**
 * A contact point to register.
 *
 * @param forSafetyIssues        channel accepts product safety reports
 * @param forConsumerComplaints  channel accepts consumer complaints
 * @param publicContact          null counts as public
 */
public record ContactInput(
        ContactType contactType,
        String value,
        String label,
        String languageCode,
        Boolean forSafetyIssues,
        Boolean forConsumerComplaints,
        Boolean publicContact
) {
    public ContactInput {
        Objects.requireNonNull(contactType, "contactType is required");
        Objects.requireNonNull(value, "value is required");
    }

    public static ContactInput of(ContactType contactType, String value) {
        return new ContactInput(contactType, value, null, null, null, null, null);
    }

    public static ContactInput safety(ContactType contactType, String value) {
        return new ContactInput(contactType, value, null, null, true, null, true);
    }
}
