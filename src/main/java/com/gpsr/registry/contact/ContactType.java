package com.gpsr.registry.contact;

public enum ContactType {
    EMAIL,
    PHONE,
    CONTACT_FORM,
    WEBSITE_SECTION,
    CHAT,
    OTHER
}
