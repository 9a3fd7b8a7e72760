package com.gpsr.registry.contact;

import com.gpsr.registry.TestRegistry;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.brand.BrandLinkType;
import com.gpsr.registry.brand.BrandService;
import com.gpsr.registry.brand.CreateBrandLink;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContactService")
class ContactServiceTest {

    private TestRegistry fixture;
    private ContactService contacts;
    private String entityId;
    private String brandId;

    @BeforeEach
    void setUp() {
        fixture = new TestRegistry();
        contacts = fixture.registry.contacts();
        entityId = fixture.entity("Acme Polska", "PL").getId();
        brandId = fixture.brand("Acme Toys").getId();
    }

    @Nested
    @DisplayName("Value validation")
    class ValueValidation {

        @ParameterizedTest(name = "{0} ''{1}'' is accepted")
        @CsvSource({
                "EMAIL, safety@acme.example",
                "PHONE, +48 22 123 45 67",
                "CONTACT_FORM, https://acme.example/contact",
                "WEBSITE_SECTION, http://acme.example/safety",
                "CHAT, acme-support"
        })
        void accepts(ContactType type, String value) {
            assertDoesNotThrow(() -> ContactService.validateValue(type, value));
        }

        @ParameterizedTest(name = "{0} ''{1}'' is rejected")
        @CsvSource({
                "EMAIL, not-an-email",
                "EMAIL, two words@acme.example",
                "PHONE, 12345",
                "PHONE, 1234567890123456",
                "CONTACT_FORM, acme.example/contact",
                "CONTACT_FORM, ftp://acme.example",
                "WEBSITE_SECTION, https://"
        })
        void rejects(ContactType type, String value) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> ContactService.validateValue(type, value));
            assertTrue(e.getFieldErrors().containsKey("value"));
        }
    }

    @Test
    @DisplayName("Should add a trimmed public contact to an entity")
    void add() {
        ElectronicContact contact = contacts.add(ContactOwnerType.ENTITY, entityId,
                new ContactInput(ContactType.EMAIL, "  safety@acme.example ", "Safety desk", "PL", true, null, null));

        assertEquals("safety@acme.example", contact.value());
        assertEquals("pl", contact.languageCode());
        assertTrue(contact.forSafetyIssues());
        assertFalse(contact.forConsumerComplaints());
        assertTrue(contact.publicContact());
        assertTrue(contact.active());
        assertFalse(contact.directCommunicationConfirmed());
        assertEquals(contact, contacts.getById(contact.id()));
    }

    @Test
    @DisplayName("Should require an existing owner of the given kind")
    void ownerMustExist() {
        assertThrows(NotFoundException.class, () -> contacts.add(ContactOwnerType.BRAND, entityId,
                ContactInput.of(ContactType.EMAIL, "info@acme.example")));
        assertDoesNotThrow(() -> contacts.add(ContactOwnerType.BRAND, brandId,
                ContactInput.of(ContactType.EMAIL, "info@acme.example")));
        assertThrows(ValidationException.class, () -> contacts.add(ContactOwnerType.ENTITY, entityId,
                ContactInput.of(ContactType.EMAIL, "broken")));
    }

    @Test
    @DisplayName("Should filter an owner's contacts and return the newest first")
    void getForOwner() {
        ElectronicContact general = contacts.add(ContactOwnerType.ENTITY, entityId,
                ContactInput.of(ContactType.EMAIL, "info@acme.example"));
        fixture.tick();
        ElectronicContact safety = contacts.add(ContactOwnerType.ENTITY, entityId,
                ContactInput.safety(ContactType.PHONE, "+48 22 123 45 67"));
        fixture.tick();
        ElectronicContact internal = contacts.add(ContactOwnerType.ENTITY, entityId,
                new ContactInput(ContactType.EMAIL, "qa@acme.example", null, null, true, null, false));

        assertEquals(List.of(internal, safety, general), contacts.getForOwner(ContactOwnerType.ENTITY, entityId,
                false, false));
        assertEquals(List.of(internal, safety), contacts.getForOwner(ContactOwnerType.ENTITY, entityId,
                true, false));
        assertEquals(List.of(safety), contacts.getForOwner(ContactOwnerType.ENTITY, entityId, true, true));
        assertTrue(contacts.getForOwner(ContactOwnerType.BRAND, entityId, false, false).isEmpty());
    }

    @Test
    @DisplayName("Should confirm, deactivate and remove with an audit trail")
    void lifecycle() {
        ElectronicContact contact = contacts.add(ContactOwnerType.ENTITY, entityId,
                ContactInput.safety(ContactType.EMAIL, "safety@acme.example"));
        fixture.tick();

        ElectronicContact confirmed = contacts.confirm(contact.id(), "test email", "reviewer@gpsr.example");
        assertTrue(confirmed.directCommunicationConfirmed());
        assertEquals("test email", confirmed.confirmationMethod());
        assertEquals(fixture.clock.instant(), confirmed.confirmedAt());

        contacts.deactivate(contact.id());
        assertTrue(contacts.getForOwner(ContactOwnerType.ENTITY, entityId, false, false).isEmpty());
        assertFalse(contacts.getById(contact.id()).active());

        contacts.remove(contact.id());
        assertThrows(NotFoundException.class, () -> contacts.getById(contact.id()));
        assertThrows(NotFoundException.class, () -> contacts.confirm(contact.id(), null, null));

        List<AuditAction> actions = fixture.registry.audit().getRecent(10, null, ContactService.RESOURCE).stream()
                .map(e -> e.action())
                .toList();
        assertEquals(List.of(AuditAction.CONTACT_REMOVED, AuditAction.CONTACT_DEACTIVATED,
                AuditAction.CONTACT_CONFIRMED, AuditAction.CONTACT_CREATED), actions);
    }

    @Nested
    @DisplayName("Brand safety contacts")
    class BrandSafety {

        @Test
        @DisplayName("Should combine the brand's safety contacts with those of its responsible entities")
        void combinesLinkedEntities() {
            BrandService brands = fixture.registry.brands();
            Entity distributor = fixture.entity("Acme Retail", "DE");
            brands.addEntityLink(brandId, CreateBrandLink.of(entityId, BrandLinkType.MANUFACTURER));
            brands.addEntityLink(brandId, CreateBrandLink.of(distributor.getId(), BrandLinkType.DISTRIBUTOR));
            ElectronicContact brandSafety = contacts.add(ContactOwnerType.BRAND, brandId,
                    ContactInput.safety(ContactType.EMAIL, "safety@acme-toys.example"));
            contacts.add(ContactOwnerType.BRAND, brandId, ContactInput.of(ContactType.EMAIL, "sales@acme-toys.example"));
            contacts.add(ContactOwnerType.BRAND, brandId, new ContactInput(ContactType.EMAIL,
                    "internal@acme-toys.example", null, null, true, null, false));
            ElectronicContact makerSafety = contacts.add(ContactOwnerType.ENTITY, entityId,
                    ContactInput.safety(ContactType.PHONE, "+48 22 123 45 67"));
            contacts.add(ContactOwnerType.ENTITY, distributor.getId(),
                    ContactInput.safety(ContactType.EMAIL, "safety@acme-retail.example"));

            BrandSafetyContacts result = contacts.getSafetyContactsForBrand(brandId);

            assertEquals(List.of(brandSafety.id()), result.brandContacts().stream().map(ElectronicContact::id).toList());
            assertEquals(1, result.entityContacts().size());
            BrandSafetyContacts.EntityContacts maker = result.entityContacts().get(0);
            assertEquals(entityId, maker.entity().getId());
            assertEquals(BrandLinkType.MANUFACTURER, maker.linkType());
            assertEquals(List.of(makerSafety.id()), maker.contacts().stream().map(ElectronicContact::id).toList());
        }

        @Test
        @DisplayName("Should skip deactivated contacts and fail for an unknown brand")
        void inactiveAndMissing() {
            ElectronicContact contact = contacts.add(ContactOwnerType.BRAND, brandId,
                    ContactInput.safety(ContactType.EMAIL, "safety@acme-toys.example"));
            contacts.deactivate(contact.id());

            assertTrue(contacts.getSafetyContactsForBrand(brandId).isEmpty());
            assertThrows(NotFoundException.class, () -> contacts.getSafetyContactsForBrand("missing"));
        }
    }
}
