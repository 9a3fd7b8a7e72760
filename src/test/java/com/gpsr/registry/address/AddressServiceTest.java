package com.gpsr.registry.address;

import com.gpsr.registry.TestRegistry;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.source.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddressService")
class AddressServiceTest {

    private TestRegistry fixture;
    private AddressService addresses;
    private String entityId;

    @BeforeEach
    void setUp() {
        fixture = new TestRegistry();
        addresses = fixture.registry.addresses();
        entityId = fixture.entity("Acme Polska", "PL").getId();
    }

    @Test
    @DisplayName("Should create a registered address with a normalized search line")
    void create() {
        Address address = addresses.create(entityId, AddressInput.of(" ul. Prosta 1 ", "Warszawa", "00-850", "pl"));

        assertEquals(AddressType.REGISTERED, address.addressType());
        assertEquals("ul. Prosta 1", address.streetLine1());
        assertEquals("PL", address.countryCode());
        assertEquals("ul. prosta 1 00-850 warszawa pl", address.normalizedFull());
        assertEquals(address, addresses.getById(address.id()));
    }

    @Test
    @DisplayName("Should reject missing parts and unknown references")
    void validation() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> addresses.create(entityId, AddressInput.of("ul. Prosta 1", " ", null, "PL")));
        assertTrue(e.getFieldErrors().containsKey("city"));
        assertThrows(ValidationException.class,
                () -> addresses.create(entityId, AddressInput.of("ul. Prosta 1", "Warszawa", null, null)));
        assertThrows(NotFoundException.class,
                () -> addresses.create("missing", AddressInput.of("ul. Prosta 1", "Warszawa", null, "PL")));
        assertThrows(NotFoundException.class, () -> addresses.create(entityId, new AddressInput(null,
                "ul. Prosta 1", null, "Warszawa", null, null, "PL", "missing")));
    }

    @Test
    @DisplayName("Should keep fields the update leaves null and refresh the search line")
    void update() {
        Address address = addresses.create(entityId, AddressInput.of("ul. Prosta 1", "Warszawa", "00-850", "PL"));
        String sourceId = fixture.source(SourceType.OFFICIAL_REGISTRY, "krs-0000123456").getId();

        Address updated = addresses.update(address.id(), new AddressInput(AddressType.OPERATING, "ul. Krzywa 5",
                null, null, null, "Mazowieckie", null, sourceId));

        assertEquals(AddressType.OPERATING, updated.addressType());
        assertEquals("Warszawa", updated.city());
        assertEquals("00-850", updated.postalCode());
        assertEquals(sourceId, updated.sourceId());
        assertEquals("ul. krzywa 5 00-850 warszawa mazowieckie pl", updated.normalizedFull());
        assertEquals(address.createdAt(), updated.createdAt());
        assertThrows(NotFoundException.class, () -> addresses.update("missing", AddressInput.of(null, null, null, null)));
    }

    @Test
    @DisplayName("Should list by type and search across entities")
    void listAndSearch() {
        String otherId = fixture.entity("Beta GmbH", "DE").getId();
        addresses.create(entityId, new AddressInput(AddressType.RETURN, "ul. Zwrotna 3", null, "Poznań", null,
                null, "PL", null));
        addresses.create(entityId, AddressInput.of("ul. Prosta 1", "Warszawa", null, "PL"));
        addresses.create(otherId, AddressInput.of("Hauptstraße 1", "Berlin", null, "DE"));

        assertEquals(List.of(AddressType.REGISTERED, AddressType.RETURN),
                addresses.getForEntity(entityId, null).stream().map(Address::addressType).toList());
        assertEquals(1, addresses.getForEntity(entityId, AddressType.RETURN).size());

        assertEquals(2, addresses.search("UL.", null).size());
        assertEquals(List.of("Hauptstraße 1"), addresses.search("1", "de").stream()
                .map(Address::streetLine1).toList());
        assertEquals(1, addresses.search("ul.", "PL", 1).size());
        assertTrue(addresses.search(" ", null).isEmpty());
    }

    @Test
    @DisplayName("Should remove an address")
    void remove() {
        Address address = addresses.create(entityId, AddressInput.of("ul. Prosta 1", "Warszawa", null, "PL"));

        addresses.remove(address.id());

        assertTrue(addresses.getForEntity(entityId, null).isEmpty());
        assertThrows(NotFoundException.class, () -> addresses.getById(address.id()));
    }
}
