package com.gpsr.registry.address;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.gpsr.registry.schema.RegistrySchema.ADDRESSES;
import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.SOURCES;

/**
 * Typed postal addresses of entities.
 */
public class AddressService {
    private static final Logger log = LoggerFactory.getLogger(AddressService.class);

    public static final String RESOURCE = "Address";
    public static final int DEFAULT_SEARCH_LIMIT = 20;

    private final RegistryContext ctx;

    public AddressService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Adds an address to an existing entity.
     *
     * @throws NotFoundException   if the entity or the given source does not exist
     * @throws ValidationException if street, city or country is missing
     */
    public Address create(String entityId, AddressInput input) {
        Address created = ctx.runner().execute("address.create", tx -> {
            if (!tx.exists(ENTITIES, entityId)) {
                throw new NotFoundException("Entity", entityId);
            }
            requireSource(tx, input.sourceId());
            Instant now = ctx.now();
            Address address = build(UUID.randomUUID().toString(), entityId,
                    input.addressType() != null ? input.addressType() : AddressType.REGISTERED,
                    input.streetLine1(), input.streetLine2(), input.city(), input.postalCode(), input.region(),
                    input.countryCode(), input.sourceId(), now, now);
            tx.insert(ADDRESSES, address);
            ctx.audit().record(tx, AuditAction.ADDRESS_CREATED, RESOURCE, address.id(), null, address);
            return address;
        });
        log.info("address.created id={} entityId={} type={}", created.id(), entityId, created.addressType());
        return created;
    }

    /**
     * Replaces the given fields and recomputes the search line.
     */
    public Address update(String addressId, AddressInput input) {
        Address updated = ctx.runner().execute("address.update", tx -> {
            Address current = tx.get(ADDRESSES, addressId)
                    .orElseThrow(() -> new NotFoundException(RESOURCE, addressId));
            requireSource(tx, input.sourceId());
            Address next = build(current.id(), current.entityId(),
                    input.addressType() != null ? input.addressType() : current.addressType(),
                    orElse(input.streetLine1(), current.streetLine1()),
                    orElse(input.streetLine2(), current.streetLine2()),
                    orElse(input.city(), current.city()),
                    orElse(input.postalCode(), current.postalCode()),
                    orElse(input.region(), current.region()),
                    orElse(input.countryCode(), current.countryCode()),
                    orElse(input.sourceId(), current.sourceId()),
                    current.createdAt(), ctx.now());
            tx.update(ADDRESSES, next);
            ctx.audit().record(tx, AuditAction.ADDRESS_UPDATED, RESOURCE, addressId, current, next);
            return next;
        });
        log.info("address.updated id={}", addressId);
        return updated;
    }

    /**
     * Physically removes an address. The audit entry keeps the removed row.
     */
    public Address remove(String addressId) {
        Address removed = ctx.runner().execute("address.remove", tx -> {
            Address deleted = tx.delete(ADDRESSES, addressId);
            ctx.audit().record(tx, AuditAction.ADDRESS_REMOVED, RESOURCE, addressId, deleted, null);
            return deleted;
        });
        log.info("address.removed id={} entityId={}", addressId, removed.entityId());
        return removed;
    }

    public Address getById(String addressId) {
        return ctx.runner().read(tx -> tx.get(ADDRESSES, addressId))
                .orElseThrow(() -> new NotFoundException(RESOURCE, addressId));
    }

    /**
     * Addresses of an entity ordered by type.
     *
     * @param type null for every type
     */
    public List<Address> getForEntity(String entityId, AddressType type) {
        return ctx.runner().read(tx -> tx.find(ADDRESSES, a -> a.entityId().equals(entityId)
                        && (type == null || a.addressType() == type)))
                .stream()
                .sorted(Comparator.comparing(Address::addressType))
                .toList();
    }

    public List<Address> search(String query, String countryCode) {
        return search(query, countryCode, DEFAULT_SEARCH_LIMIT);
    }

    /**
     * Addresses whose search line contains the query, ordered by that line.
     *
     * @param countryCode null for every country
     */
    public List<Address> search(String query, String countryCode, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String fragment = query.trim().toLowerCase(Locale.ROOT);
        String country = ctx.normalizer().country(countryCode);
        return ctx.runner().read(tx -> tx.find(ADDRESSES, a -> a.normalizedFull().contains(fragment)
                        && (country == null || a.countryCode().equals(country))))
                .stream()
                .sorted(Comparator.comparing(Address::normalizedFull))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Single lower-case line of the non-blank parts: street lines, postal code, city,
     * region and country.
     */
    static String normalizedFull(String streetLine1, String streetLine2, String postalCode, String city,
                                 String region, String countryCode) {
        return Stream.of(streetLine1, streetLine2, postalCode, city, region, countryCode)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }

    private Address build(String id, String entityId, AddressType type, String streetLine1, String streetLine2,
                          String city, String postalCode, String region, String countryCode, String sourceId,
                          Instant createdAt, Instant updatedAt) {
        if (isBlank(streetLine1) || isBlank(city) || isBlank(countryCode)) {
            throw ValidationException.forField("Invalid address", isBlank(streetLine1) ? "streetLine1"
                    : isBlank(city) ? "city" : "countryCode", "is required");
        }
        String country = ctx.normalizer().country(countryCode);
        return new Address(id, entityId, type, streetLine1.trim(), trimToNull(streetLine2), city.trim(),
                trimToNull(postalCode), trimToNull(region), country,
                normalizedFull(streetLine1, streetLine2, postalCode, city, region, country),
                sourceId, createdAt, updatedAt);
    }

    private static void requireSource(Transaction tx, String sourceId) {
        if (sourceId != null && !tx.exists(SOURCES, sourceId)) {
            throw new NotFoundException("Source", sourceId);
        }
    }

    private static String orElse(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
