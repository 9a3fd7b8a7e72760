package com.gpsr.registry.contact;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.brand.BrandLink;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.store.Table;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

import static com.gpsr.registry.schema.RegistrySchema.BRANDS;
import static com.gpsr.registry.schema.RegistrySchema.BRAND_LINKS;
import static com.gpsr.registry.schema.RegistrySchema.CONTACTS;
import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;

/**
 * Electronic contact points of entities and brands.
 */
public class ContactService {
    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    public static final String RESOURCE = "ElectronicContact";

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final int MIN_PHONE_DIGITS = 6;
    private static final int MAX_PHONE_DIGITS = 15;

    private final RegistryContext ctx;

    public ContactService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Registers a contact point for an entity or a brand.
     *
     * @throws NotFoundException   if the owner does not exist
     * @throws ValidationException if the value does not fit the contact type
     */
    public ElectronicContact add(ContactOwnerType ownerType, String ownerId, ContactInput input) {
        String value = input.value().trim();
        validateValue(input.contactType(), value);
        ElectronicContact created = ctx.runner().execute("contact.add", tx -> {
            requireOwner(tx, ownerType, ownerId);
            ElectronicContact contact = new ElectronicContact(UUID.randomUUID().toString(), ownerType, ownerId,
                    input.contactType(), value, input.label(), ctx.normalizer().language(input.languageCode()),
                    Boolean.TRUE.equals(input.forSafetyIssues()),
                    Boolean.TRUE.equals(input.forConsumerComplaints()),
                    input.publicContact() == null || input.publicContact(),
                    false, null, null, null, true, ctx.now());
            tx.insert(CONTACTS, contact);
            ctx.audit().record(tx, AuditAction.CONTACT_CREATED, RESOURCE, contact.id(), null, contact);
            return contact;
        });
        log.info("contact.created id={} owner={}:{} type={}", created.id(), ownerType, ownerId,
                created.contactType());
        return created;
    }

    /**
     * Records that direct communication through the contact has been confirmed.
     */
    public ElectronicContact confirm(String contactId, String confirmationMethod, String confirmedBy) {
        return change("contact.confirm", contactId, AuditAction.CONTACT_CONFIRMED,
                c -> c.confirmed(confirmationMethod, confirmedBy, ctx.now()));
    }

    public ElectronicContact deactivate(String contactId) {
        return change("contact.deactivate", contactId, AuditAction.CONTACT_DEACTIVATED,
                ElectronicContact::deactivated);
    }

    /**
     * Physically removes a contact. The audit entry keeps the removed row.
     */
    public ElectronicContact remove(String contactId) {
        ElectronicContact removed = ctx.runner().execute("contact.remove", tx -> {
            ElectronicContact deleted = tx.delete(CONTACTS, contactId);
            ctx.audit().record(tx, AuditAction.CONTACT_REMOVED, RESOURCE, contactId, deleted, null);
            return deleted;
        });
        log.info("contact.removed id={} owner={}:{}", contactId, removed.ownerType(), removed.ownerId());
        return removed;
    }

    /**
     * Active contacts of an owner, newest first.
     */
    public List<ElectronicContact> getForOwner(ContactOwnerType ownerType, String ownerId,
                                               boolean safetyOnly, boolean publicOnly) {
        return ctx.runner().read(tx -> tx.find(CONTACTS, c -> c.ownerType() == ownerType
                        && c.ownerId().equals(ownerId)
                        && c.active()
                        && (!safetyOnly || c.forSafetyIssues())
                        && (!publicOnly || c.publicContact())))
                .stream()
                .sorted(Comparator.comparing(ElectronicContact::createdAt).reversed())
                .toList();
    }

    /**
     * Public safety contacts of a brand and of its active MANUFACTURER, RESPONSIBLE_PERSON
     * and IMPORTER links, read in one transaction.
     *
     * @throws NotFoundException if the brand does not exist
     */
    public BrandSafetyContacts getSafetyContactsForBrand(String brandId) {
        return ctx.runner().read(tx -> {
            if (!tx.exists(BRANDS, brandId)) {
                throw new NotFoundException(ContactOwnerType.BRAND.resource(), brandId);
            }
            List<ElectronicContact> brandContacts = safetyContacts(tx, ContactOwnerType.BRAND, brandId);
            List<BrandSafetyContacts.EntityContacts> entityContacts = tx.find(BRAND_LINKS,
                            l -> l.brandId().equals(brandId) && l.active() && l.linkType().isSafetyContactRole())
                    .stream()
                    .sorted(Comparator.comparing(BrandLink::createdAt))
                    .flatMap(l -> tx.get(ENTITIES, l.entityId()).stream()
                            .map(entity -> new BrandSafetyContacts.EntityContacts(entity, l.linkType(),
                                    safetyContacts(tx, ContactOwnerType.ENTITY, entity.getId()))))
                    .toList();
            log.debug("contact.safety brandId={} brandContacts={} linkedEntities={}", brandId,
                    brandContacts.size(), entityContacts.size());
            return new BrandSafetyContacts(brandContacts, entityContacts);
        });
    }

    public ElectronicContact getById(String contactId) {
        return ctx.runner().read(tx -> tx.get(CONTACTS, contactId))
                .orElseThrow(() -> new NotFoundException("Electronic contact", contactId));
    }

    private static List<ElectronicContact> safetyContacts(Transaction tx, ContactOwnerType ownerType, String ownerId) {
        return tx.find(CONTACTS, c -> c.ownerType() == ownerType
                        && c.ownerId().equals(ownerId)
                        && c.active()
                        && c.forSafetyIssues()
                        && c.publicContact())
                .stream()
                .sorted(Comparator.comparing(ElectronicContact::createdAt).reversed())
                .toList();
    }

    static void validateValue(ContactType type, String value) {
        switch (type) {
            case EMAIL -> {
                if (!EMAIL.matcher(value).matches()) {
                    throw ValidationException.forField("Invalid email format", "value",
                            "Must be a valid email address");
                }
            }
            case CONTACT_FORM, WEBSITE_SECTION -> {
                if (!isHttpUrl(value)) {
                    throw ValidationException.forField("Invalid URL format", "value",
                            "Must be an absolute http or https URL");
                }
            }
            case PHONE -> {
                int digits = NON_DIGIT.matcher(value).replaceAll("").length();
                if (digits < MIN_PHONE_DIGITS || digits > MAX_PHONE_DIGITS) {
                    throw ValidationException.forField("Invalid phone number", "value",
                            "Must contain between " + MIN_PHONE_DIGITS + " and " + MAX_PHONE_DIGITS + " digits");
                }
            }
            default -> {
                if (value.isEmpty()) {
                    throw ValidationException.forField("Invalid contact", "value", "must not be blank");
                }
            }
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return uri.isAbsolute()
                    && uri.getHost() != null
                    && ("http".equals(scheme.toLowerCase(Locale.ROOT)) || "https".equals(scheme.toLowerCase(Locale.ROOT)));
        } catch (URISyntaxException e) {
            log.debug("contact.url.invalid value={} reason={}", value, e.getReason());
            return false;
        }
    }

    private static void requireOwner(Transaction tx, ContactOwnerType ownerType, String ownerId) {
        Table<?> table = ownerType == ContactOwnerType.ENTITY ? ENTITIES : BRANDS;
        if (!tx.exists(table, ownerId)) {
            throw new NotFoundException(ownerType.resource(), ownerId);
        }
    }

    private ElectronicContact change(String operation, String contactId, AuditAction action,
                                     UnaryOperator<ElectronicContact> mutation) {
        ElectronicContact changed = ctx.runner().execute(operation, tx -> {
            ElectronicContact current = tx.get(CONTACTS, contactId)
                    .orElseThrow(() -> new NotFoundException("Electronic contact", contactId));
            ElectronicContact updated = mutation.apply(current);
            tx.update(CONTACTS, updated);
            ctx.audit().record(tx, action, RESOURCE, contactId, current, updated);
            return updated;
        });
        log.info("{} id={}", operation, contactId);
        return changed;
    }
}
