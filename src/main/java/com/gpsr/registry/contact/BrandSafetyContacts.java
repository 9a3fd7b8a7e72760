package com.gpsr.registry.contact;

import com.gpsr.registry.brand.BrandLinkType;
import com.gpsr.registry.entity.Entity;

import java.util.List;

/**
 * Everyone to contact about the safety of a brand's products: the brand's own
 * public safety contacts and those of the entities linked to it as manufacturer,
 * importer or responsible person.
 */
public record BrandSafetyContacts(List<ElectronicContact> brandContacts, List<EntityContacts> entityContacts) {

    public BrandSafetyContacts {
        brandContacts = List.copyOf(brandContacts);
        entityContacts = List.copyOf(entityContacts);
    }

    /**
     * Safety contacts of one linked entity. An entity linked twice appears once per link.
     */
    public record EntityContacts(Entity entity, BrandLinkType linkType, List<ElectronicContact> contacts) {
        public EntityContacts {
            contacts = List.copyOf(contacts);
        }
    }

    public boolean isEmpty() {
        return brandContacts.isEmpty() && entityContacts.stream().allMatch(e -> e.contacts().isEmpty());
    }
}
