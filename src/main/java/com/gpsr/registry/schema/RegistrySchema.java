package com.gpsr.registry.schema;

import com.gpsr.registry.address.Address;
import com.gpsr.registry.brand.Brand;
import com.gpsr.registry.brand.BrandLink;
import com.gpsr.registry.claim.Claim;
import com.gpsr.registry.claim.Evidence;
import com.gpsr.registry.contact.ElectronicContact;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.entity.EntityRole;
import com.gpsr.registry.identifier.EntityIdentifier;
import com.gpsr.registry.product.Product;
import com.gpsr.registry.product.SafetyInfo;
import com.gpsr.registry.relationship.EntityRelationship;
import com.gpsr.registry.responsibility.ProductResponsibility;
import com.gpsr.registry.responsibility.ResponsibilityStatus;
import com.gpsr.registry.source.Source;
import com.gpsr.registry.store.Table;
import com.gpsr.registry.version.AggregateVersion;
import com.gpsr.registry.version.VerificationRecord;

/**
 * Tables of the registry and the unique constraints the store enforces on them.
 * The constraints are the only concurrency control the services rely on.
 */
public final class RegistrySchema {

    private RegistrySchema() {
    }

    public static final Table<Source> SOURCES = Table.<Source>builder("sources", Source::getId)
            .resource("Source")
            .unique("sources_type_identifier", s -> Table.key(s.getSourceType(), s.getSourceIdentifier()))
            .build();

    public static final Table<Entity> ENTITIES = Table.<Entity>builder("entities", Entity::getId)
            .resource("Entity")
            .build();

    public static final Table<AggregateVersion> ENTITY_VERSIONS = versionTable("entity_versions", "Entity version");

    public static final Table<EntityRole> ENTITY_ROLES = Table.<EntityRole>builder("entity_roles", EntityRole::id)
            .resource("Entity role")
            .build();

    public static final Table<VerificationRecord> VERIFICATIONS =
            Table.<VerificationRecord>builder("verification_records", VerificationRecord::id)
                    .resource("Verification record")
                    .build();

    public static final Table<Brand> BRANDS = Table.<Brand>builder("brands", Brand::getId)
            .resource("Brand")
            .build();

    public static final Table<AggregateVersion> BRAND_VERSIONS = versionTable("brand_versions", "Brand version");

    public static final Table<BrandLink> BRAND_LINKS = Table.<BrandLink>builder("brand_links", BrandLink::id)
            .resource("Brand link")
            .build();

    public static final Table<Product> PRODUCTS = Table.<Product>builder("products", Product::id)
            .resource("Product")
            .build();

    public static final Table<SafetyInfo> SAFETY_INFO = Table.<SafetyInfo>builder("safety_info", SafetyInfo::getId)
            .resource("Safety info")
            .unique("safety_info_product_market",
                    s -> Table.key(s.getProductId(), s.getCountryCode(), s.getLanguageCode()))
            .build();

    public static final Table<AggregateVersion> SAFETY_INFO_VERSIONS =
            versionTable("safety_info_versions", "Safety info version");

    public static final Table<ProductResponsibility> RESPONSIBILITIES =
            Table.<ProductResponsibility>builder("product_responsibilities", ProductResponsibility::id)
                    .resource("Product responsibility")
                    .unique("responsibilities_one_active", r -> r.status() == ResponsibilityStatus.ACTIVE
                            ? Table.key(r.productId(), r.countryCode(), r.role())
                            : null)
                    .build();

    public static final Table<Claim> CLAIMS = Table.<Claim>builder("claims", Claim::getId)
            .resource("Claim")
            .build();

    public static final Table<Evidence> EVIDENCE = Table.<Evidence>builder("evidence", Evidence::id)
            .resource("Evidence")
            .build();

    public static final Table<EntityIdentifier> IDENTIFIERS =
            Table.<EntityIdentifier>builder("entity_identifiers", EntityIdentifier::id)
                    .resource("Identifier")
                    .unique("identifiers_type_value", i -> Table.key(i.type(), i.value()))
                    .unique("identifiers_one_primary", i -> i.primary() ? Table.key(i.entityId(), i.type()) : null)
                    .build();

    public static final Table<EntityRelationship> RELATIONSHIPS =
            Table.<EntityRelationship>builder("entity_relationships", EntityRelationship::id)
                    .resource("Relationship")
                    .build();

    public static final Table<ElectronicContact> CONTACTS =
            Table.<ElectronicContact>builder("electronic_contacts", ElectronicContact::id)
                    .resource("Electronic contact")
                    .build();

    public static final Table<Address> ADDRESSES = Table.<Address>builder("addresses", Address::id)
            .resource("Address")
            .build();

    private static Table<AggregateVersion> versionTable(String name, String resource) {
        return Table.<AggregateVersion>builder(name, AggregateVersion::id)
                .resource(resource)
                .unique(name + "_parent_number", v -> Table.key(v.parentId(), v.versionNumber()))
                .build();
    }
}
