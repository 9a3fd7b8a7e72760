package com.gpsr.registry.brand;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.entity.EntityService;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.source.SourceInfo;
import com.gpsr.registry.source.SourceRegistry;
import com.gpsr.registry.version.AggregateHistory;
import com.gpsr.registry.version.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static com.gpsr.registry.schema.RegistrySchema.BRANDS;
import static com.gpsr.registry.schema.RegistrySchema.BRAND_LINKS;
import static com.gpsr.registry.schema.RegistrySchema.BRAND_VERSIONS;
import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;

/**
 * Versioned brands and the entities linked to them. Trade names are stored as given;
 * only blank optional fields are dropped.
 */
public class BrandService {
    private static final Logger log = LoggerFactory.getLogger(BrandService.class);

    public static final String AGGREGATE_TYPE = "Brand";
    public static final String LINK_RESOURCE = "BrandLink";

    private final RegistryContext ctx;
    private final VersionStore<Brand> versions;

    public BrandService(RegistryContext ctx, SourceRegistry sources) {
        this.ctx = ctx;
        this.versions = new VersionStore<>(AGGREGATE_TYPE, BRANDS, BRAND_VERSIONS, sources, ctx);
    }

    public Brand create(BrandInput input, SourceInfo sourceInfo) {
        if (input.tradeName() == null || input.tradeName().isBlank()) {
            throw ValidationException.forField("Invalid brand", "tradeName", "is required");
        }
        Instant now = ctx.now();
        Brand brand = Brand.builder()
                .tradeName(input.tradeName().trim())
                .tradeMarkNumber(blankToNull(input.tradeMarkNumber()))
                .tradeMarkOffice(blankToNull(input.tradeMarkOffice()))
                .logoUrl(blankToNull(input.logoUrl()))
                .description(blankToNull(input.description()))
                .verified(Boolean.TRUE.equals(input.verified()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        Brand created = versions.createWithVersion(brand, input, sourceInfo, null);
        log.info("brand.created id={} tradeName='{}'", created.getId(), created.getTradeName());
        return created;
    }

    public Brand update(String id, BrandInput input, SourceInfo sourceInfo, String changeNote) {
        if (input.tradeName() != null && input.tradeName().isBlank()) {
            throw ValidationException.forField("Invalid brand", "tradeName", "must not be blank");
        }
        Brand updated = versions.updateWithNewVersion(id, current -> {
            Brand.Builder builder = Brand.builder(current);
            if (input.tradeName() != null) {
                builder.tradeName(input.tradeName().trim());
            }
            if (input.tradeMarkNumber() != null) {
                builder.tradeMarkNumber(blankToNull(input.tradeMarkNumber()));
            }
            if (input.tradeMarkOffice() != null) {
                builder.tradeMarkOffice(blankToNull(input.tradeMarkOffice()));
            }
            if (input.logoUrl() != null) {
                builder.logoUrl(blankToNull(input.logoUrl()));
            }
            if (input.description() != null) {
                builder.description(blankToNull(input.description()));
            }
            if (input.verified() != null) {
                builder.verified(input.verified());
            }
            return builder.build();
        }, input, sourceInfo, changeNote);
        log.info("brand.updated id={} versionId={}", id, updated.getCurrentVersionId());
        return updated;
    }

    public Brand getById(String id) {
        return versions.getById(id);
    }

    public Optional<Brand> findById(String id) {
        return versions.findById(id);
    }

    public AggregateHistory<Brand> getWithHistory(String id) {
        return versions.getHistory(id);
    }

    public VersionStore<Brand> versions() {
        return versions;
    }

    /**
     * Lists active brands by trade name, optionally filtered by a name fragment.
     */
    public Page<Brand> list(String search, PageRequest page) {
        String fragment = search != null ? search.toLowerCase(Locale.ROOT) : null;
        List<Brand> matches = versions.list(b -> b.isActive()
                        && (fragment == null || b.getTradeName().toLowerCase(Locale.ROOT).contains(fragment)))
                .stream()
                .sorted(Comparator.comparing(Brand::getTradeName, String.CASE_INSENSITIVE_ORDER))
                .toList();
        return Page.slice(matches, ctx.page(page));
    }

    public Brand deactivate(String id) {
        Brand deactivated = versions.deactivate(id);
        log.info("brand.deactivated id={}", id);
        return deactivated;
    }

    /**
     * Links an entity to a brand, for example as its manufacturer in the EU.
     *
     * @throws NotFoundException   if the brand or the entity does not exist
     * @throws ValidationException if {@code validTo} is not after {@code validFrom}
     */
    public BrandLink addEntityLink(String brandId, CreateBrandLink request) {
        BrandLink created = ctx.runner().execute("brand.link", tx -> {
            if (!tx.exists(BRANDS, brandId)) {
                throw new NotFoundException(AGGREGATE_TYPE, brandId);
            }
            if (!tx.exists(ENTITIES, request.entityId())) {
                throw new NotFoundException(EntityService.AGGREGATE_TYPE, request.entityId());
            }
            Instant now = ctx.now();
            Instant from = request.validFrom() != null ? request.validFrom() : now;
            if (request.validTo() != null && !request.validTo().isAfter(from)) {
                throw ValidationException.forField("Invalid brand link", "validTo", "must be after validFrom");
            }
            BrandLink link = new BrandLink(UUID.randomUUID().toString(), brandId, request.entityId(),
                    request.linkType(), marketOf(request.marketContext()), blankToNull(request.productScope()),
                    from, request.validTo(), true, now);
            tx.insert(BRAND_LINKS, link);
            ctx.audit().record(tx, AuditAction.LINK_BRAND, LINK_RESOURCE, link.id(), null, link);
            return link;
        });
        log.info("brand.linked brandId={} entityId={} linkType={} market={}", brandId, created.entityId(),
                created.linkType(), created.marketContext());
        return created;
    }

    /**
     * Active links of a brand with their entities, oldest first.
     *
     * @param linkType      null for every type
     * @param marketContext null for every market
     */
    public List<LinkedEntity> getLinkedEntities(String brandId, BrandLinkType linkType, String marketContext) {
        String market = marketContext != null ? marketOf(marketContext) : null;
        return ctx.runner().read(tx -> tx.find(BRAND_LINKS, l -> l.brandId().equals(brandId)
                                && l.active()
                                && (linkType == null || l.linkType() == linkType)
                                && (market == null || l.marketContext().equals(market)))
                        .stream()
                        .sorted(Comparator.comparing(BrandLink::createdAt))
                        .map(l -> new LinkedEntity(l, tx.get(ENTITIES, l.entityId())
                                .orElseThrow(() -> new NotFoundException(EntityService.AGGREGATE_TYPE, l.entityId()))))
                        .toList());
    }

    private static String marketOf(String marketContext) {
        return marketContext == null || marketContext.isBlank()
                ? BrandLink.GLOBAL_MARKET
                : marketContext.trim().toUpperCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
