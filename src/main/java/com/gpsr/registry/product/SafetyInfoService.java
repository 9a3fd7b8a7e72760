package com.gpsr.registry.product;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.logging.LogContext;
import com.gpsr.registry.normalize.Normalizer;
import com.gpsr.registry.source.Source;
import com.gpsr.registry.source.SourceInfo;
import com.gpsr.registry.source.SourceRegistry;
import com.gpsr.registry.store.Transaction;
import com.gpsr.registry.version.AggregateVersion;
import com.gpsr.registry.version.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.gpsr.registry.schema.RegistrySchema.PRODUCTS;
import static com.gpsr.registry.schema.RegistrySchema.SAFETY_INFO;
import static com.gpsr.registry.schema.RegistrySchema.SAFETY_INFO_VERSIONS;

/**
 * Versioned safety information per product, country and language.
 *
 * <p>Each {@code (product, country, language)} has one {@link SafetyInfo} row whose
 * {@code currentVersionId} points at the latest version, so there is never more than
 * one current version. The first add for a market creates that row; concurrent first
 * adds collide on its unique key and the loser is retried as a new version.</p>
 */
public class SafetyInfoService {
    private static final Logger log = LoggerFactory.getLogger(SafetyInfoService.class);

    public static final String AGGREGATE_TYPE = "SafetyInfo";

    private static final Comparator<SafetyInfo> BY_MARKET = Comparator.comparing(SafetyInfo::getCountryCode)
            .thenComparing(SafetyInfo::getLanguageCode);

    private final RegistryContext ctx;
    private final SourceRegistry sources;
    private final VersionStore<SafetyInfo> versions;
    private final Normalizer normalizer;

    public SafetyInfoService(RegistryContext ctx, SourceRegistry sources) {
        this.ctx = ctx;
        this.sources = sources;
        this.versions = new VersionStore<>(AGGREGATE_TYPE, SAFETY_INFO, SAFETY_INFO_VERSIONS, sources, ctx);
        this.normalizer = ctx.normalizer();
    }

    /**
     * Sets the safety content of a product for a market. Creates the thread on first
     * use, otherwise appends a version that replaces the content.
     *
     * @throws NotFoundException if the product does not exist
     */
    public SafetyInfo addSafetyInfo(String productId, String countryCode, String languageCode,
                                    SafetyContent content, SourceInfo sourceInfo, String changeNote) {
        if (sourceInfo == null) {
            throw ValidationException.forField("Invalid safety info", "source", "is required");
        }
        String country = normalizer.country(countryCode);
        String language = normalizer.language(languageCode);
        if (country == null || language == null) {
            throw new ValidationException("countryCode and languageCode are required");
        }
        if (!ctx.runner().read(tx -> tx.exists(PRODUCTS, productId))) {
            throw new NotFoundException("Product", productId);
        }
        Source source = sources.findOrCreate(sourceInfo);
        try (LogContext lc = LogContext.forAggregate(AGGREGATE_TYPE, null, "add")
                .with("productId", productId)
                .with("market", country + "/" + language)) {
            return ctx.runner().executeWithRetry("SafetyInfo.add", tx -> {
                Instant now = ctx.now();
                Optional<SafetyInfo> existing = findThread(tx, productId, country, language);
                if (existing.isEmpty()) {
                    SafetyInfo created = SafetyInfo.create(productId, country, language, content, now);
                    return versions.createInTransaction(tx, created, content, source.getId(), changeNote);
                }
                return versions.updateInTransaction(tx, existing.get().getId(),
                        current -> current.withContent(content, now).withActive(true, now),
                        content, source.getId(), changeNote);
            });
        }
    }

    /**
     * Appends a version with the non-null fields of {@code patch} applied to the current content.
     */
    public SafetyInfo updateSafetyInfo(String id, SafetyContent patch, SourceInfo sourceInfo, String changeNote) {
        if (sourceInfo == null) {
            throw ValidationException.forField("Invalid safety info", "source", "is required");
        }
        return versions.updateWithNewVersion(id,
                current -> current.withContent(patch.mergedOnto(current.getContent()), ctx.now()),
                patch, sourceInfo, changeNote);
    }

    /**
     * Current safety information for a market. Without a language, the first
     * language in alphabetical order is returned.
     */
    public Optional<SafetyInfo> getSafetyInfo(String productId, String countryCode, String languageCode) {
        String country = normalizer.country(countryCode);
        String language = normalizer.language(languageCode);
        return ctx.runner().read(tx -> tx.find(SAFETY_INFO, s -> s.isActive()
                        && s.getProductId().equals(productId)
                        && s.getCountryCode().equals(country)
                        && (language == null || s.getLanguageCode().equals(language))))
                .stream()
                .min(BY_MARKET);
    }

    public List<SafetyInfo> getAllSafetyInfo(String productId) {
        return ctx.runner().read(tx -> tx.find(SAFETY_INFO, s -> s.isActive() && s.getProductId().equals(productId)))
                .stream()
                .sorted(BY_MARKET)
                .toList();
    }

    /**
     * Every version of a market's safety information, newest first. The latest one is
     * flagged current and each older one names the version that superseded it.
     */
    public List<SafetyInfoVersion> getSafetyInfoHistory(String productId, String countryCode, String languageCode) {
        String country = normalizer.country(countryCode);
        String language = normalizer.language(languageCode);
        Optional<SafetyInfo> thread = ctx.runner().read(tx -> findThread(tx, productId, country, language));
        if (thread.isEmpty()) {
            return List.of();
        }
        SafetyInfo info = thread.get();
        List<AggregateVersion> chain = versions.getVersions(info.getId());
        List<SafetyInfoVersion> views = new ArrayList<>(chain.size());
        String successorId = null;
        for (AggregateVersion version : chain) {
            SafetyContent content = ctx.snapshots().fromJson(version.normalizedData(), SafetyContent.class);
            views.add(new SafetyInfoVersion(version, content,
                    version.id().equals(info.getCurrentVersionId()), successorId));
            successorId = version.id();
        }
        return views;
    }

    public SafetyInfo getById(String id) {
        return versions.getById(id);
    }

    public SafetyInfo deactivate(String id) {
        SafetyInfo deactivated = versions.deactivate(id);
        log.debug("safetyInfo.deactivated productId={} market={}/{}", deactivated.getProductId(),
                deactivated.getCountryCode(), deactivated.getLanguageCode());
        return deactivated;
    }

    private static Optional<SafetyInfo> findThread(Transaction tx, String productId, String country, String language) {
        return tx.findFirst(SAFETY_INFO, s -> s.getProductId().equals(productId)
                && s.getCountryCode().equals(country)
                && s.getLanguageCode().equals(language));
    }
}
