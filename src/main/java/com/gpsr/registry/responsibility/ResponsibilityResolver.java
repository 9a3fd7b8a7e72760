package com.gpsr.registry.responsibility;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.entity.RoleType;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.logging.LogContext;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.PRODUCTS;
import static com.gpsr.registry.schema.RegistrySchema.RESPONSIBILITIES;
import static com.gpsr.registry.schema.RegistrySchema.SOURCES;

/**
 * Answers "who is responsible for product X in country Y".
 *
 * <p>{@link #assign} demotes the ACTIVE row for {@code (product, country, role)} to
 * HISTORICAL and inserts the new ACTIVE row in one transaction. The store's partial
 * unique key on ACTIVE rows rejects a concurrent second assignment, which surfaces as
 * a conflict and is not retried.</p>
 *
 * <p>{@link #getResolved} picks one winner per role: highest confidence, then the
 * most recent {@code validFrom}, then the most recently created row.</p>
 */
public class ResponsibilityResolver {
    private static final Logger log = LoggerFactory.getLogger(ResponsibilityResolver.class);

    public static final String RESOURCE = "ProductResponsibility";

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    static final Comparator<ProductResponsibility> WINNER_ORDER =
            Comparator.comparingInt(ProductResponsibility::confidence).reversed()
                    .thenComparing(ProductResponsibility::validFrom, Comparator.reverseOrder())
                    .thenComparing(ProductResponsibility::createdAt, Comparator.reverseOrder());

    private final RegistryContext ctx;

    public ResponsibilityResolver(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Makes an entity responsible for a product in a country, replacing the current
     * assignment for that role.
     *
     * @throws NotFoundException if the product, entity or source does not exist
     * @throws com.gpsr.registry.error.ConflictException if another assignment for the same key committed first
     */
    public ProductResponsibility assign(AssignResponsibility request) {
        String country = ctx.normalizer().country(request.countryCode());
        int confidence = ctx.confidenceOrDefault(request.confidence());
        try (LogContext lc = LogContext.forResolution(request.productId(), country).with("operation", "assign")) {
            ProductResponsibility assigned = ctx.runner().execute("responsibility.assign", tx -> {
                requireExists(tx, request);
                Instant now = ctx.now();
                Instant validFrom = request.validFrom() != null ? request.validFrom() : now;
                if (request.validTo() != null && !request.validTo().isAfter(validFrom)) {
                    throw ValidationException.forField("Invalid responsibility", "validTo", "must be after validFrom");
                }
                Optional<ProductResponsibility> active = tx.findFirst(RESPONSIBILITIES, r -> r.isActive()
                        && r.productId().equals(request.productId())
                        && r.countryCode().equals(country)
                        && r.role() == request.role());
                active.ifPresent(previous -> {
                    ProductResponsibility demoted = previous.withStatus(ResponsibilityStatus.HISTORICAL, now, now);
                    tx.update(RESPONSIBILITIES, demoted);
                    ctx.audit().record(tx, AuditAction.RESPONSIBILITY_DEMOTED, RESOURCE, previous.id(),
                            previous, demoted);
                });
                ProductResponsibility created = new ProductResponsibility(UUID.randomUUID().toString(),
                        request.productId(), country, request.entityId(), request.role(), request.sourceId(),
                        confidence, ResponsibilityStatus.ACTIVE, validFrom, request.validTo(), now, now);
                tx.insert(RESPONSIBILITIES, created);
                ctx.audit().record(tx, AuditAction.RESPONSIBILITY_ASSIGNED, RESOURCE, created.id(), null, created);
                return created;
            });
            log.info("responsibility.assigned role={} entityId={} confidence={}",
                    assigned.role(), assigned.entityId(), assigned.confidence());
            return assigned;
        }
    }

    /**
     * Current resolution from ACTIVE rows.
     */
    public ResolvedResponsibilities getResolved(String productId, String countryCode) {
        return getResolved(productId, countryCode, null);
    }

    /**
     * Resolves the responsibilities of a product in a country.
     *
     * @param validOnDate null for the CURRENT view from ACTIVE rows; otherwise the
     *                    HISTORICAL view from every row valid at that instant
     */
    public ResolvedResponsibilities getResolved(String productId, String countryCode, Instant validOnDate) {
        long started = System.nanoTime();
        String country = ctx.normalizer().country(countryCode);
        Instant resolvedAt = ctx.now();
        ResolutionMode mode = validOnDate != null ? ResolutionMode.HISTORICAL : ResolutionMode.CURRENT;
        Instant target = validOnDate != null ? validOnDate : resolvedAt;

        try (LogContext lc = LogContext.forResolution(productId, country)) {
            Map<RoleType, ResolvedRole> resolved = ctx.runner().read(tx -> {
                List<ProductResponsibility> candidates = tx.find(RESPONSIBILITIES, r ->
                        r.productId().equals(productId)
                                && r.countryCode().equals(country)
                                && (mode == ResolutionMode.CURRENT ? r.isActive() : r.isValidAt(target)));
                Map<RoleType, List<ProductResponsibility>> byRole = candidates.stream()
                        .collect(Collectors.groupingBy(ProductResponsibility::role,
                                () -> new EnumMap<>(RoleType.class), Collectors.toList()));
                Map<RoleType, ResolvedRole> winners = new EnumMap<>(RoleType.class);
                byRole.forEach((role, rows) -> winners.put(role, resolveRole(tx, rows, target)));
                return winners;
            });
            int conflictCount = (int) resolved.values().stream().filter(ResolvedRole::hasConflicts).count();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            ctx.metrics().recordResolutionDuration(mode, elapsed);
            log.debug("responsibility.resolved mode={} roles={} conflicts={}", mode, resolved.size(), conflictCount);
            return new ResolvedResponsibilities(productId, country, mode, resolvedAt, target, resolved,
                    conflictCount);
        }
    }

    /**
     * Responsibilities of a product, ordered by role then confidence.
     *
     * @param status null for every status
     */
    public List<ProductResponsibility> getForProduct(String productId, String countryCode, RoleType role,
                                                     ResponsibilityStatus status) {
        String country = ctx.normalizer().country(countryCode);
        return ctx.runner().read(tx -> tx.find(RESPONSIBILITIES, r -> r.productId().equals(productId)
                        && (country == null || r.countryCode().equals(country))
                        && (role == null || r.role() == role)
                        && (status == null || r.status() == status)))
                .stream()
                .sorted(Comparator.comparing(ProductResponsibility::role)
                        .thenComparing(Comparator.comparingInt(ProductResponsibility::confidence).reversed()))
                .toList();
    }

    /**
     * ACTIVE responsibilities held by an entity, newest first.
     */
    public List<ProductResponsibility> getForEntity(String entityId) {
        return ctx.runner().read(tx -> tx.find(RESPONSIBILITIES, r -> r.isActive() && r.entityId().equals(entityId)))
                .stream()
                .sorted(Comparator.comparing(ProductResponsibility::createdAt).reversed())
                .toList();
    }

    /**
     * Every responsibility of a product in any status, by country, role and newest validity first.
     */
    public List<ProductResponsibility> getHistory(String productId, String countryCode) {
        String country = ctx.normalizer().country(countryCode);
        return ctx.runner().read(tx -> tx.find(RESPONSIBILITIES, r -> r.productId().equals(productId)
                        && (country == null || r.countryCode().equals(country))))
                .stream()
                .sorted(Comparator.comparing(ProductResponsibility::countryCode)
                        .thenComparing(ProductResponsibility::role)
                        .thenComparing(ProductResponsibility::validFrom, Comparator.reverseOrder()))
                .toList();
    }

    /**
     * Marks a responsibility as disputed. A disputed row no longer counts as ACTIVE.
     */
    public ProductResponsibility dispute(String id, String reason) {
        return ctx.runner().executeWithRetry("responsibility.dispute", tx -> {
            ProductResponsibility current = tx.get(RESPONSIBILITIES, id)
                    .orElseThrow(() -> new NotFoundException(RESOURCE, id));
            ProductResponsibility disputed = current.withStatus(ResponsibilityStatus.DISPUTED, current.validTo(),
                    ctx.now());
            tx.update(RESPONSIBILITIES, disputed);
            ctx.audit().record(tx, AuditAction.RESPONSIBILITY_DISPUTED, RESOURCE, id, current,
                    reason != null ? Map.of("status", disputed.status(), "reason", reason)
                            : Map.of("status", disputed.status()));
            tx.afterCommit(() -> log.info("responsibility.disputed responsibilityId={}", id));
            return disputed;
        });
    }

    private ResolvedRole resolveRole(Transaction tx, List<ProductResponsibility> rows, Instant target) {
        ProductResponsibility winner = rows.stream().min(WINNER_ORDER).orElseThrow();
        String entityName = tx.get(ENTITIES, winner.entityId()).map(Entity::getNormalizedName).orElse(null);
        long freshnessDays = Math.floorDiv(target.toEpochMilli() - winner.validFrom().toEpochMilli(), MILLIS_PER_DAY);
        return new ResolvedRole(winner.role(), winner.id(), winner.entityId(), entityName, winner.sourceId(),
                winner.confidence(), winner.validFrom(), freshnessDays, rows.size() > 1, rows.size());
    }

    private static void requireExists(Transaction tx, AssignResponsibility request) {
        if (!tx.exists(PRODUCTS, request.productId())) {
            throw new NotFoundException("Product", request.productId());
        }
        if (!tx.exists(ENTITIES, request.entityId())) {
            throw new NotFoundException("Entity", request.entityId());
        }
        if (!tx.exists(SOURCES, request.sourceId())) {
            throw new NotFoundException("Source", request.sourceId());
        }
    }
}
