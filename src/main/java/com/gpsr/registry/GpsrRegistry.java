package com.gpsr.registry;

import com.gpsr.registry.address.AddressService;
import com.gpsr.registry.audit.AuditRepository;
import com.gpsr.registry.audit.AuditService;
import com.gpsr.registry.audit.InMemoryAuditRepository;
import com.gpsr.registry.brand.BrandService;
import com.gpsr.registry.claim.ClaimService;
import com.gpsr.registry.config.RegistryConfig;
import com.gpsr.registry.contact.ContactService;
import com.gpsr.registry.entity.EntityService;
import com.gpsr.registry.identifier.IdentifierService;
import com.gpsr.registry.json.SnapshotMapper;
import com.gpsr.registry.metrics.MetricsService;
import com.gpsr.registry.metrics.NoOpMetricsService;
import com.gpsr.registry.product.ProductService;
import com.gpsr.registry.product.SafetyInfoService;
import com.gpsr.registry.relationship.RelationshipService;
import com.gpsr.registry.responsibility.ResponsibilityResolver;
import com.gpsr.registry.source.SourceRegistry;
import com.gpsr.registry.store.InMemoryRegistryStore;
import com.gpsr.registry.store.RegistryStore;
import com.gpsr.registry.version.VerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point of the registry. Wires every service over one store so that
 * they share the same transaction runner, audit trail, metrics and clock.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * GpsrRegistry registry = GpsrRegistry.builder()
 *     .config(RegistryConfig.load())
 *     .metricsService(new MicrometerMetricsService(meterRegistry))
 *     .build();
 *
 * Entity acme = registry.entities().create(EntityInput.of("ACME GmbH", "DE"), SourceInfo.of(SourceType.MANUAL_ENTRY));
 * ResolvedResponsibilities resolved = registry.responsibilities().getResolved(productId, "DE");
 * </pre>
 */
public class GpsrRegistry {
    private static final Logger log = LoggerFactory.getLogger(GpsrRegistry.class);

    private final RegistryContext context;
    private final SourceRegistry sources;
    private final EntityService entities;
    private final BrandService brands;
    private final ProductService products;
    private final SafetyInfoService safetyInfo;
    private final ResponsibilityResolver responsibilities;
    private final ClaimService claims;
    private final VerificationService verifications;
    private final IdentifierService identifiers;
    private final RelationshipService relationships;
    private final ContactService contacts;
    private final AddressService addresses;

    private GpsrRegistry(RegistryContext context) {
        this.context = context;
        this.sources = new SourceRegistry(context);
        this.entities = new EntityService(context, sources);
        this.brands = new BrandService(context, sources);
        this.products = new ProductService(context);
        this.safetyInfo = new SafetyInfoService(context, sources);
        this.responsibilities = new ResponsibilityResolver(context);
        this.claims = new ClaimService(context);
        this.verifications = new VerificationService(context);
        this.identifiers = new IdentifierService(context);
        this.relationships = new RelationshipService(context);
        this.contacts = new ContactService(context);
        this.addresses = new AddressService(context);
        log.info("registry.started store={} maxAttempts={} sourceCache={}",
                context.runner().getStore().getClass().getSimpleName(),
                context.config().retry().maxAttempts(), context.config().sourceCache().enabled());
    }

    public RegistryContext context() {
        return context;
    }

    public AuditService audit() {
        return context.audit();
    }

    public SourceRegistry sources() {
        return sources;
    }

    public EntityService entities() {
        return entities;
    }

    public BrandService brands() {
        return brands;
    }

    public ProductService products() {
        return products;
    }

    public SafetyInfoService safetyInfo() {
        return safetyInfo;
    }

    public ResponsibilityResolver responsibilities() {
        return responsibilities;
    }

    public ClaimService claims() {
        return claims;
    }

    public VerificationService verifications() {
        return verifications;
    }

    public IdentifierService identifiers() {
        return identifiers;
    }

    public RelationshipService relationships() {
        return relationships;
    }

    public ContactService contacts() {
        return contacts;
    }

    public AddressService addresses() {
        return addresses;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RegistryStore store;
        private RegistryConfig config;
        private MetricsService metricsService;
        private Clock clock;
        private AuditService auditService;
        private AuditRepository auditRepository;

        /**
         * Backing store. Defaults to a fresh {@link InMemoryRegistryStore}.
         */
        public Builder store(RegistryStore store) {
            this.store = store;
            return this;
        }

        /**
         * Defaults to {@link RegistryConfig#defaults()}.
         */
        public Builder config(RegistryConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets a custom audit service. Takes precedence over {@link #auditRepository}.
         */
        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Sets the sink audit entries are appended to. Defaults to an
         * {@link InMemoryAuditRepository}.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public GpsrRegistry build() {
            RegistryStore resolvedStore = store != null ? store : new InMemoryRegistryStore();
            RegistryConfig resolvedConfig = config != null ? config : RegistryConfig.defaults();
            MetricsService resolvedMetrics = metricsService != null ? metricsService : new NoOpMetricsService();
            Clock resolvedClock = clock != null ? clock : Clock.systemUTC();
            SnapshotMapper snapshots = new SnapshotMapper();
            AuditService resolvedAudit;
            if (auditService != null) {
                resolvedAudit = auditService;
            } else {
                resolvedAudit = new AuditService(
                        auditRepository != null ? auditRepository : new InMemoryAuditRepository(),
                        snapshots, resolvedClock);
            }
            return new GpsrRegistry(RegistryContext.of(resolvedStore, resolvedConfig, resolvedMetrics,
                    resolvedClock, resolvedAudit, snapshots));
        }
    }
}
