package com.gpsr.registry.version;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.entity.Entity;
import com.gpsr.registry.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.ENTITY_VERSIONS;
import static com.gpsr.registry.schema.RegistrySchema.VERIFICATIONS;

/**
 * Verification statements attached to specific entity versions.
 */
public class VerificationService {
    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private static final Comparator<VerificationRecord> NEWEST_FIRST =
            Comparator.comparing(VerificationRecord::verifiedAt).reversed();

    private final RegistryContext ctx;

    public VerificationService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Records a verification of one entity version.
     *
     * @throws NotFoundException if the version does not exist
     */
    public VerificationRecord addVerification(String versionId, VerificationStatus status, String verifiedBy,
                                              String verificationMethod, String notes, String evidenceUrl,
                                              Instant expiresAt) {
        return ctx.runner().execute("verification.add", tx -> {
            if (!tx.exists(ENTITY_VERSIONS, versionId)) {
                throw new NotFoundException("Entity version", versionId);
            }
            VerificationRecord record = new VerificationRecord(UUID.randomUUID().toString(), versionId, status,
                    verifiedBy, verificationMethod, notes, evidenceUrl, ctx.now(), expiresAt);
            tx.insert(VERIFICATIONS, record);
            ctx.audit().record(tx, AuditAction.VERIFICATION_ADDED, "VerificationRecord", record.id(), null, record);
            tx.afterCommit(() -> log.info("verification.added versionId={} status={}", versionId, status));
            return record;
        });
    }

    /**
     * All verifications of all versions of an entity, newest first.
     */
    public List<VerificationRecord> getEntityVerificationHistory(String entityId) {
        return ctx.runner().read(tx -> {
            Set<String> versionIds = tx.find(ENTITY_VERSIONS, v -> v.parentId().equals(entityId)).stream()
                    .map(AggregateVersion::id)
                    .collect(Collectors.toSet());
            return tx.find(VERIFICATIONS, r -> versionIds.contains(r.versionId())).stream()
                    .sorted(NEWEST_FIRST)
                    .toList();
        });
    }

    /**
     * The newest verification of the entity's current version, if any.
     */
    public Optional<VerificationRecord> getLatestVerificationStatus(String entityId) {
        return ctx.runner().read(tx -> {
            Optional<String> currentVersionId = tx.get(ENTITIES, entityId).map(Entity::getCurrentVersionId);
            if (currentVersionId.isEmpty()) {
                return Optional.empty();
            }
            String versionId = currentVersionId.get();
            return tx.find(VERIFICATIONS, r -> r.versionId().equals(versionId)).stream()
                    .min(NEWEST_FIRST);
        });
    }

    public Page<VerificationRecord> getByStatus(VerificationStatus status, PageRequest page) {
        List<VerificationRecord> records = ctx.runner().read(tx -> tx.find(VERIFICATIONS, r -> r.status() == status))
                .stream()
                .sorted(NEWEST_FIRST)
                .toList();
        return Page.slice(records, ctx.page(page));
    }
}
