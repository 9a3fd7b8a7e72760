package com.gpsr.registry.claim;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import com.gpsr.registry.source.Source;
import com.gpsr.registry.source.SourceType;
import com.gpsr.registry.store.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import static com.gpsr.registry.schema.RegistrySchema.CLAIMS;
import static com.gpsr.registry.schema.RegistrySchema.EVIDENCE;
import static com.gpsr.registry.schema.RegistrySchema.SOURCES;

/**
 * Ledger of attribute-level claims and their evidence.
 *
 * <p>Claims move through {@link ClaimStatus}; an illegal transition is a validation
 * error. Superseding marks the old claim and inserts its successor in one
 * transaction, so readers never see both as open or neither.</p>
 *
 * <p>Conflicting accepted claims are never merged: {@link #resolveAttribute} ranks
 * them and reports the disagreement for a reviewer.</p>
 */
public class ClaimService {
    private static final Logger log = LoggerFactory.getLogger(ClaimService.class);

    public static final String RESOURCE = "Claim";

    private static final Comparator<Claim> NEWEST_FIRST = Comparator.comparing(Claim::getCreatedAt).reversed();

    private static final Comparator<Claim> REVIEW_QUEUE_ORDER =
            Comparator.comparingInt(Claim::getConfidence).reversed()
                    .thenComparing(Claim::getCreatedAt);

    private final RegistryContext ctx;

    public ClaimService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Records a PROPOSED claim together with its evidence.
     *
     * @throws NotFoundException if the source or the subject does not exist
     */
    public ClaimDetails submit(ClaimSubmission submission) {
        int confidence = ctx.confidenceOrDefault(submission.confidence());
        requireAttribute(submission.attribute());
        ClaimDetails details = ctx.runner().execute("claim.submit", tx -> {
            requireSource(tx, submission.sourceId());
            ClaimSubjects.requireExists(tx, submission.subject(), submission.subjectId());
            Claim claim = Claim.builder()
                    .subject(submission.subject())
                    .subjectId(submission.subjectId())
                    .attribute(submission.attribute().trim())
                    .value(submission.value())
                    .sourceId(submission.sourceId())
                    .confidence(confidence)
                    .status(ClaimStatus.PROPOSED)
                    .createdAt(ctx.now())
                    .build();
            tx.insert(CLAIMS, claim);
            List<Evidence> evidence = insertEvidence(tx, claim.getId(), submission.evidence());
            ctx.audit().record(tx, AuditAction.CLAIM_SUBMITTED, RESOURCE, claim.getId(), null, claim);
            return new ClaimDetails(claim, evidence);
        });
        ctx.metrics().incrementClaimTransition(ClaimStatus.PROPOSED);
        log.info("claim.submitted claimId={} subject={}:{} attribute={}", details.claim().getId(),
                submission.subject(), submission.subjectId(), details.claim().getAttribute());
        return details;
    }

    public Claim accept(String claimId, String reviewedBy, String notes) {
        return review(claimId, ClaimStatus.ACCEPTED, AuditAction.CLAIM_ACCEPTED, reviewedBy, notes);
    }

    public Claim reject(String claimId, String reviewedBy, String notes) {
        return review(claimId, ClaimStatus.REJECTED, AuditAction.CLAIM_REJECTED, reviewedBy, notes);
    }

    /**
     * Contests a claim. A disputed claim can later be accepted, rejected or superseded.
     */
    public Claim dispute(String claimId, String disputedBy, String reason) {
        return review(claimId, ClaimStatus.DISPUTED, AuditAction.CLAIM_DISPUTED, disputedBy, reason);
    }

    /**
     * Replaces an open claim with a new PROPOSED claim about the same subject and
     * attribute. The old claim becomes SUPERSEDED and points at its successor.
     *
     * @return the successor claim
     * @throws ValidationException if the old claim is no longer open
     */
    public ClaimDetails supersede(String oldClaimId, ClaimReplacement replacement) {
        int confidence = ctx.confidenceOrDefault(replacement.confidence());
        ClaimDetails successor = ctx.runner().executeWithRetry("claim.supersede", tx -> {
            Claim old = requireClaim(tx, oldClaimId);
            requireTransition(old, ClaimStatus.SUPERSEDED);
            requireSource(tx, replacement.sourceId());
            Instant now = ctx.now();
            Claim next = Claim.builder()
                    .subject(old.getSubject())
                    .subjectId(old.getSubjectId())
                    .attribute(old.getAttribute())
                    .value(replacement.value())
                    .sourceId(replacement.sourceId())
                    .confidence(confidence)
                    .status(ClaimStatus.PROPOSED)
                    .createdAt(now)
                    .build();
            Claim superseded = Claim.builder(old)
                    .status(ClaimStatus.SUPERSEDED)
                    .supersededById(next.getId())
                    .build();
            tx.update(CLAIMS, superseded);
            tx.insert(CLAIMS, next);
            List<Evidence> evidence = insertEvidence(tx, next.getId(), replacement.evidence());
            ctx.audit().record(tx, AuditAction.CLAIM_SUPERSEDED, RESOURCE, oldClaimId, old,
                    Map.of("status", ClaimStatus.SUPERSEDED, "supersededById", next.getId()));
            ctx.audit().record(tx, AuditAction.CLAIM_SUBMITTED, RESOURCE, next.getId(), null, next);
            return new ClaimDetails(next, evidence);
        });
        ctx.metrics().incrementClaimTransition(ClaimStatus.SUPERSEDED);
        ctx.metrics().incrementClaimTransition(ClaimStatus.PROPOSED);
        log.info("claim.superseded claimId={} successorId={}", oldClaimId, successor.claim().getId());
        return successor;
    }

    /**
     * Claims about a subject, newest first.
     *
     * @param status null for every status
     */
    public List<Claim> getForSubject(ClaimSubject subject, String subjectId, ClaimStatus status) {
        return ctx.runner().read(tx -> tx.find(CLAIMS, c -> c.getSubject() == subject
                        && c.getSubjectId().equals(subjectId)
                        && (status == null || c.getStatus() == status)))
                .stream()
                .sorted(NEWEST_FIRST)
                .toList();
    }

    /**
     * PROPOSED claims awaiting review: highest confidence first, oldest first among equals.
     */
    public List<Claim> getPending(int limit) {
        return ctx.runner().read(tx -> tx.find(CLAIMS, c -> c.getStatus() == ClaimStatus.PROPOSED))
                .stream()
                .sorted(REVIEW_QUEUE_ORDER)
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Attaches more evidence to an existing claim.
     */
    public Evidence addEvidence(String claimId, EvidenceInput input) {
        return ctx.runner().execute("claim.addEvidence", tx -> {
            requireClaim(tx, claimId);
            Evidence evidence = insertEvidence(tx, claimId, List.of(input)).get(0);
            ctx.audit().record(tx, AuditAction.EVIDENCE_ADDED, "Evidence", evidence.id(), null, evidence);
            return evidence;
        });
    }

    public List<Evidence> getEvidence(String claimId) {
        return ctx.runner().read(tx -> evidenceOf(tx, claimId));
    }

    public ClaimDetails getById(String claimId) {
        return ctx.runner().read(tx -> new ClaimDetails(requireClaim(tx, claimId), evidenceOf(tx, claimId)));
    }

    /**
     * Best known value of an attribute. Accepted claims are ranked by confidence,
     * then by the trust rank of their source, then newest first.
     */
    public AttributeResolution resolveAttribute(ClaimSubject subject, String subjectId, String attribute) {
        return ctx.runner().read(tx -> {
            List<Claim> claims = tx.find(CLAIMS, c -> c.isAbout(subject, subjectId, attribute));
            Map<String, Integer> trust = new LinkedHashMap<>();
            for (Claim claim : claims) {
                trust.computeIfAbsent(claim.getSourceId(), id -> tx.get(SOURCES, id)
                        .map(Source::getSourceType)
                        .map(SourceType::trustRank)
                        .orElse(0));
            }
            Comparator<Claim> ranking = Comparator.comparingInt(Claim::getConfidence).reversed()
                    .thenComparing(Comparator.comparingInt((Claim c) -> trust.get(c.getSourceId())).reversed())
                    .thenComparing(NEWEST_FIRST);
            List<Claim> accepted = claims.stream()
                    .filter(c -> c.getStatus() == ClaimStatus.ACCEPTED)
                    .sorted(ranking)
                    .toList();
            boolean conflicting = accepted.stream().map(Claim::getValue).distinct().count() > 1;
            int open = (int) claims.stream().filter(c -> c.getStatus().isOpen()).count();
            if (conflicting) {
                log.debug("claim.conflict subject={}:{} attribute={} acceptedValues={}", subject, subjectId,
                        attribute, accepted.stream().map(Claim::getValue).distinct().count());
            }
            return new AttributeResolution(subject, subjectId, attribute, accepted.stream().findFirst(),
                    accepted, conflicting, open);
        });
    }

    private Claim review(String claimId, ClaimStatus target, AuditAction action, String reviewer, String notes) {
        Claim reviewed = ctx.runner().executeWithRetry("claim." + target.name().toLowerCase(Locale.ROOT), tx -> {
            Claim current = requireClaim(tx, claimId);
            requireTransition(current, target);
            Claim.Builder builder = Claim.builder(current).status(target).reviewNotes(notes);
            if (target != ClaimStatus.DISPUTED) {
                builder.reviewedBy(reviewer).reviewedAt(ctx.now());
            }
            Claim next = builder.build();
            tx.update(CLAIMS, next);
            Map<String, Object> decision = new LinkedHashMap<>();
            decision.put("status", target);
            decision.put(target == ClaimStatus.DISPUTED ? "disputedBy" : "reviewedBy", reviewer);
            decision.put("notes", notes);
            ctx.audit().record(tx, action, RESOURCE, claimId, current, decision);
            return next;
        });
        ctx.metrics().incrementClaimTransition(target);
        log.info("claim.{} claimId={} by={}", target.name().toLowerCase(Locale.ROOT), claimId, reviewer);
        return reviewed;
    }

    private static void requireTransition(Claim claim, ClaimStatus target) {
        if (!claim.getStatus().canTransitionTo(target)) {
            throw ValidationException.forField("Illegal claim transition", "status",
                    "cannot move from " + claim.getStatus() + " to " + target);
        }
    }

    private static void requireAttribute(String attribute) {
        if (attribute.isBlank()) {
            throw ValidationException.forField("Invalid claim", "attribute", "must not be blank");
        }
    }

    private static Claim requireClaim(Transaction tx, String claimId) {
        return tx.get(CLAIMS, claimId).orElseThrow(() -> new NotFoundException(RESOURCE, claimId));
    }

    private static void requireSource(Transaction tx, String sourceId) {
        if (!tx.exists(SOURCES, sourceId)) {
            throw new NotFoundException("Source", sourceId);
        }
    }

    private List<Evidence> insertEvidence(Transaction tx, String claimId, List<EvidenceInput> inputs) {
        List<Evidence> created = new ArrayList<>(inputs.size());
        for (EvidenceInput input : inputs) {
            String hash = input.contentHash();
            if (hash == null && input.content() != null) {
                hash = sha256(input.content());
            }
            Evidence evidence = new Evidence(UUID.randomUUID().toString(), claimId, input.type(), input.url(),
                    input.content(), hash, ctx.now());
            tx.insert(EVIDENCE, evidence);
            created.add(evidence);
        }
        return created;
    }

    private static List<Evidence> evidenceOf(Transaction tx, String claimId) {
        return tx.find(EVIDENCE, e -> e.claimId().equals(claimId)).stream()
                .sorted(Comparator.comparing(Evidence::createdAt))
                .toList();
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
