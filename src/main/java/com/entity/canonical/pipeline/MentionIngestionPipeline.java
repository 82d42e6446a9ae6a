package com.entity.canonical.pipeline;

import com.entity.canonical.audit.AuditAction;
import com.entity.canonical.audit.AuditService;
import com.entity.canonical.core.model.Candidate;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.decision.DecisionOutcome;
import com.entity.canonical.decision.MentionResolver;
import com.entity.canonical.decision.Resolution;
import com.entity.canonical.extraction.MalformedMentionException;
import com.entity.canonical.logging.LogContext;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.CanonicalStore;
import com.entity.canonical.store.StoreTransaction;
import com.entity.canonical.tracing.Span;
import com.entity.canonical.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves and persists one document's mentions as a single atomic unit.
 *
 * <p>Mentions are validated, trimmed, normalized and deduplicated before the store
 * transaction opens. Inside it the document's previous mentions are replaced, every mention
 * is resolved and written, and the document is marked resolved. Any failure rolls the whole
 * document back and is reported in the result; it never propagates to the caller.
 * Audit entries, metrics and logs are emitted only after commit.</p>
 */
public class MentionIngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(MentionIngestionPipeline.class);

    public static final double MENTION_CONFIDENCE = 1.0;

    private final CanonicalStore store;
    private final MentionNormalizer normalizer;
    private final MentionResolver resolver;
    private final MentionValidator validator;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public MentionIngestionPipeline(CanonicalStore store, MentionNormalizer normalizer, MentionResolver resolver,
                                    MentionValidator validator, AuditService auditService,
                                    MetricsService metricsService, TracingService tracingService) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.validator = Objects.requireNonNull(validator, "validator is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
    }

    /**
     * Ingests the mentions of one document, replacing any mentions ingested for it before.
     */
    public IngestionResult ingest(String documentId, List<RawMention> mentions) {
        Objects.requireNonNull(documentId, "documentId is required");
        List<RawMention> input = mentions != null ? mentions : List.of();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forDocument(null, documentId);
             Span span = tracingService.startSpan("canonical.ingest", Map.of("documentId", documentId))) {
            span.setAttribute("mentions", input.size());

            PreparedMentions prepared;
            try {
                prepared = prepare(input);
            } catch (MalformedMentionException e) {
                span.fail(e);
                return fail(documentId, input.size(), 0, e, start);
            }

            List<Applied> applied = new ArrayList<>();
            try (StoreTransaction tx = store.begin(documentId)) {
                int replaced = tx.deleteMentionsForDocument(documentId);
                if (replaced > 0) {
                    log.debug("document.mentions.replaced count={}", replaced);
                }
                for (PreparedMention mention : prepared.mentions()) {
                    applied.add(apply(tx, documentId, mention));
                }
                tx.markDocumentResolved(documentId);
                tx.commit();
            } catch (RuntimeException e) {
                span.fail(e);
                return fail(documentId, prepared.mentions().size(), prepared.skipped(), e, start);
            }

            IngestionResult result = report(documentId, applied, prepared.skipped());
            metricsService.recordDocumentDuration(Duration.ofNanos(System.nanoTime() - start), true);
            span.setAttribute("created", result.created());
            span.setAttribute("merged", result.merged());
            span.setAttribute("ambiguous", result.ambiguous());
            span.setStatus(Span.SpanStatus.OK);
            log.info("document.ingested documentId={} created={} merged={} ambiguous={} skipped={}",
                    documentId, result.created(), result.merged(), result.ambiguous(), result.skipped());
            return result;
        }
    }

    /**
     * Records a document that failed before ingestion (for example during extraction):
     * the document is marked unresolved and the failure is audited.
     */
    public IngestionResult rejectDocument(String documentId, RuntimeException cause) {
        try (LogContext ctx = LogContext.forDocument(null, documentId)) {
            return fail(documentId, 0, 0, cause, System.nanoTime());
        }
    }

    private PreparedMentions prepare(List<RawMention> input) {
        for (int i = 0; i < input.size(); i++) {
            validator.validate(input.get(i), i);
        }
        List<PreparedMention> prepared = new ArrayList<>();
        Set<DedupKey> seen = new HashSet<>();
        int skipped = 0;
        for (RawMention raw : input) {
            String text = raw.text().trim();
            String normalized = text.isEmpty() ? "" : normalizer.normalize(text);
            if (normalized.isEmpty()) {
                skipped++;
                continue;
            }
            if (!seen.add(new DedupKey(raw.type(), normalized, raw.position()))) {
                skipped++;
                continue;
            }
            prepared.add(new PreparedMention(raw, text, normalized));
        }
        return new PreparedMentions(prepared, skipped);
    }

    private Applied apply(StoreTransaction tx, String documentId, PreparedMention mention) {
        RawMention raw = mention.raw();
        Resolution resolution = resolver.resolve(tx, raw.type(), mention.text(), mention.normalized());

        EntityMention row = EntityMention.builder()
                .documentId(documentId)
                .chunkRef(raw.chunkRef())
                .canonicalEntityId(resolution.canonicalEntityId())
                .aliasId(resolution.aliasId())
                .mentionText(mention.text())
                .mentionNormalized(mention.normalized())
                .contextSnippet(raw.context())
                .position(raw.position())
                .confidence(MENTION_CONFIDENCE)
                .build();
        tx.insertMention(row);

        int links = 0;
        if (resolution.isAmbiguous()) {
            Map<String, Candidate> distinct = new LinkedHashMap<>();
            for (Candidate candidate : resolution.decision().candidates()) {
                distinct.putIfAbsent(candidate.canonicalEntityId(), candidate);
            }
            for (Candidate candidate : distinct.values()) {
                tx.insertCandidateLink(EntityCandidateLink.builder()
                        .mentionId(row.getId())
                        .candidateCanonicalEntityId(candidate.canonicalEntityId())
                        .score(candidate.score())
                        .reason(candidate.reason().getDescription())
                        .build());
                links++;
            }
        }
        return new Applied(raw.type(), row, resolution, links);
    }

    private IngestionResult report(String documentId, List<Applied> applied, int skipped) {
        int created = 0;
        int merged = 0;
        int ambiguous = 0;
        for (Applied a : applied) {
            Resolution resolution = a.resolution();
            DecisionOutcome outcome = resolution.decision().outcome();
            Map<String, Object> details = Map.of(
                    "mentionId", a.mention().getId(),
                    "mentionText", a.mention().getMentionText(),
                    "outcome", outcome.name(),
                    "reasoning", resolution.decision().reasoning());
            if (resolution.isAmbiguous()) {
                ambiguous++;
                metricsService.incrementAmbiguous(a.type());
                auditService.record(AuditAction.AMBIGUOUS_PLACEHOLDER_CREATED, resolution.canonicalEntityId(),
                        documentId, AuditService.SYSTEM_ACTOR, withLinks(details, a.links()));
            } else if (resolution.isNewCanonical()) {
                created++;
                metricsService.incrementCanonicalCreated(a.type());
                auditService.record(AuditAction.CANONICAL_CREATED, resolution.canonicalEntityId(),
                        documentId, AuditService.SYSTEM_ACTOR, details);
            } else {
                merged++;
                metricsService.incrementMentionMerged(a.type(), outcome);
                auditService.record(AuditAction.MENTION_MERGED, resolution.canonicalEntityId(),
                        documentId, AuditService.SYSTEM_ACTOR, details);
            }
        }
        return new IngestionResult(documentId, created, merged, ambiguous, skipped, 0, null);
    }

    private IngestionResult fail(String documentId, int failed, int skipped, RuntimeException cause, long start) {
        try {
            store.markDocumentUnresolved(documentId);
        } catch (RuntimeException e) {
            log.warn("document.unresolve.failed documentId={} error={}", documentId, e.getMessage());
        }
        metricsService.incrementDocumentFailed();
        metricsService.recordDocumentDuration(Duration.ofNanos(System.nanoTime() - start), false);
        auditService.record(AuditAction.DOCUMENT_FAILED, documentId, documentId, AuditService.SYSTEM_ACTOR,
                Map.of("error", String.valueOf(cause.getMessage()), "exception", cause.getClass().getSimpleName()));
        log.error("document.failed documentId={} mentions={} error={}", documentId, failed, cause.getMessage(), cause);
        return IngestionResult.failed(documentId, failed, skipped, cause.getMessage());
    }

    private static Map<String, Object> withLinks(Map<String, Object> details, int links) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put("candidateLinks", links);
        return copy;
    }

    private record DedupKey(EntityType type, String normalized, Integer position) {}

    private record PreparedMention(RawMention raw, String text, String normalized) {}

    private record PreparedMentions(List<PreparedMention> mentions, int skipped) {}

    private record Applied(EntityType type, EntityMention mention, Resolution resolution, int links) {}
}
