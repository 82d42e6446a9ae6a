package com.entity.canonical.decision;

import com.entity.canonical.core.model.Candidate;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.matching.CandidateMatcher;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.metrics.NoOpMetricsService;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.DuplicateAliasException;
import com.entity.canonical.store.ResolutionConflictException;
import com.entity.canonical.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Applies the resolution policy to one mention inside an open store transaction:
 * finds candidates, decides, then creates or extends canonical entities and aliases.
 *
 * <p>A {@link DuplicateAliasException} means another writer registered the alias between
 * lookup and insert. Lookup and decision are then re-run up to {@code conflictRetries}
 * times before the conflict is reported as a {@link ResolutionConflictException}.</p>
 */
public class MentionResolver {
    private static final Logger log = LoggerFactory.getLogger(MentionResolver.class);

    public static final int DEFAULT_CONFLICT_RETRIES = 1;

    private final MentionNormalizer normalizer;
    private final CandidateMatcher matcher;
    private final ResolutionDecisionEngine decisionEngine;
    private final MetricsService metricsService;
    private final int conflictRetries;

    public MentionResolver(MentionNormalizer normalizer, CandidateMatcher matcher,
                           ResolutionDecisionEngine decisionEngine) {
        this(normalizer, matcher, decisionEngine, new NoOpMetricsService(), DEFAULT_CONFLICT_RETRIES);
    }

    public MentionResolver(MentionNormalizer normalizer, CandidateMatcher matcher,
                           ResolutionDecisionEngine decisionEngine, MetricsService metricsService,
                           int conflictRetries) {
        if (conflictRetries < 0) {
            throw new IllegalArgumentException("conflictRetries must be >= 0");
        }
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.decisionEngine = decisionEngine;
        this.metricsService = metricsService;
        this.conflictRetries = conflictRetries;
    }

    /**
     * Resolves a mention and registers its aliases.
     *
     * @param tx                open transaction; all reads and writes go through it
     * @param entityType        mention type
     * @param mentionText       trimmed surface text
     * @param mentionNormalized normalized text, must not be empty
     * @throws ResolutionConflictException if alias registration keeps conflicting
     */
    public Resolution resolve(StoreTransaction tx, EntityType entityType, String mentionText,
                              String mentionNormalized) {
        if (mentionNormalized == null || mentionNormalized.isEmpty()) {
            throw new IllegalArgumentException("mentionNormalized must not be empty");
        }
        int attempt = 0;
        while (true) {
            try {
                return resolveOnce(tx, entityType, mentionText, mentionNormalized);
            } catch (DuplicateAliasException e) {
                if (attempt >= conflictRetries) {
                    throw new ResolutionConflictException("Alias conflict persisted for " + entityType
                            + " '" + mentionNormalized + "' after " + (attempt + 1) + " attempts", e);
                }
                attempt++;
                metricsService.incrementConflictRetry(entityType);
                log.info("resolver.conflict.retry type={} normalized='{}' attempt={}",
                        entityType, mentionNormalized, attempt);
            }
        }
    }

    private Resolution resolveOnce(StoreTransaction tx, EntityType entityType, String mentionText,
                                   String mentionNormalized) {
        var candidates = matcher.findCandidates(tx, entityType, mentionText, mentionNormalized);
        metricsService.recordCandidateCount(candidates.size());
        ResolutionDecision decision = decisionEngine.decide(entityType, mentionText, mentionNormalized, candidates);
        log.debug("resolver.decision type={} normalized='{}' outcome={} candidates={}",
                entityType, mentionNormalized, decision.outcome(), candidates.size());

        switch (decision.outcome()) {
            case MERGE_EXACT, MERGE_FINGERPRINT -> {
                String targetId = decision.targetCanonicalEntityId();
                String aliasId = registerAliases(tx, entityType, targetId, mentionText, mentionNormalized);
                return new Resolution(targetId, aliasId, false, false, decision);
            }
            case AMBIGUOUS -> {
                CanonicalEntity placeholder = CanonicalEntity.builder()
                        .type(entityType)
                        .canonicalText(mentionText)
                        .canonicalNormalized(mentionNormalized)
                        .unresolved(CanonicalEntity.REASON_AMBIGUOUS_ALIAS_MATCH)
                        .build();
                tx.insertCanonicalEntity(placeholder);
                String aliasId = registerAliases(tx, entityType, placeholder.getId(), mentionText, mentionNormalized);
                log.info("resolver.ambiguous type={} normalized='{}' placeholderId={} candidates={}",
                        entityType, mentionNormalized, placeholder.getId(),
                        decision.candidates().stream().map(Candidate::canonicalEntityId).distinct().count());
                return new Resolution(placeholder.getId(), aliasId, true, true, decision);
            }
            default -> {
                CanonicalEntity created = CanonicalEntity.builder()
                        .type(entityType)
                        .canonicalText(mentionText)
                        .canonicalNormalized(mentionNormalized)
                        .build();
                tx.insertCanonicalEntity(created);
                String aliasId = registerAliases(tx, entityType, created.getId(), mentionText, mentionNormalized);
                return new Resolution(created.getId(), aliasId, true, false, decision);
            }
        }
    }

    /**
     * Registers the normalized text and every fingerprint as aliases of the canonical entity,
     * skipping those it already owns.
     *
     * @return id of the alias whose normalized text equals the mention's
     */
    private String registerAliases(StoreTransaction tx, EntityType entityType, String canonicalEntityId,
                                   String mentionText, String mentionNormalized) {
        Set<String> fingerprints = normalizer.fingerprints(entityType, mentionText);
        String primaryAliasId = ensureAlias(tx, entityType, canonicalEntityId, mentionText, mentionNormalized);
        for (String key : fingerprints) {
            if (!key.equals(mentionNormalized)) {
                ensureAlias(tx, entityType, canonicalEntityId, mentionText, key);
            }
        }
        return primaryAliasId;
    }

    private String ensureAlias(StoreTransaction tx, EntityType entityType, String canonicalEntityId,
                               String aliasText, String aliasNormalized) {
        Optional<EntityAlias> existing = tx.findAlias(canonicalEntityId, aliasNormalized);
        if (existing.isPresent()) {
            return existing.get().getId();
        }
        EntityAlias alias = EntityAlias.builder()
                .entityType(entityType)
                .canonicalEntityId(canonicalEntityId)
                .aliasText(aliasText)
                .aliasNormalized(aliasNormalized)
                .build();
        tx.insertAlias(alias);
        log.debug("resolver.alias.registered canonicalEntityId={} alias='{}'", canonicalEntityId, aliasNormalized);
        return alias.getId();
    }

    public int getConflictRetries() {
        return conflictRetries;
    }
}
