package com.entity.canonical.matching;

import com.entity.canonical.core.model.Candidate;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.CanonicalStoreReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds canonical entities a mention might refer to.
 *
 * <p>Two mechanisms run in order: exact lookup of the normalized text among aliases of the
 * same type, then lookup of each key fingerprint for types that support it. Each lookup
 * reads at most {@code maxCandidatesPerMechanism} alias rows. Results are unique per
 * canonical entity, exact candidates first.</p>
 */
public class CandidateMatcher {
    private static final Logger log = LoggerFactory.getLogger(CandidateMatcher.class);

    public static final int DEFAULT_MAX_CANDIDATES_PER_MECHANISM = 20;

    private final MentionNormalizer normalizer;
    private final int maxCandidatesPerMechanism;

    public CandidateMatcher(MentionNormalizer normalizer) {
        this(normalizer, DEFAULT_MAX_CANDIDATES_PER_MECHANISM);
    }

    public CandidateMatcher(MentionNormalizer normalizer, int maxCandidatesPerMechanism) {
        if (maxCandidatesPerMechanism <= 0) {
            throw new IllegalArgumentException("maxCandidatesPerMechanism must be > 0");
        }
        this.normalizer = normalizer;
        this.maxCandidatesPerMechanism = maxCandidatesPerMechanism;
    }

    /**
     * Returns the candidates for a mention, read through {@code reader} (normally the
     * caller's open transaction).
     *
     * @param reader            store view to search
     * @param entityType        mention type; candidates never cross types
     * @param mentionText       surface text, used to derive fingerprints
     * @param mentionNormalized normalized text; an empty value yields no candidates
     */
    public List<Candidate> findCandidates(CanonicalStoreReader reader, EntityType entityType,
                                          String mentionText, String mentionNormalized) {
        if (mentionNormalized == null || mentionNormalized.isEmpty()) {
            return List.of();
        }
        Map<String, Candidate> byCanonical = new LinkedHashMap<>();

        for (EntityAlias alias : reader.findAliases(entityType, mentionNormalized, maxCandidatesPerMechanism)) {
            byCanonical.putIfAbsent(alias.getCanonicalEntityId(),
                    Candidate.exact(alias.getCanonicalEntityId(), alias.getId()));
        }

        if (entityType.isKeyFingerprinted()) {
            Set<String> fingerprints = normalizer.fingerprints(entityType, mentionText);
            for (String key : fingerprints) {
                if (key.equals(mentionNormalized)) {
                    continue;
                }
                for (EntityAlias alias : reader.findAliases(entityType, key, maxCandidatesPerMechanism)) {
                    byCanonical.putIfAbsent(alias.getCanonicalEntityId(),
                            Candidate.fingerprint(alias.getCanonicalEntityId(), alias.getId()));
                }
            }
        }

        List<Candidate> candidates = new ArrayList<>(byCanonical.values());
        log.debug("matcher.candidates type={} normalized='{}' count={}",
                entityType, mentionNormalized, candidates.size());
        return candidates;
    }

    public int getMaxCandidatesPerMechanism() {
        return maxCandidatesPerMechanism;
    }
}
