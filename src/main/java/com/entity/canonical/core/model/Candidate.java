package com.entity.canonical.core.model;

import java.util.Objects;

/**
 * A canonical entity that might be the referent of a mention.
 *
 * @param canonicalEntityId the candidate canonical entity
 * @param matchedAliasId    the alias row that produced the match
 * @param reason            how the candidate was found
 * @param score             match score (1.0 exact, 0.6 fingerprint)
 */
public record Candidate(
        String canonicalEntityId,
        String matchedAliasId,
        MatchReason reason,
        double score
) {
    public Candidate {
        Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
        Objects.requireNonNull(reason, "reason is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    public static Candidate exact(String canonicalEntityId, String aliasId) {
        return new Candidate(canonicalEntityId, aliasId, MatchReason.EXACT_ALIAS, MatchReason.EXACT_ALIAS.getScore());
    }

    public static Candidate fingerprint(String canonicalEntityId, String aliasId) {
        return new Candidate(canonicalEntityId, aliasId, MatchReason.KEY_FINGERPRINT,
                MatchReason.KEY_FINGERPRINT.getScore());
    }

    public boolean isExact() {
        return reason == MatchReason.EXACT_ALIAS;
    }
}
