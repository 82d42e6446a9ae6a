package com.entity.canonical.decision;

import com.entity.canonical.core.model.Candidate;

import java.util.List;
import java.util.Objects;

/**
 * Result of the pure resolution policy for one mention.
 *
 * @param outcome                 chosen outcome
 * @param targetCanonicalEntityId merge target for MERGE_* outcomes, null otherwise
 * @param candidates              every candidate considered (used for candidate links)
 * @param reasoning               short explanation for logs and audit
 */
public record ResolutionDecision(
        DecisionOutcome outcome,
        String targetCanonicalEntityId,
        List<Candidate> candidates,
        String reasoning
) {
    public ResolutionDecision {
        Objects.requireNonNull(outcome, "outcome is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        if (outcome.isMerge() && targetCanonicalEntityId == null) {
            throw new IllegalArgumentException("merge decisions require a target canonical entity");
        }
    }
}
