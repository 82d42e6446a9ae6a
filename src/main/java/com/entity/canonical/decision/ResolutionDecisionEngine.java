package com.entity.canonical.decision;

import com.entity.canonical.core.model.Candidate;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.MatchReason;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure resolution policy: given the candidates for a mention, choose merge, ambiguity or
 * creation. The policy never guesses between several plausible entities.
 *
 * <ol>
 *   <li>exactly one exact candidate: {@link DecisionOutcome#MERGE_EXACT}</li>
 *   <li>no exact candidate and exactly one fingerprint candidate: {@link DecisionOutcome#MERGE_FINGERPRINT}</li>
 *   <li>several exact candidates, or none and several fingerprint candidates: {@link DecisionOutcome#AMBIGUOUS}</li>
 *   <li>no candidate: {@link DecisionOutcome#CREATE_NEW}</li>
 * </ol>
 */
public class ResolutionDecisionEngine {

    public ResolutionDecision decide(EntityType entityType, String mentionText, String mentionNormalized,
                                     List<Candidate> candidates) {
        Set<String> exact = new LinkedHashSet<>();
        Set<String> fingerprint = new LinkedHashSet<>();
        for (Candidate candidate : candidates) {
            if (candidate.reason() == MatchReason.EXACT_ALIAS) {
                exact.add(candidate.canonicalEntityId());
            } else {
                fingerprint.add(candidate.canonicalEntityId());
            }
        }

        if (exact.size() == 1) {
            String target = exact.iterator().next();
            return new ResolutionDecision(DecisionOutcome.MERGE_EXACT, target, candidates,
                    "single exact alias match for '" + mentionNormalized + "'");
        }
        if (exact.size() > 1) {
            return new ResolutionDecision(DecisionOutcome.AMBIGUOUS, null, candidates,
                    exact.size() + " " + entityType + " entities share alias '" + mentionNormalized + "'");
        }
        if (fingerprint.size() == 1) {
            String target = fingerprint.iterator().next();
            return new ResolutionDecision(DecisionOutcome.MERGE_FINGERPRINT, target, candidates,
                    "single fingerprint match for '" + mentionText + "'");
        }
        if (fingerprint.size() > 1) {
            return new ResolutionDecision(DecisionOutcome.AMBIGUOUS, null, candidates,
                    fingerprint.size() + " " + entityType + " entities share a fingerprint of '" + mentionText + "'");
        }
        return new ResolutionDecision(DecisionOutcome.CREATE_NEW, null, candidates,
                "no known " + entityType + " matches '" + mentionNormalized + "'");
    }
}
