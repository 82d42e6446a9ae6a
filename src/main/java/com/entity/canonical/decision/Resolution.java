package com.entity.canonical.decision;

import java.util.Objects;

/**
 * The applied result of resolving one mention inside a store transaction.
 *
 * @param canonicalEntityId canonical entity the mention now belongs to
 * @param aliasId           alias whose normalized text equals the mention's
 * @param isNewCanonical    whether a canonical entity (new or placeholder) was created
 * @param isAmbiguous       whether the mention went to an ambiguity placeholder
 * @param decision          the policy decision that was applied
 */
public record Resolution(
        String canonicalEntityId,
        String aliasId,
        boolean isNewCanonical,
        boolean isAmbiguous,
        ResolutionDecision decision
) {
    public Resolution {
        Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
        Objects.requireNonNull(decision, "decision is required");
    }
}
