package com.entity.canonical.decision;

/**
 * Outcome of deciding which canonical entity a mention refers to.
 */
public enum DecisionOutcome {
    /** Exactly one canonical entity owns the mention's normalized text as an alias. */
    MERGE_EXACT,
    /** No exact match, but exactly one canonical entity shares a key fingerprint. */
    MERGE_FINGERPRINT,
    /** Several canonical entities match; a placeholder is created and candidates are flagged. */
    AMBIGUOUS,
    /** No candidate at all; a new canonical entity is created. */
    CREATE_NEW;

    public boolean isMerge() {
        return this == MERGE_EXACT || this == MERGE_FINGERPRINT;
    }
}
