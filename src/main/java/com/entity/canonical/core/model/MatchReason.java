package com.entity.canonical.core.model;

/**
 * Mechanism through which a candidate canonical entity was found.
 */
public enum MatchReason {
    EXACT_ALIAS("exact_alias", 1.0, "exact alias normalized match"),
    KEY_FINGERPRINT("key_fingerprint", 0.6, "last-token fingerprint match");

    private final String code;
    private final double score;
    private final String description;

    MatchReason(String code, double score, String description) {
        this.code = code;
        this.score = score;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public double getScore() {
        return score;
    }

    /**
     * Human-readable reason stored on candidate links.
     */
    public String getDescription() {
        return description;
    }
}
