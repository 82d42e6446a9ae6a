package com.entity.canonical.core.model;

/**
 * Review status of a candidate link recorded for an ambiguous mention.
 */
public enum CandidateLinkStatus {
    /**
     * Recorded at ingestion time, awaiting adjudication.
     */
    PENDING,

    /**
     * The placeholder entity was merged into this candidate.
     */
    ACCEPTED,

    /**
     * The candidate was ruled out; the placeholder keeps standing on its own.
     */
    REJECTED
}
