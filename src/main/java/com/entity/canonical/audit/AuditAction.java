package com.entity.canonical.audit;

/**
 * Auditable canonicalization decisions.
 */
public enum AuditAction {
    CANONICAL_CREATED,
    MENTION_MERGED,
    AMBIGUOUS_PLACEHOLDER_CREATED,
    CANDIDATE_LINK_ACCEPTED,
    CANDIDATE_LINK_REJECTED,
    DOCUMENT_FAILED
}
