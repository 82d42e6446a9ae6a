package com.entity.canonical.review;

import com.entity.canonical.core.model.EntityCandidateLink;

/**
 * Result of adjudicating one candidate link.
 *
 * @param link                 the link after its status change
 * @param placeholderId        the unresolved placeholder the mention pointed at
 * @param placeholderDeleted   whether the placeholder was merged away
 * @param mentionsReassigned   mentions moved from the placeholder to the candidate
 * @param aliasesMigrated      aliases moved from the placeholder to the candidate
 * @param linksRejected        sibling links rejected along with an accept
 */
public record ReviewOutcome(EntityCandidateLink link, String placeholderId, boolean placeholderDeleted,
                            int mentionsReassigned, int aliasesMigrated, int linksRejected) {
}
