package com.entity.canonical.review;

import com.entity.canonical.api.Page;
import com.entity.canonical.api.PageRequest;
import com.entity.canonical.audit.AuditAction;
import com.entity.canonical.audit.AuditService;
import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.logging.LogContext;
import com.entity.canonical.store.CanonicalStore;
import com.entity.canonical.store.CanonicalStoreReader;
import com.entity.canonical.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adjudicates the PENDING candidate links left behind by ambiguous mentions.
 *
 * <p>Accepting a link merges the mention's placeholder entity into the candidate: every
 * mention of the placeholder moves to the candidate, aliases the candidate lacks are
 * migrated, the sibling links are rejected and the placeholder is deleted. Rejecting a link
 * only changes its status; the placeholder stays.</p>
 */
public class CandidateLinkReviewService {
    private static final Logger log = LoggerFactory.getLogger(CandidateLinkReviewService.class);

    private final CanonicalStore store;
    private final AuditService auditService;

    public CandidateLinkReviewService(CanonicalStore store, AuditService auditService) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    public Page<EntityCandidateLink> pendingLinks(PageRequest request) {
        Objects.requireNonNull(request, "request is required");
        CanonicalStoreReader reader = store.reader();
        long total = reader.countCandidateLinksByStatus(CandidateLinkStatus.PENDING);
        List<EntityCandidateLink> links = total == 0 ? List.of()
                : reader.findCandidateLinksByStatus(CandidateLinkStatus.PENDING, request.offset(), request.limit());
        return Page.of(links, total, request);
    }

    /**
     * Accepts a link, merging the placeholder entity into the candidate.
     *
     * @throws IllegalArgumentException if the link does not exist
     * @throws IllegalStateException    if the link is not PENDING
     */
    public ReviewOutcome accept(String linkId, String reviewerId) {
        Objects.requireNonNull(linkId, "linkId is required");
        Objects.requireNonNull(reviewerId, "reviewerId is required");

        ReviewOutcome outcome;
        try (LogContext ctx = LogContext.forReview(linkId, reviewerId);
             StoreTransaction tx = store.begin("review:" + linkId)) {
            EntityCandidateLink link = requirePending(tx, linkId);
            EntityMention mention = tx.findMention(link.getMentionId())
                    .orElseThrow(() -> new IllegalStateException("Mention of link " + linkId + " no longer exists"));
            String placeholderId = mention.getCanonicalEntityId();
            String candidateId = link.getCandidateCanonicalEntityId();

            int moved = tx.reassignMentions(placeholderId, candidateId);
            int migrated = tx.migrateAliases(placeholderId, candidateId);
            EntityCandidateLink accepted = tx.updateCandidateLinkStatus(linkId, CandidateLinkStatus.ACCEPTED);

            int rejected = 0;
            for (EntityCandidateLink sibling : tx.findCandidateLinksByMention(mention.getId())) {
                if (!sibling.getId().equals(linkId) && sibling.isPending()) {
                    tx.updateCandidateLinkStatus(sibling.getId(), CandidateLinkStatus.REJECTED);
                    rejected++;
                }
            }

            boolean deleted = false;
            if (!placeholderId.equals(candidateId) && tx.findCanonicalEntity(placeholderId).isPresent()) {
                tx.deleteCanonicalEntity(placeholderId);
                deleted = true;
            }
            tx.commit();

            outcome = new ReviewOutcome(accepted, placeholderId, deleted, moved, migrated, rejected);
            log.info("link.accepted linkId={} placeholder={} candidate={} mentions={} aliases={} rejected={}",
                    linkId, placeholderId, candidateId, moved, migrated, rejected);
        }

        auditService.record(AuditAction.CANDIDATE_LINK_ACCEPTED, outcome.link().getCandidateCanonicalEntityId(),
                null, reviewerId, Map.of(
                        "linkId", linkId,
                        "placeholderId", outcome.placeholderId(),
                        "mentionsReassigned", outcome.mentionsReassigned(),
                        "aliasesMigrated", outcome.aliasesMigrated(),
                        "linksRejected", outcome.linksRejected()));
        return outcome;
    }

    /**
     * Rejects a link. The placeholder entity and the mention's other links are unchanged.
     *
     * @throws IllegalArgumentException if the link does not exist
     * @throws IllegalStateException    if the link is not PENDING
     */
    public ReviewOutcome reject(String linkId, String reviewerId) {
        Objects.requireNonNull(linkId, "linkId is required");
        Objects.requireNonNull(reviewerId, "reviewerId is required");

        ReviewOutcome outcome;
        try (LogContext ctx = LogContext.forReview(linkId, reviewerId);
             StoreTransaction tx = store.begin("review:" + linkId)) {
            EntityCandidateLink link = requirePending(tx, linkId);
            String placeholderId = tx.findMention(link.getMentionId())
                    .map(EntityMention::getCanonicalEntityId)
                    .orElse(null);
            EntityCandidateLink rejected = tx.updateCandidateLinkStatus(linkId, CandidateLinkStatus.REJECTED);
            tx.commit();
            outcome = new ReviewOutcome(rejected, placeholderId, false, 0, 0, 0);
            log.info("link.rejected linkId={} candidate={}", linkId, link.getCandidateCanonicalEntityId());
        }

        auditService.record(AuditAction.CANDIDATE_LINK_REJECTED, outcome.link().getCandidateCanonicalEntityId(),
                null, reviewerId, Map.of("linkId", linkId, "mentionId", outcome.link().getMentionId()));
        return outcome;
    }

    private static EntityCandidateLink requirePending(StoreTransaction tx, String linkId) {
        EntityCandidateLink link = tx.findCandidateLink(linkId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown candidate link: " + linkId));
        if (!link.isPending()) {
            throw new IllegalStateException("Candidate link " + linkId + " is already " + link.getStatus());
        }
        return link;
    }
}
