package com.entity.canonical.graph;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.store.CompensatingTransaction;
import com.entity.canonical.store.DuplicateAliasException;
import com.entity.canonical.store.DuplicateCandidateLinkException;
import com.entity.canonical.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Graph store transaction: statements are applied immediately and each registers the
 * statement that undoes it. Rolling back replays the undo statements in reverse order.
 */
class GraphStoreTransaction extends GraphCanonicalStore.GraphReader implements StoreTransaction {
    private static final Logger log = LoggerFactory.getLogger(GraphStoreTransaction.class);

    private final String label;
    private final CompensatingTransaction undo;
    private final Runnable onEnd;
    private boolean active = true;

    GraphStoreTransaction(CanonicalCypherExecutor executor, String label, Runnable onEnd) {
        super(executor);
        this.label = label;
        this.undo = new CompensatingTransaction(label);
        this.onEnd = onEnd;
    }

    @Override
    public void insertCanonicalEntity(CanonicalEntity entity) {
        ensureActive();
        undo.execute("create canonical " + entity.getId(),
                () -> executor.createCanonicalEntity(entity),
                () -> executor.deleteCanonicalEntity(entity.getId()));
    }

    @Override
    public EntityAlias insertAlias(EntityAlias alias) {
        ensureActive();
        String storedId = executor.mergeAlias(alias);
        if (!alias.getId().equals(storedId)) {
            throw new DuplicateAliasException(alias.getCanonicalEntityId(), alias.getAliasNormalized());
        }
        undo.registerCompensation("create alias " + alias.getId(), () -> executor.deleteAlias(alias.getId()));
        return alias;
    }

    @Override
    public void insertMention(EntityMention mention) {
        ensureActive();
        undo.execute("create mention " + mention.getId(),
                () -> executor.createMention(mention),
                () -> executor.deleteMention(mention.getId()));
    }

    @Override
    public void insertCandidateLink(EntityCandidateLink link) {
        ensureActive();
        String storedId = executor.mergeCandidateLink(link);
        if (!link.getId().equals(storedId)) {
            throw new DuplicateCandidateLinkException(link.getMentionId(), link.getCandidateCanonicalEntityId());
        }
        undo.registerCompensation("create link " + link.getId(), () -> executor.deleteCandidateLink(link.getId()));
    }

    @Override
    public int deleteMentionsForDocument(String documentId) {
        ensureActive();
        List<EntityMention> doomed = executor.findMentionsByDocument(documentId);
        for (EntityMention mention : doomed) {
            for (EntityCandidateLink link : executor.findCandidateLinksByMention(mention.getId())) {
                undo.execute("delete link " + link.getId(),
                        () -> executor.deleteCandidateLink(link.getId()),
                        () -> executor.createCandidateLink(link));
            }
            undo.execute("delete mention " + mention.getId(),
                    () -> executor.deleteMention(mention.getId()),
                    () -> executor.createMention(mention));
        }
        return doomed.size();
    }

    @Override
    public void markDocumentResolved(String documentId) {
        ensureActive();
        boolean wasResolved = executor.isDocumentResolved(documentId);
        undo.execute("mark resolved " + documentId,
                () -> executor.markDocumentResolved(documentId),
                () -> {
                    if (!wasResolved) {
                        executor.markDocumentUnresolved(documentId);
                    }
                });
    }

    @Override
    public EntityCandidateLink updateCandidateLinkStatus(String linkId, CandidateLinkStatus status) {
        ensureActive();
        EntityCandidateLink previous = executor.findCandidateLink(linkId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown candidate link: " + linkId));
        EntityCandidateLink updated = previous.withStatus(status);
        undo.execute("update link " + linkId,
                () -> executor.updateCandidateLinkStatus(linkId, status, updated.getUpdatedAt()),
                () -> executor.updateCandidateLinkStatus(linkId, previous.getStatus(), previous.getUpdatedAt()));
        return updated;
    }

    @Override
    public int reassignMentions(String fromCanonicalId, String toCanonicalId) {
        ensureActive();
        List<EntityMention> moving = executor.findMentionsByCanonicalEntity(fromCanonicalId, Integer.MAX_VALUE);
        for (EntityMention mention : moving) {
            undo.execute("reassign mention " + mention.getId(),
                    () -> executor.updateMentionOwner(mention.getId(), toCanonicalId),
                    () -> executor.updateMentionOwner(mention.getId(), fromCanonicalId));
        }
        return moving.size();
    }

    @Override
    public int migrateAliases(String fromCanonicalId, String toCanonicalId) {
        ensureActive();
        Set<String> targetNormalized = new HashSet<>();
        executor.findAliasesOf(toCanonicalId).forEach(a -> targetNormalized.add(a.getAliasNormalized()));
        int moved = 0;
        for (EntityAlias alias : executor.findAliasesOf(fromCanonicalId)) {
            if (targetNormalized.add(alias.getAliasNormalized())) {
                undo.execute("migrate alias " + alias.getId(),
                        () -> executor.updateAliasOwner(alias.getId(), toCanonicalId),
                        () -> executor.updateAliasOwner(alias.getId(), fromCanonicalId));
                moved++;
            }
        }
        return moved;
    }

    @Override
    public void deleteCanonicalEntity(String canonicalEntityId) {
        ensureActive();
        CanonicalEntity entity = executor.findCanonicalEntity(canonicalEntityId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown canonical entity: " + canonicalEntityId));
        if (executor.countMentionsOf(canonicalEntityId) > 0) {
            throw new IllegalStateException("Canonical entity still has mentions: " + canonicalEntityId);
        }
        for (EntityCandidateLink link : executor.findCandidateLinksByCandidate(canonicalEntityId)) {
            undo.execute("delete link " + link.getId(),
                    () -> executor.deleteCandidateLink(link.getId()),
                    () -> executor.createCandidateLink(link));
        }
        for (EntityAlias alias : executor.findAliasesOf(canonicalEntityId)) {
            undo.execute("delete alias " + alias.getId(),
                    () -> executor.deleteAlias(alias.getId()),
                    () -> executor.createAlias(alias));
        }
        undo.execute("delete canonical " + canonicalEntityId,
                () -> executor.deleteCanonicalEntity(canonicalEntityId),
                () -> executor.createCanonicalEntity(entity));
    }

    @Override
    public void commit() {
        ensureActive();
        undo.markSuccess();
        undo.close();
        end();
        log.debug("store.tx.commit label={}", label);
    }

    @Override
    public void rollback() {
        if (!active) {
            return;
        }
        try {
            undo.rollback();
        } finally {
            end();
        }
        log.debug("store.tx.rollback label={}", label);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        rollback();
    }

    private void ensureActive() {
        if (!active) {
            throw new IllegalStateException("Transaction is no longer active: " + label);
        }
    }

    private void end() {
        active = false;
        onEnd.run();
    }
}
