package com.entity.canonical.store;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;

/**
 * A unit of work over the canonical store. Reads through a transaction see its own writes.
 * Closing a transaction that was not committed rolls back every write it made.
 *
 * <pre>
 * try (StoreTransaction tx = store.begin(documentId)) {
 *     tx.insertCanonicalEntity(entity);
 *     tx.insertAlias(alias);
 *     tx.commit();
 * }
 * </pre>
 */
public interface StoreTransaction extends CanonicalStoreReader, AutoCloseable {

    void insertCanonicalEntity(CanonicalEntity entity);

    /**
     * Inserts an alias.
     *
     * @throws DuplicateAliasException if the canonical entity already owns the normalized text
     */
    EntityAlias insertAlias(EntityAlias alias);

    void insertMention(EntityMention mention);

    /**
     * Inserts a candidate link.
     *
     * @throws DuplicateCandidateLinkException if the mention already links to the candidate
     */
    void insertCandidateLink(EntityCandidateLink link);

    /**
     * Deletes every mention of a document together with the candidate links of those mentions.
     *
     * @return the number of mentions deleted
     */
    int deleteMentionsForDocument(String documentId);

    void markDocumentResolved(String documentId);

    /**
     * @throws IllegalArgumentException if the link does not exist
     */
    EntityCandidateLink updateCandidateLinkStatus(String linkId, CandidateLinkStatus status);

    /**
     * Points every mention of {@code fromCanonicalId} at {@code toCanonicalId}.
     *
     * @return the number of mentions moved
     */
    int reassignMentions(String fromCanonicalId, String toCanonicalId);

    /**
     * Moves the aliases of {@code fromCanonicalId} whose normalized text the target does not
     * own yet. Aliases the target already has stay with the source.
     *
     * @return the number of aliases moved
     */
    int migrateAliases(String fromCanonicalId, String toCanonicalId);

    /**
     * Deletes a canonical entity with its remaining aliases and the candidate links pointing at it.
     *
     * @throws IllegalStateException if mentions still reference the entity
     */
    void deleteCanonicalEntity(String canonicalEntityId);

    void commit();

    void rollback();

    boolean isActive();

    @Override
    void close();
}
