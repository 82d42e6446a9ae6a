package com.entity.canonical.store;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to canonical entities, aliases, mentions and candidate links.
 * Results are returned in store insertion order unless stated otherwise.
 */
public interface CanonicalStoreReader {

    Optional<CanonicalEntity> findCanonicalEntity(String id);

    /**
     * Finds canonical entities of a type by canonical normalized text.
     */
    List<CanonicalEntity> findCanonicalEntities(EntityType type, String canonicalNormalized);

    long countCanonicalEntities();

    /**
     * Finds aliases of a type with the given normalized text, at most {@code limit} rows.
     */
    List<EntityAlias> findAliases(EntityType type, String aliasNormalized, int limit);

    /**
     * Finds aliases of any type with the given normalized text.
     */
    List<EntityAlias> findAliasesByNormalized(String aliasNormalized);

    Optional<EntityAlias> findAlias(String canonicalEntityId, String aliasNormalized);

    List<EntityAlias> findAliasesOf(String canonicalEntityId);

    Optional<EntityMention> findMention(String id);

    List<EntityMention> findMentionsByCanonicalEntity(String canonicalEntityId, int limit);

    List<EntityMention> findMentionsByDocument(String documentId);

    /**
     * Returns ids of documents that mention every given canonical entity at least once.
     */
    List<String> findDocumentsMentioningAll(Collection<String> canonicalEntityIds, int limit);

    Optional<EntityCandidateLink> findCandidateLink(String id);

    List<EntityCandidateLink> findCandidateLinksByMention(String mentionId);

    List<EntityCandidateLink> findCandidateLinksByStatus(CandidateLinkStatus status, int offset, int limit);

    long countCandidateLinksByStatus(CandidateLinkStatus status);

    boolean isDocumentResolved(String documentId);
}
