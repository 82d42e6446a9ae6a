package com.entity.canonical.query;

import com.entity.canonical.api.Page;
import com.entity.canonical.api.PageRequest;
import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.CanonicalStoreReader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only questions over the canonical layer: which entity a name refers to, where an
 * entity is mentioned, and which documents mention several entities together.
 */
public class EntityQueryService {

    public static final int DEFAULT_MENTION_LIMIT = 100;
    public static final int DEFAULT_DOCUMENT_LIMIT = 200;

    private final CanonicalStoreReader reader;
    private final MentionNormalizer normalizer;

    public EntityQueryService(CanonicalStoreReader reader, MentionNormalizer normalizer) {
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    public Optional<CanonicalEntity> findEntity(String canonicalEntityId) {
        Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
        return reader.findCanonicalEntity(canonicalEntityId);
    }

    public List<CanonicalEntity> findEntities(EntityType type, String normalizedText) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(normalizedText, "normalizedText is required");
        return reader.findCanonicalEntities(type, normalizedText);
    }

    /**
     * Normalizes a free-text query and returns the canonical entities owning an alias with
     * that normalized text.
     *
     * @param text the query text
     * @param type optional type filter, {@code null} for every type
     */
    public List<CanonicalEntity> resolveQuery(String text, EntityType type) {
        String normalized = normalizer.normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (EntityAlias alias : reader.findAliasesByNormalized(normalized)) {
            if (type == null || alias.getEntityType() == type) {
                ids.add(alias.getCanonicalEntityId());
            }
        }
        List<CanonicalEntity> entities = new ArrayList<>(ids.size());
        for (String id : ids) {
            reader.findCanonicalEntity(id).ifPresent(entities::add);
        }
        return entities;
    }

    public List<EntityAlias> aliasesOf(String canonicalEntityId) {
        Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
        return reader.findAliasesOf(canonicalEntityId);
    }

    public List<EntityMention> mentionsOf(String canonicalEntityId) {
        return mentionsOf(canonicalEntityId, DEFAULT_MENTION_LIMIT);
    }

    public List<EntityMention> mentionsOf(String canonicalEntityId, int limit) {
        Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
        requirePositive(limit);
        return reader.findMentionsByCanonicalEntity(canonicalEntityId, limit);
    }

    public List<EntityMention> mentionsInDocument(String documentId) {
        Objects.requireNonNull(documentId, "documentId is required");
        return reader.findMentionsByDocument(documentId);
    }

    /**
     * Entities mentioned in a document with their mention counts, most mentioned first.
     */
    public List<DocumentEntitySummary> documentSummary(String documentId) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (EntityMention mention : mentionsInDocument(documentId)) {
            counts.merge(mention.getCanonicalEntityId(), 1, Integer::sum);
        }
        List<DocumentEntitySummary> summary = new ArrayList<>(counts.size());
        counts.forEach((id, count) -> reader.findCanonicalEntity(id)
                .ifPresent(entity -> summary.add(new DocumentEntitySummary(entity, count))));
        summary.sort(Comparator.comparingInt(DocumentEntitySummary::mentionCount).reversed());
        return summary;
    }

    public List<String> documentsMentioningAll(List<String> canonicalEntityIds) {
        return documentsMentioningAll(canonicalEntityIds, DEFAULT_DOCUMENT_LIMIT);
    }

    /**
     * Ids of documents with at least one mention of every given entity.
     *
     * @throws IllegalArgumentException if fewer than two distinct ids are given
     */
    public List<String> documentsMentioningAll(List<String> canonicalEntityIds, int limit) {
        Objects.requireNonNull(canonicalEntityIds, "canonicalEntityIds is required");
        requirePositive(limit);
        Set<String> distinct = new LinkedHashSet<>(canonicalEntityIds);
        distinct.remove(null);
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("At least two distinct canonical entity ids are required");
        }
        return reader.findDocumentsMentioningAll(distinct, limit);
    }

    public Page<EntityCandidateLink> pendingCandidateLinks(PageRequest request) {
        Objects.requireNonNull(request, "request is required");
        long total = reader.countCandidateLinksByStatus(CandidateLinkStatus.PENDING);
        if (total == 0) {
            return Page.empty(request);
        }
        List<EntityCandidateLink> links = reader.findCandidateLinksByStatus(
                CandidateLinkStatus.PENDING, request.offset(), request.limit());
        return Page.of(links, total, request);
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }
}
