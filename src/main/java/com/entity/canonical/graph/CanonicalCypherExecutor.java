package com.entity.canonical.graph;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.store.CanonicalStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cypher statements for the canonical store and mapping of result rows to model objects.
 *
 * <p>Nodes reference each other by id properties. Timestamps are stored as epoch
 * milliseconds and metadata as a JSON string.</p>
 */
public class CanonicalCypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CanonicalCypherExecutor.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String CANONICAL_FIELDS = """
            c.id AS id, c.entityType AS entityType, c.canonicalText AS canonicalText,
            c.canonicalNormalized AS canonicalNormalized, c.metadata AS metadata,
            c.createdAt AS createdAt, c.updatedAt AS updatedAt
            """;

    private static final String ALIAS_FIELDS = """
            a.id AS id, a.entityType AS entityType, a.canonicalEntityId AS canonicalEntityId,
            a.aliasText AS aliasText, a.aliasNormalized AS aliasNormalized, a.createdAt AS createdAt
            """;

    private static final String MENTION_FIELDS = """
            m.id AS id, m.documentId AS documentId, m.chunkRef AS chunkRef,
            m.canonicalEntityId AS canonicalEntityId, m.aliasId AS aliasId, m.mentionText AS mentionText,
            m.mentionNormalized AS mentionNormalized, m.contextSnippet AS contextSnippet,
            m.position AS position, m.confidence AS confidence, m.createdAt AS createdAt
            """;

    private static final String LINK_FIELDS = """
            l.id AS id, l.mentionId AS mentionId, l.candidateCanonicalEntityId AS candidateCanonicalEntityId,
            l.score AS score, l.reason AS reason, l.status AS status,
            l.createdAt AS createdAt, l.updatedAt AS updatedAt
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public CanonicalCypherExecutor(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public CanonicalCypherExecutor(GraphConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Canonical entities ==========

    public void createCanonicalEntity(CanonicalEntity entity) {
        String query = """
                CREATE (c:CanonicalEntity {
                    id: $id,
                    entityType: $entityType,
                    canonicalText: $canonicalText,
                    canonicalNormalized: $canonicalNormalized,
                    metadata: $metadata,
                    createdAt: $createdAt,
                    updatedAt: $updatedAt
                })
                """;
        connection.execute(query, params(
                "id", entity.getId(),
                "entityType", entity.getType().name(),
                "canonicalText", entity.getCanonicalText(),
                "canonicalNormalized", entity.getCanonicalNormalized(),
                "metadata", writeMetadata(entity.getMetadata()),
                "createdAt", entity.getCreatedAt().toEpochMilli(),
                "updatedAt", entity.getUpdatedAt().toEpochMilli()));
        log.debug("graph.canonical.created id={} type={}", entity.getId(), entity.getType());
    }

    public Optional<CanonicalEntity> findCanonicalEntity(String id) {
        String query = "MATCH (c:CanonicalEntity {id: $id}) RETURN " + CANONICAL_FIELDS;
        return connection.query(query, params("id", id)).stream().findFirst().map(this::toCanonicalEntity);
    }

    public List<CanonicalEntity> findCanonicalEntities(EntityType type, String canonicalNormalized) {
        String query = """
                MATCH (c:CanonicalEntity)
                WHERE c.entityType = $entityType AND c.canonicalNormalized = $canonicalNormalized
                RETURN %s
                ORDER BY c.createdAt
                """.formatted(CANONICAL_FIELDS);
        return connection.query(query, params("entityType", type.name(), "canonicalNormalized", canonicalNormalized))
                .stream().map(this::toCanonicalEntity).collect(Collectors.toList());
    }

    public long countCanonicalEntities() {
        List<Map<String, Object>> rows = connection.query("MATCH (c:CanonicalEntity) RETURN count(c) AS total");
        return rows.isEmpty() ? 0 : asLong(rows.get(0).get("total"));
    }

    public void deleteCanonicalEntity(String id) {
        connection.execute("MATCH (c:CanonicalEntity {id: $id}) DETACH DELETE c", params("id", id));
    }

    // ========== Aliases ==========

    /**
     * Registers an alias unless its canonical entity already owns the normalized text.
     * The MERGE is atomic, so the returned id equals the given alias id only when this call
     * created the node.
     *
     * @return id of the stored alias for the (canonicalEntityId, aliasNormalized) pair
     */
    public String mergeAlias(EntityAlias alias) {
        String query = """
                MERGE (a:EntityAlias {canonicalEntityId: $canonicalEntityId, aliasNormalized: $aliasNormalized})
                ON CREATE SET a.id = $aliasId, a.entityType = $entityType, a.aliasText = $aliasText,
                    a.createdAt = $createdAt
                RETURN a.id AS id
                """;
        List<Map<String, Object>> rows = connection.query(query, params(
                "canonicalEntityId", alias.getCanonicalEntityId(),
                "aliasNormalized", alias.getAliasNormalized(),
                "aliasId", alias.getId(),
                "entityType", alias.getEntityType().name(),
                "aliasText", alias.getAliasText(),
                "createdAt", alias.getCreatedAt().toEpochMilli()));
        if (rows.isEmpty()) {
            throw new CanonicalStoreException("Alias merge returned no row for canonical entity "
                    + alias.getCanonicalEntityId());
        }
        return (String) rows.get(0).get("id");
    }

    public void createAlias(EntityAlias alias) {
        String query = """
                CREATE (a:EntityAlias {
                    id: $aliasId,
                    entityType: $entityType,
                    canonicalEntityId: $canonicalEntityId,
                    aliasText: $aliasText,
                    aliasNormalized: $aliasNormalized,
                    createdAt: $createdAt
                })
                """;
        connection.execute(query, params(
                "aliasId", alias.getId(),
                "entityType", alias.getEntityType().name(),
                "canonicalEntityId", alias.getCanonicalEntityId(),
                "aliasText", alias.getAliasText(),
                "aliasNormalized", alias.getAliasNormalized(),
                "createdAt", alias.getCreatedAt().toEpochMilli()));
    }

    public List<EntityAlias> findAliases(EntityType type, String aliasNormalized, int limit) {
        String query = """
                MATCH (a:EntityAlias)
                WHERE a.entityType = $entityType AND a.aliasNormalized = $aliasNormalized
                RETURN %s
                ORDER BY a.createdAt
                LIMIT $limit
                """.formatted(ALIAS_FIELDS);
        return mapAliases(connection.query(query, params(
                "entityType", type.name(), "aliasNormalized", aliasNormalized, "limit", limit)));
    }

    public List<EntityAlias> findAliasesByNormalized(String aliasNormalized) {
        String query = """
                MATCH (a:EntityAlias)
                WHERE a.aliasNormalized = $aliasNormalized
                RETURN %s
                ORDER BY a.createdAt
                """.formatted(ALIAS_FIELDS);
        return mapAliases(connection.query(query, params("aliasNormalized", aliasNormalized)));
    }

    public Optional<EntityAlias> findAlias(String canonicalEntityId, String aliasNormalized) {
        String query = """
                MATCH (a:EntityAlias {canonicalEntityId: $canonicalEntityId, aliasNormalized: $aliasNormalized})
                RETURN %s
                """.formatted(ALIAS_FIELDS);
        return mapAliases(connection.query(query, params(
                "canonicalEntityId", canonicalEntityId, "aliasNormalized", aliasNormalized)))
                .stream().findFirst();
    }

    public List<EntityAlias> findAliasesOf(String canonicalEntityId) {
        String query = """
                MATCH (a:EntityAlias {canonicalEntityId: $canonicalEntityId})
                RETURN %s
                ORDER BY a.createdAt
                """.formatted(ALIAS_FIELDS);
        return mapAliases(connection.query(query, params("canonicalEntityId", canonicalEntityId)));
    }

    public void updateAliasOwner(String aliasId, String canonicalEntityId) {
        connection.execute("MATCH (a:EntityAlias {id: $aliasId}) SET a.canonicalEntityId = $canonicalEntityId",
                params("aliasId", aliasId, "canonicalEntityId", canonicalEntityId));
    }

    public void deleteAlias(String aliasId) {
        connection.execute("MATCH (a:EntityAlias {id: $aliasId}) DELETE a", params("aliasId", aliasId));
    }

    // ========== Mentions ==========

    public void createMention(EntityMention mention) {
        String query = """
                CREATE (m:EntityMention {
                    id: $id,
                    documentId: $documentId,
                    chunkRef: $chunkRef,
                    canonicalEntityId: $canonicalEntityId,
                    aliasId: $aliasId,
                    mentionText: $mentionText,
                    mentionNormalized: $mentionNormalized,
                    contextSnippet: $contextSnippet,
                    position: $position,
                    confidence: $confidence,
                    createdAt: $createdAt
                })
                """;
        connection.execute(query, params(
                "id", mention.getId(),
                "documentId", mention.getDocumentId(),
                "chunkRef", mention.getChunkRef(),
                "canonicalEntityId", mention.getCanonicalEntityId(),
                "aliasId", mention.getAliasId(),
                "mentionText", mention.getMentionText(),
                "mentionNormalized", mention.getMentionNormalized(),
                "contextSnippet", mention.getContextSnippet(),
                "position", mention.getPosition(),
                "confidence", mention.getConfidence(),
                "createdAt", mention.getCreatedAt().toEpochMilli()));
    }

    public Optional<EntityMention> findMention(String id) {
        String query = "MATCH (m:EntityMention {id: $id}) RETURN " + MENTION_FIELDS;
        return connection.query(query, params("id", id)).stream().findFirst().map(this::toMention);
    }

    public List<EntityMention> findMentionsByCanonicalEntity(String canonicalEntityId, int limit) {
        String query = """
                MATCH (m:EntityMention {canonicalEntityId: $canonicalEntityId})
                RETURN %s
                ORDER BY m.createdAt
                LIMIT $limit
                """.formatted(MENTION_FIELDS);
        return connection.query(query, params("canonicalEntityId", canonicalEntityId, "limit", limit))
                .stream().map(this::toMention).collect(Collectors.toList());
    }

    public List<EntityMention> findMentionsByDocument(String documentId) {
        String query = """
                MATCH (m:EntityMention {documentId: $documentId})
                RETURN %s
                ORDER BY m.createdAt
                """.formatted(MENTION_FIELDS);
        return connection.query(query, params("documentId", documentId))
                .stream().map(this::toMention).collect(Collectors.toList());
    }

    public long countMentionsOf(String canonicalEntityId) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (m:EntityMention {canonicalEntityId: $canonicalEntityId}) RETURN count(m) AS total",
                params("canonicalEntityId", canonicalEntityId));
        return rows.isEmpty() ? 0 : asLong(rows.get(0).get("total"));
    }

    public void updateMentionOwner(String mentionId, String canonicalEntityId) {
        connection.execute("MATCH (m:EntityMention {id: $mentionId}) SET m.canonicalEntityId = $canonicalEntityId",
                params("mentionId", mentionId, "canonicalEntityId", canonicalEntityId));
    }

    public void deleteMention(String mentionId) {
        connection.execute("MATCH (m:EntityMention {id: $mentionId}) DELETE m", params("mentionId", mentionId));
    }

    /**
     * Co-occurrence: documents holding at least one mention of every given entity.
     */
    public List<String> findDocumentsMentioningAll(Collection<String> canonicalEntityIds, int limit) {
        String query = """
                MATCH (m:EntityMention)
                WHERE m.canonicalEntityId IN $canonicalEntityIds
                WITH m.documentId AS documentId, collect(DISTINCT m.canonicalEntityId) AS found
                WHERE size(found) = $required
                RETURN documentId
                ORDER BY documentId
                LIMIT $limit
                """;
        return connection.query(query, params(
                        "canonicalEntityIds", List.copyOf(canonicalEntityIds),
                        "required", canonicalEntityIds.size(),
                        "limit", limit))
                .stream().map(row -> (String) row.get("documentId")).collect(Collectors.toList());
    }

    // ========== Candidate links ==========

    /**
     * Creates a candidate link unless the mention already links to the candidate.
     *
     * @return id of the stored link for the (mentionId, candidateCanonicalEntityId) pair
     */
    public String mergeCandidateLink(EntityCandidateLink link) {
        String query = """
                MERGE (l:EntityCandidateLink {mentionId: $mentionId, candidateCanonicalEntityId: $candidateId})
                ON CREATE SET l.id = $linkId, l.score = $score, l.reason = $reason, l.status = $status,
                    l.createdAt = $createdAt, l.updatedAt = $updatedAt
                RETURN l.id AS id
                """;
        List<Map<String, Object>> rows = connection.query(query, params(
                "mentionId", link.getMentionId(),
                "candidateId", link.getCandidateCanonicalEntityId(),
                "linkId", link.getId(),
                "score", link.getScore(),
                "reason", link.getReason(),
                "status", link.getStatus().name(),
                "createdAt", link.getCreatedAt().toEpochMilli(),
                "updatedAt", link.getUpdatedAt().toEpochMilli()));
        if (rows.isEmpty()) {
            throw new CanonicalStoreException("Candidate link merge returned no row for mention "
                    + link.getMentionId());
        }
        return (String) rows.get(0).get("id");
    }

    public void createCandidateLink(EntityCandidateLink link) {
        String query = """
                CREATE (l:EntityCandidateLink {
                    id: $linkId,
                    mentionId: $mentionId,
                    candidateCanonicalEntityId: $candidateId,
                    score: $score,
                    reason: $reason,
                    status: $status,
                    createdAt: $createdAt,
                    updatedAt: $updatedAt
                })
                """;
        connection.execute(query, params(
                "linkId", link.getId(),
                "mentionId", link.getMentionId(),
                "candidateId", link.getCandidateCanonicalEntityId(),
                "score", link.getScore(),
                "reason", link.getReason(),
                "status", link.getStatus().name(),
                "createdAt", link.getCreatedAt().toEpochMilli(),
                "updatedAt", link.getUpdatedAt().toEpochMilli()));
    }

    public Optional<EntityCandidateLink> findCandidateLink(String id) {
        String query = "MATCH (l:EntityCandidateLink {id: $id}) RETURN " + LINK_FIELDS;
        return connection.query(query, params("id", id)).stream().findFirst().map(this::toCandidateLink);
    }

    public List<EntityCandidateLink> findCandidateLinksByMention(String mentionId) {
        String query = """
                MATCH (l:EntityCandidateLink {mentionId: $mentionId})
                RETURN %s
                ORDER BY l.createdAt
                """.formatted(LINK_FIELDS);
        return mapLinks(connection.query(query, params("mentionId", mentionId)));
    }

    public List<EntityCandidateLink> findCandidateLinksByCandidate(String candidateCanonicalEntityId) {
        String query = """
                MATCH (l:EntityCandidateLink {candidateCanonicalEntityId: $candidateId})
                RETURN %s
                ORDER BY l.createdAt
                """.formatted(LINK_FIELDS);
        return mapLinks(connection.query(query, params("candidateId", candidateCanonicalEntityId)));
    }

    public List<EntityCandidateLink> findCandidateLinksByStatus(CandidateLinkStatus status, int offset, int limit) {
        String query = """
                MATCH (l:EntityCandidateLink {status: $status})
                RETURN %s
                ORDER BY l.createdAt
                SKIP $offset
                LIMIT $limit
                """.formatted(LINK_FIELDS);
        return mapLinks(connection.query(query, params("status", status.name(), "offset", offset, "limit", limit)));
    }

    public long countCandidateLinksByStatus(CandidateLinkStatus status) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (l:EntityCandidateLink {status: $status}) RETURN count(l) AS total",
                params("status", status.name()));
        return rows.isEmpty() ? 0 : asLong(rows.get(0).get("total"));
    }

    public void updateCandidateLinkStatus(String linkId, CandidateLinkStatus status, Instant updatedAt) {
        connection.execute("MATCH (l:EntityCandidateLink {id: $linkId}) SET l.status = $status, l.updatedAt = $updatedAt",
                params("linkId", linkId, "status", status.name(), "updatedAt", updatedAt.toEpochMilli()));
    }

    public void deleteCandidateLink(String linkId) {
        connection.execute("MATCH (l:EntityCandidateLink {id: $linkId}) DELETE l", params("linkId", linkId));
    }

    // ========== Document resolution state ==========

    public void markDocumentResolved(String documentId) {
        connection.execute("MERGE (d:ResolvedDocument {documentId: $documentId}) SET d.resolvedAt = $resolvedAt",
                params("documentId", documentId, "resolvedAt", Instant.now().toEpochMilli()));
    }

    public void markDocumentUnresolved(String documentId) {
        connection.execute("MATCH (d:ResolvedDocument {documentId: $documentId}) DELETE d",
                params("documentId", documentId));
    }

    public boolean isDocumentResolved(String documentId) {
        return !connection.query("MATCH (d:ResolvedDocument {documentId: $documentId}) RETURN d.documentId AS documentId",
                params("documentId", documentId)).isEmpty();
    }

    // ========== Row mapping ==========

    CanonicalEntity toCanonicalEntity(Map<String, Object> row) {
        return CanonicalEntity.builder()
                .id((String) row.get("id"))
                .type(EntityType.valueOf((String) row.get("entityType")))
                .canonicalText((String) row.get("canonicalText"))
                .canonicalNormalized((String) row.get("canonicalNormalized"))
                .metadata(readMetadata((String) row.get("metadata")))
                .createdAt(asInstant(row.get("createdAt")))
                .updatedAt(asInstant(row.get("updatedAt")))
                .build();
    }

    EntityAlias toAlias(Map<String, Object> row) {
        return EntityAlias.builder()
                .id((String) row.get("id"))
                .entityType(EntityType.valueOf((String) row.get("entityType")))
                .canonicalEntityId((String) row.get("canonicalEntityId"))
                .aliasText((String) row.get("aliasText"))
                .aliasNormalized((String) row.get("aliasNormalized"))
                .createdAt(asInstant(row.get("createdAt")))
                .build();
    }

    EntityMention toMention(Map<String, Object> row) {
        Object position = row.get("position");
        Object confidence = row.get("confidence");
        return EntityMention.builder()
                .id((String) row.get("id"))
                .documentId((String) row.get("documentId"))
                .chunkRef((String) row.get("chunkRef"))
                .canonicalEntityId((String) row.get("canonicalEntityId"))
                .aliasId((String) row.get("aliasId"))
                .mentionText((String) row.get("mentionText"))
                .mentionNormalized((String) row.get("mentionNormalized"))
                .contextSnippet((String) row.get("contextSnippet"))
                .position(position instanceof Number n ? n.intValue() : null)
                .confidence(confidence instanceof Number n ? n.doubleValue() : 1.0)
                .createdAt(asInstant(row.get("createdAt")))
                .build();
    }

    EntityCandidateLink toCandidateLink(Map<String, Object> row) {
        Object score = row.get("score");
        return EntityCandidateLink.builder()
                .id((String) row.get("id"))
                .mentionId((String) row.get("mentionId"))
                .candidateCanonicalEntityId((String) row.get("candidateCanonicalEntityId"))
                .score(score instanceof Number n ? n.doubleValue() : 0.0)
                .reason((String) row.get("reason"))
                .status(CandidateLinkStatus.valueOf((String) row.get("status")))
                .createdAt(asInstant(row.get("createdAt")))
                .updatedAt(asInstant(row.get("updatedAt")))
                .build();
    }

    private List<EntityAlias> mapAliases(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toAlias).collect(Collectors.toList());
    }

    private List<EntityCandidateLink> mapLinks(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toCandidateLink).collect(Collectors.toList());
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new CanonicalStoreException("Failed to serialize canonical metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new CanonicalStoreException("Failed to parse canonical metadata: " + json, e);
        }
    }

    private static Instant asInstant(Object value) {
        return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    /**
     * Builds a parameter map that, unlike {@link Map#of}, accepts null values.
     */
    static Map<String, Object> params(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("params requires key/value pairs");
        }
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            params.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return params;
    }
}
