package com.entity.canonical.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One occurrence of an entity in a document, always linked to a canonical entity.
 */
public class EntityMention {
    private final String id;
    private final String documentId;
    private final String chunkRef;
    private final String canonicalEntityId;
    private final String aliasId;
    private final String mentionText;
    private final String mentionNormalized;
    private final String contextSnippet;
    private final Integer position;
    private final double confidence;
    private final Instant createdAt;

    private EntityMention(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.documentId = builder.documentId;
        this.chunkRef = builder.chunkRef;
        this.canonicalEntityId = builder.canonicalEntityId;
        this.aliasId = builder.aliasId;
        this.mentionText = builder.mentionText;
        this.mentionNormalized = builder.mentionNormalized;
        this.contextSnippet = builder.contextSnippet;
        this.position = builder.position;
        this.confidence = builder.confidence;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getChunkRef() {
        return chunkRef;
    }

    public String getCanonicalEntityId() {
        return canonicalEntityId;
    }

    public String getAliasId() {
        return aliasId;
    }

    public String getMentionText() {
        return mentionText;
    }

    public String getMentionNormalized() {
        return mentionNormalized;
    }

    public String getContextSnippet() {
        return contextSnippet;
    }

    public Integer getPosition() {
        return position;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a copy of this mention pointing at another canonical entity.
     */
    public EntityMention reassignTo(String newCanonicalEntityId) {
        return toBuilder().canonicalEntityId(newCanonicalEntityId).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .documentId(documentId)
                .chunkRef(chunkRef)
                .canonicalEntityId(canonicalEntityId)
                .aliasId(aliasId)
                .mentionText(mentionText)
                .mentionNormalized(mentionNormalized)
                .contextSnippet(contextSnippet)
                .position(position)
                .confidence(confidence)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityMention that = (EntityMention) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "EntityMention{" +
                "id='" + id + '\'' +
                ", documentId='" + documentId + '\'' +
                ", canonicalEntityId='" + canonicalEntityId + '\'' +
                ", mentionText='" + mentionText + '\'' +
                ", position=" + position +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String documentId;
        private String chunkRef;
        private String canonicalEntityId;
        private String aliasId;
        private String mentionText;
        private String mentionNormalized;
        private String contextSnippet;
        private Integer position;
        private double confidence = 1.0;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder chunkRef(String chunkRef) {
            this.chunkRef = chunkRef;
            return this;
        }

        public Builder canonicalEntityId(String canonicalEntityId) {
            this.canonicalEntityId = canonicalEntityId;
            return this;
        }

        public Builder aliasId(String aliasId) {
            this.aliasId = aliasId;
            return this;
        }

        public Builder mentionText(String mentionText) {
            this.mentionText = mentionText;
            return this;
        }

        public Builder mentionNormalized(String mentionNormalized) {
            this.mentionNormalized = mentionNormalized;
            return this;
        }

        public Builder contextSnippet(String contextSnippet) {
            this.contextSnippet = contextSnippet;
            return this;
        }

        public Builder position(Integer position) {
            this.position = position;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public EntityMention build() {
            Objects.requireNonNull(documentId, "documentId is required");
            Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
            Objects.requireNonNull(mentionText, "mentionText is required");
            Objects.requireNonNull(mentionNormalized, "mentionNormalized is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            return new EntityMention(this);
        }
    }
}
