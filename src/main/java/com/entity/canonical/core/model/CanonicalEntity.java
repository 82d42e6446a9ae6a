package com.entity.canonical.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The single record representing one real-world person, location or organization.
 * The entity type is fixed at creation; there is deliberately no setter for it.
 */
public class CanonicalEntity {

    /** Metadata key flagging an ambiguity placeholder. */
    public static final String META_UNRESOLVED = "unresolved";

    /** Metadata key carrying the reason a placeholder was created. */
    public static final String META_REASON = "reason";

    /** Reason recorded on placeholders created for ambiguous mentions. */
    public static final String REASON_AMBIGUOUS_ALIAS_MATCH = "ambiguous_alias_match";

    private final String id;
    private final EntityType type;
    private final String canonicalText;
    private final String canonicalNormalized;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;

    private CanonicalEntity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.canonicalText = builder.canonicalText;
        this.canonicalNormalized = builder.canonicalNormalized;
        this.metadata = builder.metadata != null ? Map.copyOf(builder.metadata) : Map.of();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getCanonicalText() {
        return canonicalText;
    }

    public String getCanonicalNormalized() {
        return canonicalNormalized;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns true for placeholders created when a mention matched several entities.
     */
    public boolean isUnresolved() {
        return Boolean.TRUE.equals(metadata.get(META_UNRESOLVED));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", canonicalText='" + canonicalText + '\'' +
                ", canonicalNormalized='" + canonicalNormalized + '\'' +
                ", metadata=" + metadata +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String canonicalText;
        private String canonicalNormalized;
        private Map<String, Object> metadata;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder canonicalText(String canonicalText) {
            this.canonicalText = canonicalText;
            return this;
        }

        public Builder canonicalNormalized(String canonicalNormalized) {
            this.canonicalNormalized = canonicalNormalized;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Marks the entity as an ambiguity placeholder.
         */
        public Builder unresolved(String reason) {
            this.metadata = Map.of(META_UNRESOLVED, true, META_REASON, reason);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CanonicalEntity build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(canonicalText, "canonicalText is required");
            Objects.requireNonNull(canonicalNormalized, "canonicalNormalized is required");
            return new CanonicalEntity(this);
        }
    }
}
