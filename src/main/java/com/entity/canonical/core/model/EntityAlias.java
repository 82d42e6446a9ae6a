package com.entity.canonical.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A known surface form that resolves to a canonical entity.
 * A canonical entity never holds the same normalized alias twice, but one normalized
 * alias may belong to several canonical entities.
 */
public class EntityAlias {
    private final String id;
    private final EntityType entityType;
    private final String canonicalEntityId;
    private final String aliasText;
    private final String aliasNormalized;
    private final Instant createdAt;

    private EntityAlias(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.entityType = builder.entityType;
        this.canonicalEntityId = builder.canonicalEntityId;
        this.aliasText = builder.aliasText;
        this.aliasNormalized = builder.aliasNormalized;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getCanonicalEntityId() {
        return canonicalEntityId;
    }

    public String getAliasText() {
        return aliasText;
    }

    public String getAliasNormalized() {
        return aliasNormalized;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a copy of this alias owned by another canonical entity.
     */
    public EntityAlias reassignTo(String newCanonicalEntityId) {
        return builder()
                .id(id)
                .entityType(entityType)
                .canonicalEntityId(newCanonicalEntityId)
                .aliasText(aliasText)
                .aliasNormalized(aliasNormalized)
                .createdAt(createdAt)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityAlias alias = (EntityAlias) o;
        return Objects.equals(id, alias.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "EntityAlias{" +
                "id='" + id + '\'' +
                ", entityType=" + entityType +
                ", canonicalEntityId='" + canonicalEntityId + '\'' +
                ", aliasText='" + aliasText + '\'' +
                ", aliasNormalized='" + aliasNormalized + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityType entityType;
        private String canonicalEntityId;
        private String aliasText;
        private String aliasNormalized;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder canonicalEntityId(String canonicalEntityId) {
            this.canonicalEntityId = canonicalEntityId;
            return this;
        }

        public Builder aliasText(String aliasText) {
            this.aliasText = aliasText;
            return this;
        }

        public Builder aliasNormalized(String aliasNormalized) {
            this.aliasNormalized = aliasNormalized;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public EntityAlias build() {
            Objects.requireNonNull(entityType, "entityType is required");
            Objects.requireNonNull(canonicalEntityId, "canonicalEntityId is required");
            Objects.requireNonNull(aliasText, "aliasText is required");
            Objects.requireNonNull(aliasNormalized, "aliasNormalized is required");
            return new EntityAlias(this);
        }
    }
}
