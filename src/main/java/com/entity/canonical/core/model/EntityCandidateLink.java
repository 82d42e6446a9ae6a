package com.entity.canonical.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Records that an ambiguous mention might belong to an existing canonical entity.
 * Links are created {@link CandidateLinkStatus#PENDING} and only change status through review.
 */
public class EntityCandidateLink {
    private final String id;
    private final String mentionId;
    private final String candidateCanonicalEntityId;
    private final double score;
    private final String reason;
    private final CandidateLinkStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private EntityCandidateLink(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.mentionId = builder.mentionId;
        this.candidateCanonicalEntityId = builder.candidateCanonicalEntityId;
        this.score = builder.score;
        this.reason = builder.reason;
        this.status = builder.status;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getMentionId() {
        return mentionId;
    }

    public String getCandidateCanonicalEntityId() {
        return candidateCanonicalEntityId;
    }

    public double getScore() {
        return score;
    }

    public String getReason() {
        return reason;
    }

    public CandidateLinkStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isPending() {
        return status == CandidateLinkStatus.PENDING;
    }

    /**
     * Returns a copy of this link with a new status and a fresh update timestamp.
     */
    public EntityCandidateLink withStatus(CandidateLinkStatus newStatus) {
        return builder()
                .id(id)
                .mentionId(mentionId)
                .candidateCanonicalEntityId(candidateCanonicalEntityId)
                .score(score)
                .reason(reason)
                .status(newStatus)
                .createdAt(createdAt)
                .updatedAt(Instant.now())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityCandidateLink that = (EntityCandidateLink) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "EntityCandidateLink{" +
                "id='" + id + '\'' +
                ", mentionId='" + mentionId + '\'' +
                ", candidateCanonicalEntityId='" + candidateCanonicalEntityId + '\'' +
                ", score=" + score +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String mentionId;
        private String candidateCanonicalEntityId;
        private double score;
        private String reason;
        private CandidateLinkStatus status = CandidateLinkStatus.PENDING;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder mentionId(String mentionId) {
            this.mentionId = mentionId;
            return this;
        }

        public Builder candidateCanonicalEntityId(String candidateCanonicalEntityId) {
            this.candidateCanonicalEntityId = candidateCanonicalEntityId;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder status(CandidateLinkStatus status) {
            this.status = status;
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

        public EntityCandidateLink build() {
            Objects.requireNonNull(mentionId, "mentionId is required");
            Objects.requireNonNull(candidateCanonicalEntityId, "candidateCanonicalEntityId is required");
            Objects.requireNonNull(status, "status is required");
            if (score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException("score must be between 0.0 and 1.0");
            }
            return new EntityCandidateLink(this);
        }
    }
}
