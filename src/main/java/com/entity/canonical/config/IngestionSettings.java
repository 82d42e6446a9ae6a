package com.entity.canonical.config;

import com.entity.canonical.lock.LockConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the canonicalization engine and the document ingestion runner.
 * Instances are immutable; use {@link #builder()} or {@link IngestionSettingsLoader}.
 */
public class IngestionSettings {

    public static final int DEFAULT_MAX_CANDIDATES_PER_MECHANISM = 20;
    public static final int DEFAULT_FINGERPRINT_MIN_TOKEN_LENGTH = 4;
    public static final int DEFAULT_CONFLICT_RETRIES = 1;
    public static final int DEFAULT_MAX_MENTION_LENGTH = 1000;
    public static final int DEFAULT_MIN_DOCUMENT_TEXT_LENGTH = 50;
    public static final int DEFAULT_MAX_CHUNK_CHARS = 100_000;
    public static final int DEFAULT_EXTRACTION_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_EXTRACTION_INITIAL_BACKOFF = Duration.ofMillis(400);
    public static final int DEFAULT_CONTEXT_WINDOW_CHARS = 100;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final int DEFAULT_NORMALIZATION_CACHE_SIZE = 10_000;
    public static final int DEFAULT_AUDIT_MAX_ENTRIES = 10_000;

    private final int maxCandidatesPerMechanism;
    private final int fingerprintMinTokenLength;
    private final int conflictRetries;
    private final int maxMentionLength;
    private final int minDocumentTextLength;
    private final int maxChunkChars;
    private final int extractionMaxAttempts;
    private final Duration extractionInitialBackoff;
    private final Duration extractionDelay;
    private final int contextWindowChars;
    private final int parallelism;
    private final boolean normalizationCacheEnabled;
    private final int normalizationCacheSize;
    private final int auditMaxEntries;
    private final LockConfig lockConfig;

    private IngestionSettings(Builder builder) {
        this.maxCandidatesPerMechanism = builder.maxCandidatesPerMechanism;
        this.fingerprintMinTokenLength = builder.fingerprintMinTokenLength;
        this.conflictRetries = builder.conflictRetries;
        this.maxMentionLength = builder.maxMentionLength;
        this.minDocumentTextLength = builder.minDocumentTextLength;
        this.maxChunkChars = builder.maxChunkChars;
        this.extractionMaxAttempts = builder.extractionMaxAttempts;
        this.extractionInitialBackoff = builder.extractionInitialBackoff;
        this.extractionDelay = builder.extractionDelay;
        this.contextWindowChars = builder.contextWindowChars;
        this.parallelism = builder.parallelism;
        this.normalizationCacheEnabled = builder.normalizationCacheEnabled;
        this.normalizationCacheSize = builder.normalizationCacheSize;
        this.auditMaxEntries = builder.auditMaxEntries;
        this.lockConfig = builder.lockConfig;
    }

    public static IngestionSettings defaults() {
        return builder().build();
    }

    public int getMaxCandidatesPerMechanism() {
        return maxCandidatesPerMechanism;
    }

    public int getFingerprintMinTokenLength() {
        return fingerprintMinTokenLength;
    }

    public int getConflictRetries() {
        return conflictRetries;
    }

    public int getMaxMentionLength() {
        return maxMentionLength;
    }

    public int getMinDocumentTextLength() {
        return minDocumentTextLength;
    }

    public int getMaxChunkChars() {
        return maxChunkChars;
    }

    public int getExtractionMaxAttempts() {
        return extractionMaxAttempts;
    }

    public Duration getExtractionInitialBackoff() {
        return extractionInitialBackoff;
    }

    /**
     * Pause between consecutive extractor calls, for rate-limited extractors.
     */
    public Duration getExtractionDelay() {
        return extractionDelay;
    }

    public int getContextWindowChars() {
        return contextWindowChars;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isNormalizationCacheEnabled() {
        return normalizationCacheEnabled;
    }

    public int getNormalizationCacheSize() {
        return normalizationCacheSize;
    }

    /**
     * Capacity of the in-memory audit trail; older entries are evicted beyond it.
     */
    public int getAuditMaxEntries() {
        return auditMaxEntries;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    public Builder toBuilder() {
        return builder()
                .maxCandidatesPerMechanism(maxCandidatesPerMechanism)
                .fingerprintMinTokenLength(fingerprintMinTokenLength)
                .conflictRetries(conflictRetries)
                .maxMentionLength(maxMentionLength)
                .minDocumentTextLength(minDocumentTextLength)
                .maxChunkChars(maxChunkChars)
                .extractionMaxAttempts(extractionMaxAttempts)
                .extractionInitialBackoff(extractionInitialBackoff)
                .extractionDelay(extractionDelay)
                .contextWindowChars(contextWindowChars)
                .parallelism(parallelism)
                .normalizationCacheEnabled(normalizationCacheEnabled)
                .normalizationCacheSize(normalizationCacheSize)
                .auditMaxEntries(auditMaxEntries)
                .lockConfig(lockConfig);
    }

    @Override
    public String toString() {
        return "IngestionSettings{" +
                "maxCandidatesPerMechanism=" + maxCandidatesPerMechanism +
                ", fingerprintMinTokenLength=" + fingerprintMinTokenLength +
                ", conflictRetries=" + conflictRetries +
                ", minDocumentTextLength=" + minDocumentTextLength +
                ", maxChunkChars=" + maxChunkChars +
                ", extractionMaxAttempts=" + extractionMaxAttempts +
                ", extractionInitialBackoff=" + extractionInitialBackoff +
                ", extractionDelay=" + extractionDelay +
                ", parallelism=" + parallelism +
                ", auditMaxEntries=" + auditMaxEntries +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxCandidatesPerMechanism = DEFAULT_MAX_CANDIDATES_PER_MECHANISM;
        private int fingerprintMinTokenLength = DEFAULT_FINGERPRINT_MIN_TOKEN_LENGTH;
        private int conflictRetries = DEFAULT_CONFLICT_RETRIES;
        private int maxMentionLength = DEFAULT_MAX_MENTION_LENGTH;
        private int minDocumentTextLength = DEFAULT_MIN_DOCUMENT_TEXT_LENGTH;
        private int maxChunkChars = DEFAULT_MAX_CHUNK_CHARS;
        private int extractionMaxAttempts = DEFAULT_EXTRACTION_MAX_ATTEMPTS;
        private Duration extractionInitialBackoff = DEFAULT_EXTRACTION_INITIAL_BACKOFF;
        private Duration extractionDelay = Duration.ZERO;
        private int contextWindowChars = DEFAULT_CONTEXT_WINDOW_CHARS;
        private int parallelism = DEFAULT_PARALLELISM;
        private boolean normalizationCacheEnabled = true;
        private int normalizationCacheSize = DEFAULT_NORMALIZATION_CACHE_SIZE;
        private int auditMaxEntries = DEFAULT_AUDIT_MAX_ENTRIES;
        private LockConfig lockConfig = LockConfig.defaults();

        public Builder maxCandidatesPerMechanism(int value) {
            this.maxCandidatesPerMechanism = value;
            return this;
        }

        public Builder fingerprintMinTokenLength(int value) {
            this.fingerprintMinTokenLength = value;
            return this;
        }

        public Builder conflictRetries(int value) {
            this.conflictRetries = value;
            return this;
        }

        public Builder maxMentionLength(int value) {
            this.maxMentionLength = value;
            return this;
        }

        public Builder minDocumentTextLength(int value) {
            this.minDocumentTextLength = value;
            return this;
        }

        public Builder maxChunkChars(int value) {
            this.maxChunkChars = value;
            return this;
        }

        public Builder extractionMaxAttempts(int value) {
            this.extractionMaxAttempts = value;
            return this;
        }

        public Builder extractionInitialBackoff(Duration value) {
            this.extractionInitialBackoff = value;
            return this;
        }

        public Builder extractionDelay(Duration value) {
            this.extractionDelay = value;
            return this;
        }

        public Builder contextWindowChars(int value) {
            this.contextWindowChars = value;
            return this;
        }

        public Builder parallelism(int value) {
            this.parallelism = value;
            return this;
        }

        public Builder normalizationCacheEnabled(boolean value) {
            this.normalizationCacheEnabled = value;
            return this;
        }

        public Builder normalizationCacheSize(int value) {
            this.normalizationCacheSize = value;
            return this;
        }

        public Builder auditMaxEntries(int value) {
            this.auditMaxEntries = value;
            return this;
        }

        public Builder lockConfig(LockConfig value) {
            this.lockConfig = value;
            return this;
        }

        public IngestionSettings build() {
            requirePositive(maxCandidatesPerMechanism, "maxCandidatesPerMechanism");
            requirePositive(fingerprintMinTokenLength, "fingerprintMinTokenLength");
            if (conflictRetries < 0) {
                throw new IllegalArgumentException("conflictRetries must be >= 0");
            }
            requirePositive(maxMentionLength, "maxMentionLength");
            if (minDocumentTextLength < 0) {
                throw new IllegalArgumentException("minDocumentTextLength must be >= 0");
            }
            requirePositive(maxChunkChars, "maxChunkChars");
            requirePositive(extractionMaxAttempts, "extractionMaxAttempts");
            Objects.requireNonNull(extractionInitialBackoff, "extractionInitialBackoff is required");
            Objects.requireNonNull(extractionDelay, "extractionDelay is required");
            if (extractionInitialBackoff.isNegative() || extractionDelay.isNegative()) {
                throw new IllegalArgumentException("durations must not be negative");
            }
            if (contextWindowChars < 0) {
                throw new IllegalArgumentException("contextWindowChars must be >= 0");
            }
            requirePositive(parallelism, "parallelism");
            requirePositive(normalizationCacheSize, "normalizationCacheSize");
            requirePositive(auditMaxEntries, "auditMaxEntries");
            Objects.requireNonNull(lockConfig, "lockConfig is required");
            return new IngestionSettings(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }
    }
}
