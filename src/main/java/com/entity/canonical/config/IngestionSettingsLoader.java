package com.entity.canonical.config;

import com.entity.canonical.lock.LockConfig;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reads {@link IngestionSettings} and {@link GraphSettings} from MicroProfile Config.
 * Keys live under {@code canonicalization.}; missing keys fall back to the builder defaults.
 */
public final class IngestionSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(IngestionSettingsLoader.class);

    public static final String PREFIX = "canonicalization.";

    private IngestionSettingsLoader() {
    }

    /**
     * Loads settings from the config of the current class loader.
     */
    public static IngestionSettings load() {
        return load(ConfigProvider.getConfig());
    }

    public static IngestionSettings load(Config config) {
        IngestionSettings defaults = IngestionSettings.defaults();
        LockConfig defaultLock = defaults.getLockConfig();
        IngestionSettings settings = IngestionSettings.builder()
                .maxCandidatesPerMechanism(intValue(config, "matching.max-candidates-per-mechanism",
                        defaults.getMaxCandidatesPerMechanism()))
                .fingerprintMinTokenLength(intValue(config, "matching.fingerprint-min-token-length",
                        defaults.getFingerprintMinTokenLength()))
                .conflictRetries(intValue(config, "resolution.conflict-retries", defaults.getConflictRetries()))
                .maxMentionLength(intValue(config, "resolution.max-mention-length", defaults.getMaxMentionLength()))
                .minDocumentTextLength(intValue(config, "ingestion.min-document-text-length",
                        defaults.getMinDocumentTextLength()))
                .maxChunkChars(intValue(config, "ingestion.max-chunk-chars", defaults.getMaxChunkChars()))
                .extractionMaxAttempts(intValue(config, "extraction.max-attempts",
                        defaults.getExtractionMaxAttempts()))
                .extractionInitialBackoff(Duration.ofMillis(longValue(config, "extraction.initial-backoff-ms",
                        defaults.getExtractionInitialBackoff().toMillis())))
                .extractionDelay(Duration.ofMillis(longValue(config, "extraction.delay-ms",
                        defaults.getExtractionDelay().toMillis())))
                .contextWindowChars(intValue(config, "ingestion.context-window-chars",
                        defaults.getContextWindowChars()))
                .parallelism(intValue(config, "ingestion.parallelism", defaults.getParallelism()))
                .normalizationCacheEnabled(config.getOptionalValue(PREFIX + "cache.enabled", Boolean.class)
                        .orElse(defaults.isNormalizationCacheEnabled()))
                .normalizationCacheSize(intValue(config, "cache.max-size", defaults.getNormalizationCacheSize()))
                .auditMaxEntries(intValue(config, "audit.max-entries", defaults.getAuditMaxEntries()))
                .lockConfig(new LockConfig(
                        longValue(config, "lock.timeout-ms", defaultLock.timeoutMs()),
                        intValue(config, "lock.max-retries", defaultLock.maxRetries()),
                        longValue(config, "lock.retry-delay-ms", defaultLock.retryDelayMs()),
                        intValue(config, "lock.ttl-seconds", defaultLock.lockTtlSeconds())))
                .build();
        log.info("config.loaded settings={}", settings);
        return settings;
    }

    public static GraphSettings loadGraphSettings(Config config) {
        GraphSettings defaults = GraphSettings.defaults();
        return new GraphSettings(
                config.getOptionalValue(PREFIX + "falkordb.host", String.class).orElse(defaults.host()),
                intValue(config, "falkordb.port", defaults.port()),
                config.getOptionalValue(PREFIX + "falkordb.graph-name", String.class).orElse(defaults.graphName()));
    }

    private static int intValue(Config config, String key, int defaultValue) {
        return config.getOptionalValue(PREFIX + key, Integer.class).orElse(defaultValue);
    }

    private static long longValue(Config config, String key, long defaultValue) {
        return config.getOptionalValue(PREFIX + key, Long.class).orElse(defaultValue);
    }
}
