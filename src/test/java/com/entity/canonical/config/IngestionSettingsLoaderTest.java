package com.entity.canonical.config;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IngestionSettingsLoaderTest {

    private static Config configOf(Map<String, Object> values) {
        Config config = mock(Config.class);
        when(config.getOptionalValue(anyString(), any())).thenAnswer(invocation ->
                Optional.ofNullable(values.get(invocation.<String>getArgument(0))));
        return config;
    }

    @Test
    @DisplayName("Should fall back to defaults for missing keys")
    void testDefaults() {
        IngestionSettings settings = IngestionSettingsLoader.load(configOf(Map.of()));

        assertEquals(IngestionSettings.DEFAULT_MAX_CANDIDATES_PER_MECHANISM, settings.getMaxCandidatesPerMechanism());
        assertEquals(IngestionSettings.DEFAULT_EXTRACTION_INITIAL_BACKOFF, settings.getExtractionInitialBackoff());
        assertEquals(Duration.ZERO, settings.getExtractionDelay());
        assertTrue(settings.isNormalizationCacheEnabled());
        assertEquals(30_000, settings.getLockConfig().timeoutMs());
    }

    @Test
    @DisplayName("Should read overridden keys under the canonicalization prefix")
    void testOverrides() {
        IngestionSettings settings = IngestionSettingsLoader.load(configOf(Map.of(
                "canonicalization.matching.fingerprint-min-token-length", 5,
                "canonicalization.ingestion.parallelism", 4,
                "canonicalization.extraction.initial-backoff-ms", 50L,
                "canonicalization.cache.enabled", false,
                "canonicalization.lock.ttl-seconds", 30,
                "canonicalization.audit.max-entries", 500)));

        assertEquals(5, settings.getFingerprintMinTokenLength());
        assertEquals(4, settings.getParallelism());
        assertEquals(Duration.ofMillis(50), settings.getExtractionInitialBackoff());
        assertFalse(settings.isNormalizationCacheEnabled());
        assertEquals(30, settings.getLockConfig().lockTtlSeconds());
        assertEquals(500, settings.getAuditMaxEntries());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testInvalidValue() {
        Config config = configOf(Map.of("canonicalization.ingestion.parallelism", 0));

        assertThrows(IllegalArgumentException.class, () -> IngestionSettingsLoader.load(config));
    }

    @Test
    @DisplayName("Should read graph settings")
    void testGraphSettings() {
        GraphSettings graph = IngestionSettingsLoader.loadGraphSettings(configOf(Map.of(
                "canonicalization.falkordb.host", "falkordb.internal",
                "canonicalization.falkordb.port", 6380)));

        assertEquals("falkordb.internal", graph.host());
        assertEquals(6380, graph.port());
        assertEquals(GraphSettings.defaults().graphName(), graph.graphName());
    }

    @Test
    @DisplayName("Should load the bundled configuration file")
    void testBundledConfiguration() {
        IngestionSettings settings = IngestionSettingsLoader.load();

        assertEquals(IngestionSettings.DEFAULT_MIN_DOCUMENT_TEXT_LENGTH, settings.getMinDocumentTextLength());
        assertEquals(IngestionSettings.DEFAULT_MAX_CHUNK_CHARS, settings.getMaxChunkChars());
    }
}
