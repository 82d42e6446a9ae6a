package com.entity.canonical.rules;

import com.entity.canonical.cache.CacheConfig;
import com.entity.canonical.cache.NormalizationCache;
import com.entity.canonical.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MentionNormalizerTest {

    private final MentionNormalizer normalizer = new MentionNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @ParameterizedTest
        @CsvSource({
                "'Jeffrey Epstein', 'jeffrey epstein'",
                "'  JEFFREY   EPSTEIN ', 'jeffrey epstein'",
                "'Mr. Epstein', 'epstein'",
                "'mr epstein', 'epstein'",
                "'Dr. Jane Goodall', 'jane goodall'",
                "'Prof Stephen Hawking', 'stephen hawking'",
                "'Judge Judy', 'judy'",
                "'O''Brien', 'o brien'",
                "'AT&T Inc.', 'at t inc'",
                "'New-York', 'new york'",
                "'Paris', 'paris'",
                "'Mrsmith', 'mrsmith'",
                "'Meeting with Mr. Smith and Dr. Jones', 'meeting with smith and jones'"
        })
        @DisplayName("Should canonicalize surface forms")
        void testNormalize(String input, String expected) {
            assertEquals(expected, normalizer.normalize(input));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t\n"})
        @DisplayName("Should return empty string for blank input")
        void testBlank(String input) {
            assertEquals("", normalizer.normalize(input));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Mr.\u00A0Epstein", "Mr\u00A0\u00A0Epstein", "Mr.\u2009Epstein", "Mr.\u3000Epstein"})
        @DisplayName("Should strip an honorific followed by a Unicode space")
        void testUnicodeSpaceAfterHonorific(String input) {
            assertEquals("epstein", normalizer.normalize(input));
        }

        @Test
        @DisplayName("Should collapse Unicode spaces between tokens")
        void testUnicodeSpaceBetweenTokens() {
            assertEquals("jeffrey epstein", normalizer.normalize("Jeffrey\u00A0\u202FEpstein\u00A0"));
            assertEquals("", normalizer.normalize("\u00A0\u00A0"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"!!!", "...", "Mr. ---"})
        @DisplayName("Should normalize punctuation-only text to empty")
        void testPunctuationOnly(String input) {
            assertEquals("", normalizer.normalize(input));
        }

        @Test
        @DisplayName("Should not strip an honorific without following whitespace")
        void testTrailingHonorific() {
            assertEquals("epstein mr", normalizer.normalize("Epstein Mr"));
        }

        @Test
        @DisplayName("Should be idempotent")
        void testIdempotent() {
            String once = normalizer.normalize("Mr. Jeffrey E. Epstein, Jr.");
            assertEquals(once, normalizer.normalize(once));
        }

        @Test
        @DisplayName("Should produce the same result with a Caffeine cache")
        void testCached() {
            NormalizationCache cache = CacheConfig.defaults().createCache();
            MentionNormalizer cached = new MentionNormalizer(DefaultNormalizationRules.getDefaultRules(),
                    new LastTokenFingerprintStrategy(), cache);

            assertEquals("epstein", cached.normalize("Mr. Epstein"));
            assertEquals("epstein", cached.normalize("Mr. Epstein"));
            assertEquals(1, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Should apply rules in priority order")
        void testRulePriority() {
            NormalizationRule late = NormalizationRule.builder()
                    .name("drop-inc").pattern("\\binc\\b").replacement("").priority(50).build();
            List<NormalizationRule> rules = new java.util.ArrayList<>(DefaultNormalizationRules.getDefaultRules());
            rules.add(0, late);
            MentionNormalizer custom = new MentionNormalizer(rules, new LastTokenFingerprintStrategy(),
                    CacheConfig.disabled().createCache());

            assertEquals("acme", custom.normalize("Acme, Inc."));
            assertEquals("drop-inc", custom.getRules().get(2).getName());
        }
    }

    @Nested
    @DisplayName("fingerprints")
    class Fingerprints {

        @Test
        @DisplayName("Should add the last token for people")
        void testPersonLastToken() {
            assertEquals(List.of("jeffrey epstein", "epstein"),
                    List.copyOf(normalizer.fingerprints(EntityType.PERSON, "Jeffrey Epstein")));
        }

        @Test
        @DisplayName("Should add the last token for organizations")
        void testOrganizationLastToken() {
            assertEquals(Set.of("bank of america", "america"),
                    normalizer.fingerprints(EntityType.ORGANIZATION, "Bank of America"));
        }

        @Test
        @DisplayName("Should never fingerprint locations")
        void testLocation() {
            assertEquals(Set.of("new york city"), normalizer.fingerprints(EntityType.LOCATION, "New York City"));
        }

        @Test
        @DisplayName("Should skip last tokens shorter than four characters")
        void testShortToken() {
            assertEquals(Set.of("john doe"), normalizer.fingerprints(EntityType.PERSON, "John Doe"));
        }

        @Test
        @DisplayName("Should not duplicate a single-token name")
        void testSingleToken() {
            assertEquals(Set.of("jeffrey"), normalizer.fingerprints(EntityType.PERSON, "jeffrey"));
        }

        @Test
        @DisplayName("Should return empty set when text normalizes to nothing")
        void testEmpty() {
            assertTrue(normalizer.fingerprints(EntityType.PERSON, "Mr. ").isEmpty());
        }
    }

    @Nested
    @DisplayName("LastTokenFingerprintStrategy")
    class LastTokenStrategy {

        @ParameterizedTest
        @CsvSource({
                "3, 'john doe', 'doe'",
                "4, 'bill gates', 'gates'",
                "6, 'bill gates', ''"
        })
        @DisplayName("Should honor the configured minimum token length")
        void testMinLength(int minLength, String normalized, String expected) {
            Set<String> keys = new LastTokenFingerprintStrategy(minLength).keys(EntityType.PERSON, normalized);
            if (expected.isEmpty()) {
                assertTrue(keys.isEmpty());
            } else {
                assertEquals(Set.of(expected), keys);
            }
        }

        @Test
        @DisplayName("Should reject non-positive minimum length")
        void testInvalidMinLength() {
            assertThrows(IllegalArgumentException.class, () -> new LastTokenFingerprintStrategy(0));
        }
    }
}
