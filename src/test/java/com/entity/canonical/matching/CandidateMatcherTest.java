package com.entity.canonical.matching;

import com.entity.canonical.core.model.Candidate;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.MatchReason;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.InMemoryCanonicalStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entity.canonical.store.StoreFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;

class CandidateMatcherTest {

    private InMemoryCanonicalStore store;
    private CandidateMatcher matcher;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        matcher = new CandidateMatcher(new MentionNormalizer());
    }

    @Test
    @DisplayName("Should return no candidates on an empty store")
    void testEmptyStore() {
        assertTrue(matcher.findCandidates(store.reader(), EntityType.PERSON, "Epstein", "epstein").isEmpty());
    }

    @Test
    @DisplayName("Should return no candidates for empty normalized text")
    void testEmptyNormalized() {
        seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein", "epstein");
        assertTrue(matcher.findCandidates(store.reader(), EntityType.PERSON, "!!", "").isEmpty());
    }

    @Test
    @DisplayName("Should find exact alias matches with score 1.0")
    void testExactMatch() {
        CanonicalEntity epstein = seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein", "epstein");

        List<Candidate> candidates = matcher.findCandidates(store.reader(), EntityType.PERSON, "Epstein", "epstein");

        assertEquals(1, candidates.size());
        assertEquals(epstein.getId(), candidates.get(0).canonicalEntityId());
        assertEquals(MatchReason.EXACT_ALIAS, candidates.get(0).reason());
        assertEquals(1.0, candidates.get(0).score());
    }

    @Test
    @DisplayName("Should find fingerprint matches with score 0.6")
    void testFingerprintMatch() {
        CanonicalEntity epstein = seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein", "epstein");

        List<Candidate> candidates = matcher.findCandidates(store.reader(), EntityType.PERSON,
                "Mark Epstein", "mark epstein");

        assertEquals(1, candidates.size());
        assertEquals(epstein.getId(), candidates.get(0).canonicalEntityId());
        assertEquals(MatchReason.KEY_FINGERPRINT, candidates.get(0).reason());
        assertEquals(0.6, candidates.get(0).score());
    }

    @Test
    @DisplayName("Should keep the exact candidate when an entity matches both ways")
    void testDeduplicatesByCanonical() {
        CanonicalEntity epstein = seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein", "epstein");

        List<Candidate> candidates = matcher.findCandidates(store.reader(), EntityType.PERSON,
                "Jeffrey Epstein", "jeffrey epstein");

        assertEquals(1, candidates.size());
        assertEquals(epstein.getId(), candidates.get(0).canonicalEntityId());
        assertTrue(candidates.get(0).isExact());
    }

    @Test
    @DisplayName("Should list exact candidates before fingerprint candidates")
    void testExactFirst() {
        CanonicalEntity viaFingerprint = seed(store, EntityType.PERSON, "Adam Smith", "adam smith", "smith");
        CanonicalEntity viaExact = seed(store, EntityType.PERSON, "John Smith", "john smith");

        List<Candidate> candidates = matcher.findCandidates(store.reader(), EntityType.PERSON,
                "John Smith", "john smith");

        assertEquals(2, candidates.size());
        assertEquals(viaExact.getId(), candidates.get(0).canonicalEntityId());
        assertEquals(viaFingerprint.getId(), candidates.get(1).canonicalEntityId());
        assertFalse(candidates.get(1).isExact());
    }

    @Test
    @DisplayName("Should never match across entity types")
    void testTypeIsolation() {
        seed(store, EntityType.LOCATION, "Paris", "paris");

        assertTrue(matcher.findCandidates(store.reader(), EntityType.PERSON, "Paris", "paris").isEmpty());
        assertEquals(1, matcher.findCandidates(store.reader(), EntityType.LOCATION, "Paris", "paris").size());
    }

    @Test
    @DisplayName("Should not fingerprint locations")
    void testNoLocationFingerprint() {
        seed(store, EntityType.LOCATION, "York", "york");

        assertTrue(matcher.findCandidates(store.reader(), EntityType.LOCATION, "New York", "new york").isEmpty());
    }

    @Test
    @DisplayName("Should bound each lookup by maxCandidatesPerMechanism")
    void testBound() {
        for (int i = 0; i < 5; i++) {
            seed(store, EntityType.ORGANIZATION, "Acme " + i, "acme");
        }
        CandidateMatcher bounded = new CandidateMatcher(new MentionNormalizer(), 3);

        assertEquals(3, bounded.findCandidates(store.reader(), EntityType.ORGANIZATION, "Acme", "acme").size());
    }

    @Test
    @DisplayName("Should reject a non-positive bound")
    void testInvalidBound() {
        assertThrows(IllegalArgumentException.class, () -> new CandidateMatcher(new MentionNormalizer(), 0));
    }
}
