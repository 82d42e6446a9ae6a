package com.entity.canonical.api;

import com.entity.canonical.config.IngestionSettings;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.document.InMemoryDocumentSource;
import com.entity.canonical.document.SourceDocument;
import com.entity.canonical.extraction.ExtractionResult;
import com.entity.canonical.extraction.MentionExtractor;
import com.entity.canonical.pipeline.IngestionResult;
import com.entity.canonical.pipeline.RunRequest;
import com.entity.canonical.pipeline.RunSummary;
import com.entity.canonical.review.ReviewOutcome;
import com.entity.canonical.store.CanonicalStore;
import com.entity.canonical.store.InMemoryCanonicalStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.entity.canonical.store.StoreFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CanonicalizationEngineTest {

    private static RawMention person(String text) {
        return new RawMention(text, EntityType.PERSON);
    }

    private static Set<String> aliasesOf(CanonicalizationEngine engine, CanonicalEntity entity) {
        return engine.query().aliasesOf(entity.getId()).stream()
                .map(EntityAlias::getAliasNormalized)
                .collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Ingestion scenarios")
    class Scenarios {

        @Test
        @DisplayName("Should keep a bare first name apart from the full name")
        void testBareFirstName() {
            try (CanonicalizationEngine engine = CanonicalizationEngine.inMemory()) {
                IngestionResult result = engine.ingest("doc-1", List.of(
                        person("Jeffrey Epstein"), person("jeffrey"), person("Clinton")));

                assertTrue(result.isSuccess());
                assertEquals(3, result.created());
                assertEquals(3, engine.getStore().reader().countCanonicalEntities());

                CanonicalEntity epstein = engine.query().resolveQuery("Jeffrey Epstein", EntityType.PERSON).get(0);
                assertEquals(Set.of("jeffrey epstein", "epstein"), aliasesOf(engine, epstein));
                assertNotEquals(epstein, engine.query().resolveQuery("jeffrey", EntityType.PERSON).get(0));
                assertEquals(1, engine.query().resolveQuery("Clinton", null).size());
            }
        }

        @Test
        @DisplayName("Should converge an honorific separated by a no-break space")
        void testNoBreakSpaceConvergence() {
            try (CanonicalizationEngine engine = CanonicalizationEngine.inMemory()) {
                IngestionResult result = engine.ingest("doc-1", List.of(
                        person("Jeffrey Epstein"), person("Mr.\u00A0Epstein")));

                assertEquals(1, result.created());
                assertEquals(1, result.merged());
                CanonicalEntity epstein = engine.query().resolveQuery("Jeffrey Epstein", EntityType.PERSON).get(0);
                assertEquals(Set.of("jeffrey epstein", "epstein"), aliasesOf(engine, epstein));
            }
        }

        @Test
        @DisplayName("Should answer co-occurrence across documents")
        void testCoOccurrence() {
            try (CanonicalizationEngine engine = CanonicalizationEngine.inMemory()) {
                engine.ingest("doc-1", List.of(person("Jeffrey Epstein"), person("Bill Clinton")));
                engine.ingest("doc-2", List.of(person("Mr. Epstein")));
                engine.ingest("doc-3", List.of(person("epstein"), person("President Clinton")));

                String epstein = engine.query().resolveQuery("epstein", EntityType.PERSON).get(0).getId();
                String clinton = engine.query().resolveQuery("clinton", EntityType.PERSON).get(0).getId();

                List<String> documents = new ArrayList<>(engine.query().documentsMentioningAll(List.of(epstein, clinton)));
                documents.sort(String::compareTo);
                assertEquals(List.of("doc-1", "doc-3"), documents);
                assertEquals(3, engine.query().mentionsOf(epstein).size());
            }
        }

        @Test
        @DisplayName("Should route ambiguity to review and resolve it on acceptance")
        void testAmbiguityReview() {
            try (CanonicalizationEngine engine = CanonicalizationEngine.inMemory()) {
                seed(engine.getStore(), EntityType.PERSON, "Adam Smith", "adam smith", "smith");
                seed(engine.getStore(), EntityType.PERSON, "Will Smith", "will smith", "smith");
                IngestionResult result = engine.ingest("doc-2", List.of(person("John Smith")));
                assertEquals(1, result.ambiguous());

                Page<?> pending = engine.query().pendingCandidateLinks(PageRequest.first(10));
                assertEquals(2, pending.totalElements());

                CanonicalEntity adam = engine.query().resolveQuery("Adam Smith", EntityType.PERSON).get(0);
                String linkId = engine.review().pendingLinks(PageRequest.first(10)).content().stream()
                        .filter(l -> l.getCandidateCanonicalEntityId().equals(adam.getId()))
                        .findFirst()
                        .orElseThrow()
                        .getId();

                ReviewOutcome outcome = engine.review().accept(linkId, "reviewer-1");

                assertTrue(outcome.placeholderDeleted());
                assertEquals(List.of(adam), engine.query().resolveQuery("John Smith", EntityType.PERSON));
                assertEquals(0, engine.query().pendingCandidateLinks(PageRequest.first(10)).totalElements());
            }
        }
    }

    @Nested
    @DisplayName("Document runs")
    class Runs {

        @Test
        @DisplayName("Should run the document loop over the configured source and extractor")
        void testRun() {
            InMemoryDocumentSource source = new InMemoryDocumentSource()
                    .add(new SourceDocument("doc-1", "flights", null, "Jeffrey Epstein boarded the plane in Paris."))
                    .add(new SourceDocument("doc-2", "flights", null, "Epstein landed in London the next morning."));
            MentionExtractor extractor = (documentId, chunkIndex, text) -> {
                List<RawMention> mentions = new ArrayList<>();
                for (String name : List.of("Jeffrey Epstein", "Epstein ")) {
                    if (text.startsWith(name)) {
                        mentions.add(new RawMention(name.trim(), EntityType.PERSON, null, 0));
                    }
                }
                for (String place : List.of("Paris", "London")) {
                    int index = text.indexOf(place);
                    if (index >= 0) {
                        mentions.add(new RawMention(place, EntityType.LOCATION, null, index));
                    }
                }
                return ExtractionResult.ok(mentions);
            };
            IngestionSettings settings = IngestionSettings.builder().minDocumentTextLength(10).build();

            try (CanonicalizationEngine engine = CanonicalizationEngine.builder()
                    .inMemory()
                    .settings(settings)
                    .documentSource(source)
                    .extractor(extractor)
                    .build()) {
                RunSummary summary = engine.run(RunRequest.all());

                assertEquals(2, summary.processed());
                assertEquals(4, summary.totalMentions());
                assertEquals(3, summary.newEntities());
                assertEquals(1, summary.mergedMentions());
                assertEquals(2, engine.query().mentionsOf(
                        engine.query().resolveQuery("epstein", EntityType.PERSON).get(0).getId()).size());
            }
        }

        @Test
        @DisplayName("Should refuse to run without a document source")
        void testRunWithoutSource() {
            try (CanonicalizationEngine engine = CanonicalizationEngine.inMemory()) {
                assertThrows(IllegalStateException.class, () -> engine.run(RunRequest.all()));
            }
        }
    }

    @Nested
    @DisplayName("Store ownership")
    class Ownership {

        @Test
        @DisplayName("Should not close a caller-managed store")
        void testCallerStoreNotClosed() {
            CanonicalStore store = spy(new InMemoryCanonicalStore());

            CanonicalizationEngine.builder().store(store).build().close();

            verify(store, never()).close();
        }

        @Test
        @DisplayName("Should bound the audit trail by the configured capacity")
        void testAuditCapacity() {
            IngestionSettings settings = IngestionSettings.builder().auditMaxEntries(2).build();

            try (CanonicalizationEngine engine = CanonicalizationEngine.builder().settings(settings).build()) {
                engine.ingest("doc-1", List.of(person("Jeffrey Epstein"), person("Epstein"), person("Bill Clinton")));

                assertEquals(2, engine.getAuditService().size());
                assertEquals(1, engine.getAuditService().getEvictedCount());
                assertEquals(2, engine.getAuditService().getMaxEntries());
            }
        }

        @Test
        @DisplayName("Should apply settings to the normalizer")
        void testSettingsApplied() {
            IngestionSettings settings = IngestionSettings.builder().fingerprintMinTokenLength(3).build();

            try (CanonicalizationEngine engine = CanonicalizationEngine.builder().settings(settings).build()) {
                assertEquals(Set.of("john doe", "doe"), engine.getNormalizer().fingerprints(EntityType.PERSON, "John Doe"));
                assertSame(settings, engine.getSettings());
            }
        }
    }
}
