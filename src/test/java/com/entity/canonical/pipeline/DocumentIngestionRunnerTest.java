package com.entity.canonical.pipeline;

import com.entity.canonical.audit.AuditAction;
import com.entity.canonical.audit.AuditService;
import com.entity.canonical.config.IngestionSettings;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.decision.MentionResolver;
import com.entity.canonical.decision.ResolutionDecisionEngine;
import com.entity.canonical.document.InMemoryDocumentSource;
import com.entity.canonical.document.SourceDocument;
import com.entity.canonical.extraction.ExtractionResult;
import com.entity.canonical.extraction.MentionExtractor;
import com.entity.canonical.matching.CandidateMatcher;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.InMemoryCanonicalStore;
import com.entity.canonical.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DocumentIngestionRunnerTest {

    private InMemoryCanonicalStore store;
    private AuditService auditService;
    private MetricsService metrics;
    private MentionIngestionPipeline pipeline;
    private InMemoryDocumentSource source;
    private IngestionSettings settings;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        auditService = new AuditService();
        metrics = mock(MetricsService.class);
        MentionNormalizer normalizer = new MentionNormalizer();
        MentionResolver resolver = new MentionResolver(normalizer, new CandidateMatcher(normalizer),
                new ResolutionDecisionEngine());
        pipeline = new MentionIngestionPipeline(store, normalizer, resolver, new MentionValidator(1000),
                auditService, metrics, new NoOpTracingService());
        source = new InMemoryDocumentSource();
        settings = IngestionSettings.builder()
                .minDocumentTextLength(10)
                .extractionInitialBackoff(Duration.ofMillis(1))
                .build();
    }

    private DocumentIngestionRunner runner(MentionExtractor extractor) {
        return new DocumentIngestionRunner(source, extractor, pipeline, store.reader(), metrics, settings);
    }

    /**
     * Reports every occurrence of the given names found in a chunk, with chunk-relative positions.
     */
    private static MentionExtractor namesExtractor(Map<String, EntityType> names) {
        return (documentId, chunkIndex, chunkText) -> {
            List<RawMention> mentions = new ArrayList<>();
            names.forEach((name, type) -> {
                int index = chunkText.indexOf(name);
                if (index >= 0) {
                    mentions.add(new RawMention(name, type, null, index));
                }
            });
            return ExtractionResult.ok(mentions);
        };
    }

    private static MentionExtractor personExtractor(String... names) {
        return (documentId, chunkIndex, chunkText) -> {
            List<RawMention> mentions = new ArrayList<>();
            for (String name : names) {
                int index = chunkText.indexOf(name);
                if (index >= 0) {
                    mentions.add(new RawMention(name, EntityType.PERSON, null, index));
                }
            }
            return ExtractionResult.ok(mentions);
        };
    }

    @Nested
    @DisplayName("Run summary")
    class Summary {

        @Test
        @DisplayName("Should ingest every document and total the outcomes")
        void testTotals() {
            source.add(new SourceDocument("doc-1", "flights", "/docs/1.txt", "Jeffrey Epstein flew to Paris today."))
                    .add(new SourceDocument("doc-2", "flights", "/docs/2.txt", "Later, Epstein returned home again."));

            RunSummary summary = runner(personExtractor("Jeffrey Epstein", "Epstein")).run(RunRequest.all());

            assertEquals(2, summary.totalDocuments());
            assertEquals(2, summary.processed());
            assertEquals(0, summary.failed());
            assertEquals(0, summary.skipped());
            // "Epstein" is also found inside "Jeffrey Epstein" in the first document
            assertEquals(3, summary.extractedMentions());
            assertEquals(3, summary.totalMentions());
            assertEquals(1, summary.newEntities());
            assertEquals(2, summary.mergedMentions());
            assertEquals(0, summary.ambiguousMentions());
            assertTrue(summary.failedDocuments().isEmpty());
            assertEquals(1, store.reader().countCanonicalEntities());
        }

        @Test
        @DisplayName("Should restrict the run to a dataset")
        void testDatasetFilter() {
            source.add(new SourceDocument("doc-1", "flights", null, "Jeffrey Epstein flew to Paris today."))
                    .add(new SourceDocument("doc-2", "emails", null, "Jeffrey Epstein wrote a long email."));

            RunSummary summary = runner(personExtractor("Jeffrey Epstein")).run(RunRequest.dataset("emails", false));

            assertEquals(1, summary.totalDocuments());
            assertTrue(store.reader().isDocumentResolved("doc-2"));
            assertFalse(store.reader().isDocumentResolved("doc-1"));
        }

        @Test
        @DisplayName("Should converge on one entity when documents run in parallel")
        void testParallelRun() {
            settings = settings.toBuilder().parallelism(4).build();
            for (int i = 0; i < 8; i++) {
                source.add(new SourceDocument("doc-" + i, null, null, "Report " + i + ": Jeffrey Epstein was seen."));
            }

            RunSummary summary = runner(personExtractor("Jeffrey Epstein")).run(RunRequest.all());

            assertEquals(8, summary.processed());
            assertEquals(8, summary.totalMentions());
            assertEquals(1, store.reader().countCanonicalEntities());
        }
    }

    @Nested
    @DisplayName("Skip rules")
    class SkipRules {

        @Test
        @DisplayName("Should skip resolved documents unless reprocessing")
        void testSkipResolved() {
            source.add(new SourceDocument("doc-1", null, null, "Jeffrey Epstein flew to Paris today."));
            DocumentIngestionRunner runner = runner(personExtractor("Jeffrey Epstein"));

            runner.run(RunRequest.all());
            RunSummary second = runner.run(RunRequest.all());
            assertEquals(1, second.skipped());
            assertEquals(0, second.processed());

            RunSummary reprocessed = runner.run(RunRequest.reprocessAll());
            assertEquals(1, reprocessed.processed());
            assertEquals(1, store.reader().findMentionsByDocument("doc-1").size());
            verify(metrics, times(1)).incrementDocumentSkipped();
        }

        @Test
        @DisplayName("Should skip documents without usable text")
        void testSkipEmptyAndShort() {
            source.add(new SourceDocument("empty", null, null, null))
                    .add(new SourceDocument("blank", null, null, "   \n  "))
                    .add(new SourceDocument("short", null, null, "Hi there"));
            MentionExtractor extractor = mock(MentionExtractor.class);

            RunSummary summary = runner(extractor).run(RunRequest.all());

            assertEquals(3, summary.skipped());
            assertEquals(0, summary.processed());
            verifyNoInteractions(extractor);
            verify(metrics, times(3)).incrementDocumentSkipped();
        }
    }

    @Nested
    @DisplayName("Extraction retry")
    class ExtractionRetry {

        private static final String TEXT = "Jeffrey Epstein flew to Paris today.";

        @Test
        @DisplayName("Should retry retryable failures and then ingest")
        void testRetryThenSucceed() {
            source.add(new SourceDocument("doc-1", null, null, TEXT));
            AtomicInteger calls = new AtomicInteger();
            MentionExtractor delegate = personExtractor("Jeffrey Epstein");
            MentionExtractor flaky = (id, index, text) -> calls.incrementAndGet() < 3
                    ? ExtractionResult.retryable("rate limited")
                    : delegate.extract(id, index, text);

            RunSummary summary = runner(flaky).run(RunRequest.all());

            assertEquals(1, summary.processed());
            assertEquals(3, calls.get());
            verify(metrics, times(2)).incrementExtractionRetry();
        }

        @Test
        @DisplayName("Should treat extractor exceptions as retryable")
        void testExceptionRetried() {
            source.add(new SourceDocument("doc-1", null, null, TEXT));
            AtomicInteger calls = new AtomicInteger();
            MentionExtractor delegate = personExtractor("Jeffrey Epstein");
            MentionExtractor throwing = (id, index, text) -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("connection reset");
                }
                return delegate.extract(id, index, text);
            };

            RunSummary summary = runner(throwing).run(RunRequest.all());

            assertEquals(1, summary.processed());
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("Should fail the document once attempts are exhausted")
        void testRetriesExhausted() {
            source.add(new SourceDocument("doc-1", null, null, TEXT))
                    .add(new SourceDocument("doc-2", null, null, "Ghislaine Maxwell arrived in London."));
            AtomicInteger calls = new AtomicInteger();
            MentionExtractor delegate = personExtractor("Ghislaine Maxwell");
            MentionExtractor extractor = (id, index, text) -> {
                if (id.equals("doc-1")) {
                    calls.incrementAndGet();
                    return ExtractionResult.retryable("timeout");
                }
                return delegate.extract(id, index, text);
            };

            RunSummary summary = runner(extractor).run(RunRequest.all());

            assertEquals(3, calls.get());
            assertEquals(1, summary.failed());
            assertEquals(1, summary.processed());
            assertEquals(List.of("doc-1"), summary.failedDocuments());
            assertFalse(store.reader().isDocumentResolved("doc-1"));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.DOCUMENT_FAILED).size());
            verify(metrics).incrementDocumentFailed();
        }

        @Test
        @DisplayName("Should not retry fatal failures")
        void testFatalFailure() {
            source.add(new SourceDocument("doc-1", null, null, TEXT));
            AtomicInteger calls = new AtomicInteger();
            MentionExtractor extractor = (id, index, text) -> {
                calls.incrementAndGet();
                return ExtractionResult.fatal("unparseable payload");
            };

            RunSummary summary = runner(extractor).run(RunRequest.all());

            assertEquals(1, calls.get());
            assertEquals(1, summary.failed());
            verify(metrics, never()).incrementExtractionRetry();
            assertTrue(store.reader().findMentionsByDocument("doc-1").isEmpty());
        }
    }

    @Nested
    @DisplayName("Chunking")
    class Chunking {

        @Test
        @DisplayName("Should extract chunk by chunk and report document-level positions")
        void testChunkedDocument() {
            String first = "Alpha paragraph mentions Paris here.";
            String second = "Beta paragraph mentions London there.";
            source.add(new SourceDocument("doc-1", null, null, first + "\n\n" + second));
            settings = settings.toBuilder().maxChunkChars(40).contextWindowChars(5).build();
            List<Integer> chunkIndexes = new ArrayList<>();
            MentionExtractor delegate = namesExtractor(Map.of("Paris", EntityType.LOCATION, "London", EntityType.LOCATION));
            MentionExtractor recording = (id, index, text) -> {
                chunkIndexes.add(index);
                return delegate.extract(id, index, text);
            };

            RunSummary summary = runner(recording).run(RunRequest.all());

            assertEquals(1, summary.processed());
            assertEquals(List.of(0, 1), chunkIndexes);

            List<EntityMention> mentions = new ArrayList<>(store.reader().findMentionsByDocument("doc-1"));
            mentions.sort(Comparator.comparing(EntityMention::getPosition));
            assertEquals(2, mentions.size());

            EntityMention paris = mentions.get(0);
            assertEquals("Paris", paris.getMentionText());
            assertEquals(first.indexOf("Paris"), paris.getPosition());
            assertEquals("doc-1#0", paris.getChunkRef());

            EntityMention london = mentions.get(1);
            assertEquals("London", london.getMentionText());
            assertEquals(first.length() + 2 + second.indexOf("London"), london.getPosition());
            assertEquals("doc-1#1", london.getChunkRef());
            assertEquals("ions London ther", london.getContextSnippet());
        }
    }
}
