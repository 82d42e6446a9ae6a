package com.entity.canonical.pipeline;

import com.entity.canonical.config.IngestionSettings;
import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.document.DocumentSource;
import com.entity.canonical.document.SourceDocument;
import com.entity.canonical.extraction.ExtractionFailedException;
import com.entity.canonical.extraction.ExtractionResult;
import com.entity.canonical.extraction.ExtractionRetryPolicy;
import com.entity.canonical.extraction.MentionExtractor;
import com.entity.canonical.logging.LogContext;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.pipeline.TextChunker.TextChunk;
import com.entity.canonical.store.CanonicalStoreReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives ingestion over a set of documents: selection, skip rules, chunking, extraction with
 * retry, and one {@link MentionIngestionPipeline#ingest} call per document.
 *
 * <p>Extraction for a document completes before its resolution transaction opens. A failing
 * document is counted and logged; it never aborts the run.</p>
 */
public class DocumentIngestionRunner {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionRunner.class);

    private final DocumentSource documentSource;
    private final MentionExtractor extractor;
    private final MentionIngestionPipeline pipeline;
    private final CanonicalStoreReader reader;
    private final MetricsService metricsService;
    private final IngestionSettings settings;
    private final TextChunker chunker;
    private final MentionLocator locator;
    private final ExtractionRetryPolicy retryPolicy;

    public DocumentIngestionRunner(DocumentSource documentSource, MentionExtractor extractor,
                                   MentionIngestionPipeline pipeline, CanonicalStoreReader reader,
                                   MetricsService metricsService, IngestionSettings settings) {
        this.documentSource = Objects.requireNonNull(documentSource, "documentSource is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.chunker = new TextChunker(settings.getMaxChunkChars());
        this.locator = new MentionLocator(settings.getContextWindowChars());
        this.retryPolicy = new ExtractionRetryPolicy(settings.getExtractionMaxAttempts(),
                settings.getExtractionInitialBackoff());
    }

    public RunSummary run(RunRequest request) {
        Objects.requireNonNull(request, "request is required");
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forRun(runId)) {
            List<SourceDocument> documents = documentSource.list(request.dataset(), request.documentId());
            log.info("run.started documents={} reprocess={} dataset={} documentId={} parallelism={}",
                    documents.size(), request.reprocess(), request.dataset(), request.documentId(),
                    settings.getParallelism());

            RunTotals totals = new RunTotals();
            if (settings.getParallelism() == 1 || documents.size() <= 1) {
                for (SourceDocument document : documents) {
                    processDocument(runId, document, request, totals);
                }
            } else {
                runParallel(runId, documents, request, totals);
            }

            RunSummary summary = totals.toSummary(documents.size(), Duration.ofNanos(System.nanoTime() - start));
            log.info("run.finished documents={} processed={} skipped={} failed={} extracted={} mentions={} "
                            + "merged={} newEntities={} ambiguous={} elapsedMs={}",
                    summary.totalDocuments(), summary.processed(), summary.skipped(), summary.failed(),
                    summary.extractedMentions(), summary.totalMentions(), summary.mergedMentions(),
                    summary.newEntities(), summary.ambiguousMentions(), summary.elapsed().toMillis());
            return summary;
        }
    }

    private void runParallel(String runId, List<SourceDocument> documents, RunRequest request, RunTotals totals) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(settings.getParallelism(), documents.size()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (SourceDocument document : documents) {
                futures.add(pool.submit(() -> processDocument(runId, document, request, totals)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("run.worker.failed error={}", e.getCause().getMessage(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("run.interrupted remaining={}", futures.size());
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void processDocument(String runId, SourceDocument document, RunRequest request, RunTotals totals) {
        try (LogContext ctx = LogContext.forDocument(runId, document.id())) {
            if (!request.reprocess() && reader.isDocumentResolved(document.id())) {
                skip(document, "already resolved", totals);
                return;
            }
            String text = document.text() != null ? document.text().trim() : "";
            if (text.isEmpty()) {
                skip(document, "no text content", totals);
                return;
            }
            if (text.length() < settings.getMinDocumentTextLength()) {
                skip(document, "text too short", totals);
                return;
            }

            List<RawMention> mentions;
            try {
                mentions = extractDocument(document.id(), text, totals);
            } catch (ExtractionFailedException e) {
                pipeline.rejectDocument(document.id(), e);
                totals.fail(document.id());
                return;
            }

            IngestionResult result = pipeline.ingest(document.id(), mentions);
            if (result.isSuccess()) {
                totals.add(result);
            } else {
                totals.fail(document.id());
            }
        } catch (RuntimeException e) {
            log.error("document.unexpected.failure documentId={} error={}", document.id(), e.getMessage(), e);
            totals.fail(document.id());
        }
    }

    private List<RawMention> extractDocument(String documentId, String text, RunTotals totals) {
        List<TextChunk> chunks = chunker.chunk(text);
        List<RawMention> mentions = new ArrayList<>();
        for (TextChunk chunk : chunks) {
            if (chunks.size() > 1) {
                log.debug("extraction.chunk index={} of={} offset={}", chunk.index() + 1, chunks.size(), chunk.offset());
            }
            ExtractionResult result = extractWithRetry(documentId, chunk);
            totals.extracted.addAndGet(result.mentions().size());
            String chunkRef = chunks.size() > 1 ? documentId + "#" + chunk.index() : null;
            for (RawMention raw : result.mentions()) {
                if (raw == null) {
                    continue;
                }
                RawMention withRef = raw.chunkRef() == null && chunkRef != null
                        ? new RawMention(raw.text(), raw.type(), raw.context(), raw.position(), chunkRef)
                        : raw;
                mentions.add(locator.locate(withRef, chunk, text));
            }
            pause(settings.getExtractionDelay(), documentId);
        }
        return mentions;
    }

    private ExtractionResult extractWithRetry(String documentId, TextChunk chunk) {
        int attempt = 0;
        while (true) {
            attempt++;
            ExtractionResult result;
            try {
                result = extractor.extract(documentId, chunk.index(), chunk.text());
            } catch (RuntimeException e) {
                result = ExtractionResult.retryable(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result.isOk()) {
                return result;
            }
            if (!result.isRetryable()) {
                throw new ExtractionFailedException("Extraction failed for chunk " + chunk.index()
                        + ": " + result.error(), attempt);
            }
            if (!retryPolicy.hasAttemptsLeft(attempt)) {
                throw new ExtractionFailedException("Extraction failed for chunk " + chunk.index()
                        + " after " + attempt + " attempts: " + result.error(), attempt);
            }
            Duration backoff = retryPolicy.backoffAfter(attempt);
            metricsService.incrementExtractionRetry();
            log.warn("extraction.retry documentId={} chunk={} attempt={} backoffMs={} error={}",
                    documentId, chunk.index(), attempt, backoff.toMillis(), result.error());
            pause(backoff, documentId);
        }
    }

    private void pause(Duration duration, String documentId) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionFailedException("Interrupted while extracting " + documentId, 0, e);
        }
    }

    private void skip(SourceDocument document, String reason, RunTotals totals) {
        totals.skipped.incrementAndGet();
        metricsService.incrementDocumentSkipped();
        log.info("document.skipped documentId={} path={} reason={}", document.id(), document.path(), reason);
    }

    private static final class RunTotals {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger extracted = new AtomicInteger();
        final AtomicInteger mentions = new AtomicInteger();
        final AtomicInteger merged = new AtomicInteger();
        final AtomicInteger newEntities = new AtomicInteger();
        final AtomicInteger ambiguous = new AtomicInteger();
        final List<String> failedDocuments = Collections.synchronizedList(new ArrayList<>());

        void add(IngestionResult result) {
            processed.incrementAndGet();
            mentions.addAndGet(result.mentionsWritten());
            merged.addAndGet(result.merged());
            newEntities.addAndGet(result.created() + result.ambiguous());
            ambiguous.addAndGet(result.ambiguous());
        }

        void fail(String documentId) {
            failed.incrementAndGet();
            failedDocuments.add(documentId);
        }

        RunSummary toSummary(int totalDocuments, Duration elapsed) {
            List<String> failedIds;
            synchronized (failedDocuments) {
                failedIds = new ArrayList<>(failedDocuments);
            }
            return new RunSummary(totalDocuments, processed.get(), skipped.get(), failed.get(), extracted.get(),
                    mentions.get(), merged.get(), newEntities.get(), ambiguous.get(), elapsed, failedIds);
        }
    }
}
