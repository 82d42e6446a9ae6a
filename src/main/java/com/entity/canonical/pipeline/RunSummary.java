package com.entity.canonical.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Totals of an ingestion run.
 *
 * @param totalDocuments    documents selected by the request
 * @param processed         documents ingested successfully
 * @param skipped           documents skipped (already resolved, empty or too short)
 * @param failed            documents that failed extraction or resolution
 * @param extractedMentions mentions returned by the extractor
 * @param totalMentions     mention rows written
 * @param mergedMentions    mentions merged into existing canonical entities
 * @param newEntities       canonical entities created, placeholders included
 * @param ambiguousMentions mentions routed to ambiguity placeholders
 * @param elapsed           wall-clock duration
 * @param failedDocuments   ids of the failed documents
 */
public record RunSummary(
        int totalDocuments,
        int processed,
        int skipped,
        int failed,
        int extractedMentions,
        int totalMentions,
        int mergedMentions,
        int newEntities,
        int ambiguousMentions,
        Duration elapsed,
        List<String> failedDocuments
) {
    public RunSummary {
        failedDocuments = failedDocuments != null ? List.copyOf(failedDocuments) : List.of();
    }
}
