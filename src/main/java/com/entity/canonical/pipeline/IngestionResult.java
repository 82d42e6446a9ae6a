package com.entity.canonical.pipeline;

import java.util.Objects;

/**
 * Outcome of ingesting one document's mentions.
 *
 * @param documentId   the document
 * @param created      mentions that created a new canonical entity
 * @param merged       mentions merged into an existing canonical entity
 * @param ambiguous    mentions routed to an ambiguity placeholder
 * @param skipped      blank, empty-after-normalization or duplicate mentions
 * @param failed       mentions not written because the document failed
 * @param errorMessage failure cause, null on success
 */
public record IngestionResult(
        String documentId,
        int created,
        int merged,
        int ambiguous,
        int skipped,
        int failed,
        String errorMessage
) {
    public IngestionResult {
        Objects.requireNonNull(documentId, "documentId is required");
    }

    public static IngestionResult failed(String documentId, int failed, int skipped, String errorMessage) {
        return new IngestionResult(documentId, 0, 0, 0, skipped, failed,
                errorMessage != null ? errorMessage : "unknown error");
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    /**
     * Number of mention rows written.
     */
    public int mentionsWritten() {
        return created + merged + ambiguous;
    }
}
