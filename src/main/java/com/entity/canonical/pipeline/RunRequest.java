package com.entity.canonical.pipeline;

/**
 * Parameters of an ingestion run.
 *
 * @param reprocess  re-ingest documents that are already resolved
 * @param documentId restrict the run to one document, or null
 * @param dataset    restrict the run to one dataset, or null
 */
public record RunRequest(boolean reprocess, String documentId, String dataset) {

    public static RunRequest all() {
        return new RunRequest(false, null, null);
    }

    public static RunRequest reprocessAll() {
        return new RunRequest(true, null, null);
    }

    public static RunRequest document(String documentId, boolean reprocess) {
        return new RunRequest(reprocess, documentId, null);
    }

    public static RunRequest dataset(String dataset, boolean reprocess) {
        return new RunRequest(reprocess, null, dataset);
    }
}
