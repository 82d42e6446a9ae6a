package com.entity.canonical.document;

import java.util.List;

/**
 * Supplies documents to the ingestion runner. Discovery and text extraction happen upstream.
 */
public interface DocumentSource {

    /**
     * Returns the documents to consider, optionally filtered.
     *
     * @param dataset    only documents of this dataset, or all when null
     * @param documentId only this document, or all when null
     */
    List<SourceDocument> list(String dataset, String documentId);
}
