package com.entity.canonical.extraction;

/**
 * Upstream named-entity extractor (an LLM or NER service). Implementations report failures
 * through {@link ExtractionResult} and leave retrying to the caller.
 */
@FunctionalInterface
public interface MentionExtractor {

    /**
     * Extracts mentions from one chunk of a document.
     *
     * @param documentId document the chunk belongs to
     * @param chunkIndex zero-based chunk index
     * @param chunkText  chunk text; mention positions are relative to it
     */
    ExtractionResult extract(String documentId, int chunkIndex, String chunkText);
}
