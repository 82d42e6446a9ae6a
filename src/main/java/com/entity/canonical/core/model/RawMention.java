package com.entity.canonical.core.model;

/**
 * A mention as produced by the upstream extractor, before normalization.
 *
 * @param text     the surface text
 * @param type     entity type
 * @param context  optional context supplied by the extractor
 * @param position optional character offset in the document (advisory)
 * @param chunkRef optional chunk or page reference
 */
public record RawMention(String text, EntityType type, String context, Integer position, String chunkRef) {

    public RawMention(String text, EntityType type) {
        this(text, type, null, null, null);
    }

    public RawMention(String text, EntityType type, String context, Integer position) {
        this(text, type, context, position, null);
    }

    /**
     * Returns a copy positioned at the given global offset with the given context snippet.
     */
    public RawMention relocate(Integer globalPosition, String contextSnippet) {
        return new RawMention(text, type, contextSnippet, globalPosition, chunkRef);
    }
}
