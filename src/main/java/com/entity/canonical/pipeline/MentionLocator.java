package com.entity.canonical.pipeline;

import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.pipeline.TextChunker.TextChunk;

/**
 * Turns chunk-relative extractor mentions into document-level mentions: positions become
 * global offsets and the context becomes a window of the full text around the mention.
 */
final class MentionLocator {

    private final int windowChars;

    MentionLocator(int windowChars) {
        this.windowChars = windowChars;
    }

    /**
     * Relocates a mention found in {@code chunk} of {@code fullText}. A missing or out-of-range
     * position falls back to the first occurrence of the mention text in the chunk; when the
     * text cannot be found the extractor's own context is kept and the position is dropped.
     */
    RawMention locate(RawMention mention, TextChunk chunk, String fullText) {
        String text = mention.text() != null ? mention.text().trim() : null;
        if (text == null || text.isEmpty()) {
            return mention;
        }
        Integer positionInChunk = mention.position();
        if (positionInChunk == null || positionInChunk < 0 || positionInChunk >= chunk.text().length()) {
            int index = chunk.text().indexOf(text);
            positionInChunk = index >= 0 ? index : null;
        }
        if (positionInChunk == null) {
            return mention.relocate(null, mention.context() != null ? mention.context() : "");
        }
        int global = chunk.offset() + positionInChunk;
        return mention.relocate(global, snippet(fullText, global, text.length()));
    }

    String snippet(String fullText, int position, int mentionLength) {
        int start = Math.max(0, position - windowChars);
        int end = Math.min(fullText.length(), position + Math.max(mentionLength, 1) + windowChars);
        return start < end ? fullText.substring(start, end) : "";
    }
}
