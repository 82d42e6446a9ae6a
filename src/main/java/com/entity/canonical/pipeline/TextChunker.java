package com.entity.canonical.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts document text into extractor-sized chunks, preferring paragraph boundaries.
 */
public final class TextChunker {

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final int maxChars;

    public TextChunker(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be > 0");
        }
        this.maxChars = maxChars;
    }

    /**
     * A chunk and its offset in the full text.
     */
    public record TextChunk(int index, int offset, String text) {}

    /**
     * Splits {@code text} into chunks of at most {@code maxChars} characters. A chunk ends
     * just after the last paragraph break before the limit when that break lies further than
     * {@code min(1000, maxChars / 4)} characters into the chunk.
     */
    public List<TextChunk> chunk(String text) {
        if (text.length() <= maxChars) {
            return List.of(new TextChunk(0, 0, text));
        }
        List<TextChunk> chunks = new ArrayList<>();
        int minBreak = Math.min(1000, maxChars / 4);
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + maxChars, text.length());
            if (end < text.length()) {
                int boundary = text.lastIndexOf(PARAGRAPH_BREAK, end);
                if (boundary > start + minBreak && boundary + PARAGRAPH_BREAK.length() <= start + maxChars) {
                    end = boundary + PARAGRAPH_BREAK.length();
                }
            }
            chunks.add(new TextChunk(chunks.size(), start, text.substring(start, end)));
            start = end;
        }
        return chunks;
    }

    public int getMaxChars() {
        return maxChars;
    }
}
