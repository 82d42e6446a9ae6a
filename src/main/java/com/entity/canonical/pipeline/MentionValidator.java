package com.entity.canonical.pipeline;

import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.extraction.MalformedMentionException;

/**
 * Validates raw mentions before any store access.
 */
public final class MentionValidator {

    private final int maxMentionLength;

    public MentionValidator(int maxMentionLength) {
        if (maxMentionLength <= 0) {
            throw new IllegalArgumentException("maxMentionLength must be > 0");
        }
        this.maxMentionLength = maxMentionLength;
    }

    /**
     * Rejects a missing mention, a missing type or text, overly long text, or text containing
     * control characters. Blank text is accepted here and skipped later.
     *
     * @throws MalformedMentionException if the mention cannot be ingested
     */
    public void validate(RawMention mention, int index) {
        if (mention == null) {
            throw new MalformedMentionException("Mention #" + index + " is null");
        }
        if (mention.type() == null) {
            throw new MalformedMentionException("Mention #" + index + " has no entity type");
        }
        String text = mention.text();
        if (text == null) {
            throw new MalformedMentionException("Mention #" + index + " has no text");
        }
        if (text.length() > maxMentionLength) {
            throw new MalformedMentionException("Mention #" + index + " exceeds maximum length of "
                    + maxMentionLength + " characters (was " + text.length() + ")");
        }
        if (containsControlCharacters(text)) {
            throw new MalformedMentionException("Mention #" + index + " contains control characters");
        }
    }

    /**
     * ASCII control characters (0x00-0x1F, 0x7F) other than tab, newline and carriage return.
     */
    static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
