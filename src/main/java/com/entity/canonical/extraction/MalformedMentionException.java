package com.entity.canonical.extraction;

/**
 * Thrown when extractor output or a raw mention cannot be used. The whole document is
 * rejected; nothing is written for it.
 */
public class MalformedMentionException extends RuntimeException {

    public MalformedMentionException(String message) {
        super(message);
    }

    public MalformedMentionException(String message, Throwable cause) {
        super(message, cause);
    }
}
