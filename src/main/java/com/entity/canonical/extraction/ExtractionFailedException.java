package com.entity.canonical.extraction;

/**
 * Thrown when a chunk could not be extracted: a fatal error, or retryable errors on every
 * allowed attempt.
 */
public class ExtractionFailedException extends RuntimeException {

    private final int attempts;

    public ExtractionFailedException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public ExtractionFailedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
