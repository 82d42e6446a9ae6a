package com.entity.canonical.extraction;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff for retryable extractor failures:
 * attempt {@code n} failing waits {@code initialBackoff * 2^(n-1)} before attempt {@code n+1}.
 *
 * @param maxAttempts    total attempts, including the first
 * @param initialBackoff wait after the first failed attempt
 */
public record ExtractionRetryPolicy(int maxAttempts, Duration initialBackoff) {

    public ExtractionRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff is required");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
    }

    /**
     * Three attempts, 400ms initial backoff.
     */
    public static ExtractionRetryPolicy defaults() {
        return new ExtractionRetryPolicy(3, Duration.ofMillis(400));
    }

    /**
     * Wait after failed attempt {@code attempt} (1-based).
     */
    public Duration backoffAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        return initialBackoff.multipliedBy(1L << Math.min(attempt - 1, 30));
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
