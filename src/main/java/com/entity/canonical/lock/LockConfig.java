package com.entity.canonical.lock;

/**
 * Lock timing configuration.
 *
 * @param timeoutMs      maximum wait for an in-process lock
 * @param maxRetries     retry attempts for the graph lock
 * @param retryDelayMs   pause between graph lock attempts
 * @param lockTtlSeconds lifetime of a graph lock node before another owner may reclaim it
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    /**
     * 30s timeout, 300 retries 100ms apart, 120s TTL. A document transaction can take a
     * while, so waits are longer than for single-row locks.
     */
    public static LockConfig defaults() {
        return new LockConfig(30_000, 300, 100, 120);
    }
}
