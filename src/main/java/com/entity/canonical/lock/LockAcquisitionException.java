package com.entity.canonical.lock;

/**
 * Raised when a store lock cannot be obtained: the wait timed out, the retries ran out,
 * or the waiting thread was interrupted.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String reason) {
        super("lock '" + key + "' not acquired: " + reason);
        this.key = key;
    }

    public LockAcquisitionException(String key, InterruptedException cause) {
        super("lock '" + key + "' not acquired: interrupted", cause);
        this.key = key;
    }

    /**
     * The lock key, or the transaction label for store-level locks.
     */
    public String getKey() {
        return key;
    }
}
