package com.entity.canonical.store;

/**
 * Root of the storage-layer exception hierarchy.
 */
public class CanonicalStoreException extends RuntimeException {

    public CanonicalStoreException(String message) {
        super(message);
    }

    public CanonicalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
