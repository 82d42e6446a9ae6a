package com.entity.canonical.lock;

/**
 * Lock serializing store transactions that must not interleave, such as two documents
 * resolving mentions against the same graph.
 */
public interface DistributedLock {

    /**
     * Acquires the lock for {@code key}.
     *
     * @param key lock key (for the graph store, one key per graph)
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock cannot be obtained in time
     */
    boolean tryLock(String key);

    void unlock(String key);
}
