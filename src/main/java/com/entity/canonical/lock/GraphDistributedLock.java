package com.entity.canonical.lock;

import com.entity.canonical.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cross-JVM lock stored as a {@code :StoreLock} node in the graph.
 *
 * <p>Acquisition is an atomic MERGE: the node is created for a free key, and an expired
 * node is taken over by the caller. The caller holds the lock when the returned owner is
 * its own id. Owner ids are per thread, so threads of one process exclude each other too.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private static final String ACQUIRE = """
            MERGE (l:StoreLock {key: $key})
            ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
            ON MATCH SET l.owner = CASE WHEN l.expiresAt < $now THEN $owner ELSE l.owner END,
                l.acquiredAt = CASE WHEN l.expiresAt < $now THEN $now ELSE l.acquiredAt END,
                l.expiresAt = CASE WHEN l.expiresAt < $now THEN $expiresAt ELSE l.expiresAt END
            RETURN l.owner AS owner
            """;

    private static final String RELEASE = """
            MATCH (l:StoreLock {key: $key, owner: $owner})
            DELETE l
            """;

    private final GraphConnection connection;
    private final LockConfig config;
    private final String processOwnerId;

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config) {
        this.connection = connection;
        this.config = config;
        this.processOwnerId = ProcessHandle.current().pid() + "-" + System.nanoTime();
        try {
            connection.execute("CREATE INDEX FOR (l:StoreLock) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("lock.index.exists message={}", e.getMessage());
        }
    }

    @Override
    public boolean tryLock(String key) {
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (attemptLock(key)) {
                log.debug("lock.acquired key={} attempt={}", key, attempt + 1);
                return true;
            }
            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException(key, e);
                }
            }
        }
        throw new LockAcquisitionException(key, "held elsewhere after " + (config.maxRetries() + 1) + " attempts");
    }

    @Override
    public void unlock(String key) {
        try {
            connection.execute(RELEASE, Map.of("key", key, "owner", currentOwnerId()));
            log.debug("lock.released key={}", key);
        } catch (RuntimeException e) {
            // the node still expires after its TTL
            log.warn("lock.release.failed key={} error={}", key, e.getMessage());
        }
    }

    /**
     * Owner id written to the lock node by the calling thread.
     */
    public String currentOwnerId() {
        return processOwnerId + "-" + Thread.currentThread().getId();
    }

    private boolean attemptLock(String key) {
        Instant now = Instant.now();
        String ownerId = currentOwnerId();
        try {
            List<Map<String, Object>> rows = connection.query(ACQUIRE, Map.of(
                    "key", key,
                    "owner", ownerId,
                    "now", now.toEpochMilli(),
                    "expiresAt", now.plusSeconds(config.lockTtlSeconds()).toEpochMilli()));
            return !rows.isEmpty() && ownerId.equals(rows.get(0).get("owner"));
        } catch (RuntimeException e) {
            log.warn("lock.attempt.failed key={} error={}", key, e.getMessage());
            return false;
        }
    }
}
