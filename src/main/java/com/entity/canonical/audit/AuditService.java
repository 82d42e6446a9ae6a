package com.entity.canonical.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * In-memory trail of merge decisions, bounded to the most recent {@code maxEntries}.
 * When the trail is full, the oldest entry is evicted for each new one.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final int maxEntries;
    private final Deque<AuditEntry> entries = new ArrayDeque<>();
    private long evicted;

    public AuditService() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public AuditService(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        this.maxEntries = maxEntries;
    }

    public AuditEntry record(AuditEntry entry) {
        synchronized (entries) {
            if (entries.size() == maxEntries) {
                entries.removeFirst();
                evicted++;
            }
            entries.addLast(entry);
        }
        log.debug("audit.recorded action={} entityId={} documentId={} actor={}",
                entry.action(), entry.entityId(), entry.documentId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String entityId, String documentId, String actorId,
                             Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .entityId(entityId)
                .documentId(documentId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public List<AuditEntry> getAllEntries() {
        return select(e -> true);
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return select(e -> entityId.equals(e.entityId()));
    }

    public List<AuditEntry> getEntriesForDocument(String documentId) {
        return select(e -> documentId.equals(e.documentId()));
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return select(e -> e.action() == action);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * Number of entries dropped so far to stay within {@link #getMaxEntries()}.
     */
    public long getEvictedCount() {
        synchronized (entries) {
            return evicted;
        }
    }

    /**
     * Returns up to {@code limit} entries, oldest first.
     */
    public List<AuditEntry> getRecentEntries(int limit) {
        List<AuditEntry> snapshot = getAllEntries();
        int size = snapshot.size();
        if (size <= limit) {
            return snapshot;
        }
        return Collections.unmodifiableList(new ArrayList<>(snapshot.subList(size - limit, size)));
    }

    private List<AuditEntry> select(Predicate<AuditEntry> filter) {
        List<AuditEntry> result = new ArrayList<>();
        synchronized (entries) {
            for (AuditEntry entry : entries) {
                if (filter.test(entry)) {
                    result.add(entry);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }
}
