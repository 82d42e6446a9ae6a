package com.entity.canonical.store;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.lock.LockAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory canonical store.
 *
 * <p>A transaction holds the write lock from {@link #begin(String)} until it commits or
 * rolls back, so transactions are serialized and readers never observe uncommitted rows.
 * Writes are applied in place and undone through a {@link CompensatingTransaction} on
 * rollback. A transaction must be closed by the thread that opened it.</p>
 */
public class InMemoryCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCanonicalStore.class);

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final long lockTimeoutMs;

    private final Map<String, CanonicalEntity> entities = new LinkedHashMap<>();
    private final Map<String, EntityAlias> aliases = new LinkedHashMap<>();
    private final Map<String, EntityMention> mentions = new LinkedHashMap<>();
    private final Map<String, EntityCandidateLink> links = new LinkedHashMap<>();
    private final Set<String> resolvedDocuments = new HashSet<>();

    private final CanonicalStoreReader reader = new LockedReader();

    public InMemoryCanonicalStore() {
        this(DEFAULT_LOCK_TIMEOUT_MS);
    }

    public InMemoryCanonicalStore(long lockTimeoutMs) {
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException("lockTimeoutMs must be > 0");
        }
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public StoreTransaction begin(String label) {
        try {
            if (!lock.writeLock().tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(label, "timed out after " + lockTimeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(label, e);
        }
        log.debug("store.tx.begin label={}", label);
        return new InMemoryTransaction(label);
    }

    @Override
    public CanonicalStoreReader reader() {
        return reader;
    }

    @Override
    public void markDocumentUnresolved(String documentId) {
        lock.writeLock().lock();
        try {
            resolvedDocuments.remove(documentId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> supplier) {
        lock.readLock().lock();
        try {
            return supplier.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reader over the maps; every call takes the read lock, which the transaction thread
     * may also take while it holds the write lock.
     */
    private class LockedReader implements CanonicalStoreReader {

        @Override
        public Optional<CanonicalEntity> findCanonicalEntity(String id) {
            return read(() -> Optional.ofNullable(entities.get(id)));
        }

        @Override
        public List<CanonicalEntity> findCanonicalEntities(EntityType type, String canonicalNormalized) {
            return read(() -> entities.values().stream()
                    .filter(e -> e.getType() == type && e.getCanonicalNormalized().equals(canonicalNormalized))
                    .collect(Collectors.toList()));
        }

        @Override
        public long countCanonicalEntities() {
            return read(() -> (long) entities.size());
        }

        @Override
        public List<EntityAlias> findAliases(EntityType type, String aliasNormalized, int limit) {
            return read(() -> aliases.values().stream()
                    .filter(a -> a.getEntityType() == type && a.getAliasNormalized().equals(aliasNormalized))
                    .limit(limit)
                    .collect(Collectors.toList()));
        }

        @Override
        public List<EntityAlias> findAliasesByNormalized(String aliasNormalized) {
            return read(() -> aliases.values().stream()
                    .filter(a -> a.getAliasNormalized().equals(aliasNormalized))
                    .collect(Collectors.toList()));
        }

        @Override
        public Optional<EntityAlias> findAlias(String canonicalEntityId, String aliasNormalized) {
            return read(() -> aliases.values().stream()
                    .filter(a -> a.getCanonicalEntityId().equals(canonicalEntityId)
                            && a.getAliasNormalized().equals(aliasNormalized))
                    .findFirst());
        }

        @Override
        public List<EntityAlias> findAliasesOf(String canonicalEntityId) {
            return read(() -> aliases.values().stream()
                    .filter(a -> a.getCanonicalEntityId().equals(canonicalEntityId))
                    .collect(Collectors.toList()));
        }

        @Override
        public Optional<EntityMention> findMention(String id) {
            return read(() -> Optional.ofNullable(mentions.get(id)));
        }

        @Override
        public List<EntityMention> findMentionsByCanonicalEntity(String canonicalEntityId, int limit) {
            return read(() -> mentions.values().stream()
                    .filter(m -> m.getCanonicalEntityId().equals(canonicalEntityId))
                    .limit(limit)
                    .collect(Collectors.toList()));
        }

        @Override
        public List<EntityMention> findMentionsByDocument(String documentId) {
            return read(() -> mentions.values().stream()
                    .filter(m -> m.getDocumentId().equals(documentId))
                    .collect(Collectors.toList()));
        }

        @Override
        public List<String> findDocumentsMentioningAll(Collection<String> canonicalEntityIds, int limit) {
            Set<String> wanted = new HashSet<>(canonicalEntityIds);
            return read(() -> {
                Map<String, Set<String>> byDocument = new LinkedHashMap<>();
                for (EntityMention mention : mentions.values()) {
                    if (wanted.contains(mention.getCanonicalEntityId())) {
                        byDocument.computeIfAbsent(mention.getDocumentId(), d -> new HashSet<>())
                                .add(mention.getCanonicalEntityId());
                    }
                }
                return byDocument.entrySet().stream()
                        .filter(e -> e.getValue().containsAll(wanted))
                        .map(Map.Entry::getKey)
                        .limit(limit)
                        .collect(Collectors.toList());
            });
        }

        @Override
        public Optional<EntityCandidateLink> findCandidateLink(String id) {
            return read(() -> Optional.ofNullable(links.get(id)));
        }

        @Override
        public List<EntityCandidateLink> findCandidateLinksByMention(String mentionId) {
            return read(() -> links.values().stream()
                    .filter(l -> l.getMentionId().equals(mentionId))
                    .collect(Collectors.toList()));
        }

        @Override
        public List<EntityCandidateLink> findCandidateLinksByStatus(CandidateLinkStatus status, int offset, int limit) {
            return read(() -> links.values().stream()
                    .filter(l -> l.getStatus() == status)
                    .skip(offset)
                    .limit(limit)
                    .collect(Collectors.toList()));
        }

        @Override
        public long countCandidateLinksByStatus(CandidateLinkStatus status) {
            return read(() -> links.values().stream().filter(l -> l.getStatus() == status).count());
        }

        @Override
        public boolean isDocumentResolved(String documentId) {
            return read(() -> resolvedDocuments.contains(documentId));
        }
    }

    private class InMemoryTransaction extends LockedReader implements StoreTransaction {

        private final String label;
        private final CompensatingTransaction undo;
        private final Thread owner = Thread.currentThread();
        private boolean active = true;

        InMemoryTransaction(String label) {
            this.label = label;
            this.undo = new CompensatingTransaction(label);
        }

        @Override
        public void insertCanonicalEntity(CanonicalEntity entity) {
            ensureActive();
            Objects.requireNonNull(entity, "entity is required");
            if (entities.containsKey(entity.getId())) {
                throw new CanonicalStoreException("Canonical entity already exists: " + entity.getId());
            }
            undo.execute("insert canonical " + entity.getId(),
                    () -> entities.put(entity.getId(), entity),
                    () -> entities.remove(entity.getId()));
        }

        @Override
        public EntityAlias insertAlias(EntityAlias alias) {
            ensureActive();
            Objects.requireNonNull(alias, "alias is required");
            if (!entities.containsKey(alias.getCanonicalEntityId())) {
                throw new CanonicalStoreException("Unknown canonical entity: " + alias.getCanonicalEntityId());
            }
            if (findAlias(alias.getCanonicalEntityId(), alias.getAliasNormalized()).isPresent()) {
                throw new DuplicateAliasException(alias.getCanonicalEntityId(), alias.getAliasNormalized());
            }
            undo.execute("insert alias " + alias.getId(),
                    () -> aliases.put(alias.getId(), alias),
                    () -> aliases.remove(alias.getId()));
            return alias;
        }

        @Override
        public void insertMention(EntityMention mention) {
            ensureActive();
            Objects.requireNonNull(mention, "mention is required");
            if (!entities.containsKey(mention.getCanonicalEntityId())) {
                throw new CanonicalStoreException("Unknown canonical entity: " + mention.getCanonicalEntityId());
            }
            undo.execute("insert mention " + mention.getId(),
                    () -> mentions.put(mention.getId(), mention),
                    () -> mentions.remove(mention.getId()));
        }

        @Override
        public void insertCandidateLink(EntityCandidateLink link) {
            ensureActive();
            Objects.requireNonNull(link, "link is required");
            boolean exists = links.values().stream()
                    .anyMatch(l -> l.getMentionId().equals(link.getMentionId())
                            && l.getCandidateCanonicalEntityId().equals(link.getCandidateCanonicalEntityId()));
            if (exists) {
                throw new DuplicateCandidateLinkException(link.getMentionId(), link.getCandidateCanonicalEntityId());
            }
            undo.execute("insert link " + link.getId(),
                    () -> links.put(link.getId(), link),
                    () -> links.remove(link.getId()));
        }

        @Override
        public int deleteMentionsForDocument(String documentId) {
            ensureActive();
            List<EntityMention> doomed = findMentionsByDocument(documentId);
            Set<String> mentionIds = doomed.stream().map(EntityMention::getId).collect(Collectors.toSet());
            List<EntityCandidateLink> doomedLinks = links.values().stream()
                    .filter(l -> mentionIds.contains(l.getMentionId()))
                    .collect(Collectors.toList());
            for (EntityCandidateLink link : doomedLinks) {
                undo.execute("delete link " + link.getId(),
                        () -> links.remove(link.getId()),
                        () -> links.put(link.getId(), link));
            }
            for (EntityMention mention : doomed) {
                undo.execute("delete mention " + mention.getId(),
                        () -> mentions.remove(mention.getId()),
                        () -> mentions.put(mention.getId(), mention));
            }
            return doomed.size();
        }

        @Override
        public void markDocumentResolved(String documentId) {
            ensureActive();
            boolean wasResolved = resolvedDocuments.contains(documentId);
            undo.execute("mark resolved " + documentId,
                    () -> resolvedDocuments.add(documentId),
                    () -> {
                        if (!wasResolved) {
                            resolvedDocuments.remove(documentId);
                        }
                    });
        }

        @Override
        public EntityCandidateLink updateCandidateLinkStatus(String linkId, CandidateLinkStatus status) {
            ensureActive();
            EntityCandidateLink previous = links.get(linkId);
            if (previous == null) {
                throw new IllegalArgumentException("Unknown candidate link: " + linkId);
            }
            EntityCandidateLink updated = previous.withStatus(status);
            undo.execute("update link " + linkId,
                    () -> links.put(linkId, updated),
                    () -> links.put(linkId, previous));
            return updated;
        }

        @Override
        public int reassignMentions(String fromCanonicalId, String toCanonicalId) {
            ensureActive();
            List<EntityMention> moving = mentions.values().stream()
                    .filter(m -> m.getCanonicalEntityId().equals(fromCanonicalId))
                    .collect(Collectors.toList());
            for (EntityMention mention : moving) {
                EntityMention moved = mention.reassignTo(toCanonicalId);
                undo.execute("reassign mention " + mention.getId(),
                        () -> mentions.put(mention.getId(), moved),
                        () -> mentions.put(mention.getId(), mention));
            }
            return moving.size();
        }

        @Override
        public int migrateAliases(String fromCanonicalId, String toCanonicalId) {
            ensureActive();
            Set<String> targetNormalized = findAliasesOf(toCanonicalId).stream()
                    .map(EntityAlias::getAliasNormalized)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            int moved = 0;
            for (EntityAlias alias : findAliasesOf(fromCanonicalId)) {
                if (targetNormalized.add(alias.getAliasNormalized())) {
                    EntityAlias migrated = alias.reassignTo(toCanonicalId);
                    undo.execute("migrate alias " + alias.getId(),
                            () -> aliases.put(alias.getId(), migrated),
                            () -> aliases.put(alias.getId(), alias));
                    moved++;
                }
            }
            return moved;
        }

        @Override
        public void deleteCanonicalEntity(String canonicalEntityId) {
            ensureActive();
            CanonicalEntity entity = entities.get(canonicalEntityId);
            if (entity == null) {
                throw new IllegalArgumentException("Unknown canonical entity: " + canonicalEntityId);
            }
            boolean referenced = mentions.values().stream()
                    .anyMatch(m -> m.getCanonicalEntityId().equals(canonicalEntityId));
            if (referenced) {
                throw new IllegalStateException("Canonical entity still has mentions: " + canonicalEntityId);
            }
            List<EntityCandidateLink> pointing = links.values().stream()
                    .filter(l -> l.getCandidateCanonicalEntityId().equals(canonicalEntityId))
                    .collect(Collectors.toList());
            for (EntityCandidateLink link : pointing) {
                undo.execute("delete link " + link.getId(),
                        () -> links.remove(link.getId()),
                        () -> links.put(link.getId(), link));
            }
            for (EntityAlias alias : new ArrayList<>(findAliasesOf(canonicalEntityId))) {
                undo.execute("delete alias " + alias.getId(),
                        () -> aliases.remove(alias.getId()),
                        () -> aliases.put(alias.getId(), alias));
            }
            undo.execute("delete canonical " + canonicalEntityId,
                    () -> entities.remove(canonicalEntityId),
                    () -> entities.put(canonicalEntityId, entity));
        }

        @Override
        public void commit() {
            ensureActive();
            undo.markSuccess();
            undo.close();
            release();
            log.debug("store.tx.commit label={}", label);
        }

        @Override
        public void rollback() {
            if (!active) {
                return;
            }
            undo.rollback();
            release();
            log.debug("store.tx.rollback label={}", label);
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            rollback();
        }

        private void ensureActive() {
            if (!active) {
                throw new IllegalStateException("Transaction is no longer active: " + label);
            }
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException("Transaction " + label + " used outside its owning thread");
            }
        }

        private void release() {
            active = false;
            lock.writeLock().unlock();
        }
    }
}
