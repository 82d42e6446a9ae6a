package com.entity.canonical.graph;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.lock.DistributedLock;
import com.entity.canonical.lock.LocalDistributedLock;
import com.entity.canonical.store.CanonicalStore;
import com.entity.canonical.store.CanonicalStoreReader;
import com.entity.canonical.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Canonical store backed by a FalkorDB graph.
 *
 * <p>Transactions are serialized per graph through a {@link DistributedLock} and roll back
 * through compensating statements. Writes become visible to other readers as they are
 * applied; only writers are isolated from each other.</p>
 */
public class GraphCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(GraphCanonicalStore.class);

    private final CanonicalCypherExecutor executor;
    private final DistributedLock lock;
    private final String lockKey;
    private final CanonicalStoreReader reader;

    public GraphCanonicalStore(GraphConnection connection) {
        this(new CanonicalCypherExecutor(connection), new LocalDistributedLock());
    }

    public GraphCanonicalStore(GraphConnection connection, DistributedLock lock) {
        this(new CanonicalCypherExecutor(connection), lock);
    }

    public GraphCanonicalStore(CanonicalCypherExecutor executor, DistributedLock lock) {
        this.executor = executor;
        this.lock = lock;
        this.lockKey = "canonical-store:" + executor.getConnection().getGraphName();
        this.reader = new GraphReader(executor);
        executor.getConnection().createIndexes();
        log.info("graph.store.initialized graph={}", executor.getConnection().getGraphName());
    }

    @Override
    public StoreTransaction begin(String label) {
        lock.tryLock(lockKey);
        log.debug("store.tx.begin label={} lockKey={}", label, lockKey);
        return new GraphStoreTransaction(executor, label, () -> lock.unlock(lockKey));
    }

    @Override
    public CanonicalStoreReader reader() {
        return reader;
    }

    @Override
    public void markDocumentUnresolved(String documentId) {
        executor.markDocumentUnresolved(documentId);
    }

    @Override
    public void close() {
        executor.getConnection().close();
    }

    String getLockKey() {
        return lockKey;
    }

    /**
     * Stateless reader issuing one query per call.
     */
    static class GraphReader implements CanonicalStoreReader {

        protected final CanonicalCypherExecutor executor;

        GraphReader(CanonicalCypherExecutor executor) {
            this.executor = executor;
        }

        @Override
        public Optional<CanonicalEntity> findCanonicalEntity(String id) {
            return executor.findCanonicalEntity(id);
        }

        @Override
        public List<CanonicalEntity> findCanonicalEntities(EntityType type, String canonicalNormalized) {
            return executor.findCanonicalEntities(type, canonicalNormalized);
        }

        @Override
        public long countCanonicalEntities() {
            return executor.countCanonicalEntities();
        }

        @Override
        public List<EntityAlias> findAliases(EntityType type, String aliasNormalized, int limit) {
            return executor.findAliases(type, aliasNormalized, limit);
        }

        @Override
        public List<EntityAlias> findAliasesByNormalized(String aliasNormalized) {
            return executor.findAliasesByNormalized(aliasNormalized);
        }

        @Override
        public Optional<EntityAlias> findAlias(String canonicalEntityId, String aliasNormalized) {
            return executor.findAlias(canonicalEntityId, aliasNormalized);
        }

        @Override
        public List<EntityAlias> findAliasesOf(String canonicalEntityId) {
            return executor.findAliasesOf(canonicalEntityId);
        }

        @Override
        public Optional<EntityMention> findMention(String id) {
            return executor.findMention(id);
        }

        @Override
        public List<EntityMention> findMentionsByCanonicalEntity(String canonicalEntityId, int limit) {
            return executor.findMentionsByCanonicalEntity(canonicalEntityId, limit);
        }

        @Override
        public List<EntityMention> findMentionsByDocument(String documentId) {
            return executor.findMentionsByDocument(documentId);
        }

        @Override
        public List<String> findDocumentsMentioningAll(Collection<String> canonicalEntityIds, int limit) {
            return executor.findDocumentsMentioningAll(canonicalEntityIds, limit);
        }

        @Override
        public Optional<EntityCandidateLink> findCandidateLink(String id) {
            return executor.findCandidateLink(id);
        }

        @Override
        public List<EntityCandidateLink> findCandidateLinksByMention(String mentionId) {
            return executor.findCandidateLinksByMention(mentionId);
        }

        @Override
        public List<EntityCandidateLink> findCandidateLinksByStatus(CandidateLinkStatus status, int offset, int limit) {
            return executor.findCandidateLinksByStatus(status, offset, limit);
        }

        @Override
        public long countCandidateLinksByStatus(CandidateLinkStatus status) {
            return executor.countCandidateLinksByStatus(status);
        }

        @Override
        public boolean isDocumentResolved(String documentId) {
            return executor.isDocumentResolved(documentId);
        }
    }
}
