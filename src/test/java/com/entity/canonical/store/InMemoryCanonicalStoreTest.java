package com.entity.canonical.store;

import com.entity.canonical.core.model.CandidateLinkStatus;
import com.entity.canonical.core.model.CanonicalEntity;
import com.entity.canonical.core.model.EntityAlias;
import com.entity.canonical.core.model.EntityCandidateLink;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.lock.LockAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.entity.canonical.store.StoreFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryCanonicalStoreTest {

    private InMemoryCanonicalStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
    }

    private static EntityMention mention(String documentId, String canonicalId) {
        return EntityMention.builder()
                .documentId(documentId)
                .canonicalEntityId(canonicalId)
                .mentionText("Epstein")
                .mentionNormalized("epstein")
                .build();
    }

    private static EntityCandidateLink link(String mentionId, String candidateId) {
        return EntityCandidateLink.builder()
                .mentionId(mentionId)
                .candidateCanonicalEntityId(candidateId)
                .score(0.6)
                .reason("last-token fingerprint match")
                .build();
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("Should make writes visible after commit")
        void testCommit() {
            CanonicalEntity entity = seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein", "epstein");

            assertTrue(store.reader().findCanonicalEntity(entity.getId()).isPresent());
            assertEquals(2, store.reader().findAliasesOf(entity.getId()).size());
            assertEquals(1, store.reader().countCanonicalEntities());
        }

        @Test
        @DisplayName("Should undo every write on rollback")
        void testRollback() {
            CanonicalEntity existing = seed(store, EntityType.PERSON, "Bill Clinton", "bill clinton");
            EntityMention old = mention("doc-1", existing.getId());
            try (StoreTransaction tx = store.begin("setup")) {
                tx.insertMention(old);
                tx.markDocumentResolved("doc-1");
                tx.commit();
            }

            try (StoreTransaction tx = store.begin("doc-1")) {
                assertEquals(1, tx.deleteMentionsForDocument("doc-1"));
                CanonicalEntity fresh = CanonicalEntity.builder()
                        .type(EntityType.PERSON).canonicalText("Epstein").canonicalNormalized("epstein").build();
                tx.insertCanonicalEntity(fresh);
                tx.insertMention(mention("doc-1", fresh.getId()));
                tx.rollback();
                assertFalse(tx.isActive());
            }

            assertEquals(1, store.reader().countCanonicalEntities());
            List<EntityMention> mentions = store.reader().findMentionsByDocument("doc-1");
            assertEquals(List.of(old), mentions);
            assertTrue(store.reader().isDocumentResolved("doc-1"));
        }

        @Test
        @DisplayName("Should roll back when closed without commit")
        void testCloseRollsBack() {
            try (StoreTransaction tx = store.begin("doc-1")) {
                tx.insertCanonicalEntity(CanonicalEntity.builder()
                        .type(EntityType.LOCATION).canonicalText("Paris").canonicalNormalized("paris").build());
            }
            assertEquals(0, store.reader().countCanonicalEntities());
        }

        @Test
        @DisplayName("Should refuse use after commit")
        void testInactive() {
            StoreTransaction tx = store.begin("doc-1");
            tx.commit();

            assertThrows(IllegalStateException.class, () -> tx.markDocumentResolved("doc-1"));
            assertDoesNotThrow(tx::close);
        }

        @Test
        @DisplayName("Should serialize transactions and time out waiting writers")
        void testSerialized() throws Exception {
            InMemoryCanonicalStore shortTimeout = new InMemoryCanonicalStore(50);
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> {
                try (StoreTransaction tx = shortTimeout.begin("holder")) {
                    held.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    tx.commit();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertTrue(held.await(5, TimeUnit.SECONDS));

            LockAcquisitionException e = assertThrows(LockAcquisitionException.class, () -> shortTimeout.begin("waiter"));
            assertEquals("waiter", e.getKey());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            try (StoreTransaction tx = shortTimeout.begin("after")) {
                tx.commit();
            }
        }

        @Test
        @DisplayName("Should reject use from another thread")
        void testOwnerThread() throws Exception {
            try (StoreTransaction tx = store.begin("doc-1")) {
                CompletableFuture<Throwable> attempt = CompletableFuture.supplyAsync(() -> {
                    try {
                        tx.markDocumentResolved("doc-1");
                        return null;
                    } catch (IllegalStateException e) {
                        return e;
                    }
                });
                assertInstanceOf(IllegalStateException.class, attempt.get(5, TimeUnit.SECONDS));
            }
        }
    }

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        @DisplayName("Should reject a second alias with the same normalized text for one entity")
        void testDuplicateAlias() {
            CanonicalEntity entity = seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein");

            try (StoreTransaction tx = store.begin("dup")) {
                DuplicateAliasException e = assertThrows(DuplicateAliasException.class, () ->
                        tx.insertAlias(EntityAlias.builder()
                                .entityType(EntityType.PERSON)
                                .canonicalEntityId(entity.getId())
                                .aliasText("JEFFREY EPSTEIN")
                                .aliasNormalized("jeffrey epstein")
                                .build()));
                assertEquals(entity.getId(), e.getCanonicalEntityId());
                assertEquals("jeffrey epstein", e.getAliasNormalized());
            }
        }

        @Test
        @DisplayName("Should allow the same normalized alias on different entities")
        void testSharedAlias() {
            seed(store, EntityType.PERSON, "Adam Smith", "adam smith", "smith");
            seed(store, EntityType.PERSON, "Will Smith", "will smith", "smith");

            assertEquals(2, store.reader().findAliases(EntityType.PERSON, "smith", 20).size());
        }

        @Test
        @DisplayName("Should reject a duplicate candidate link")
        void testDuplicateLink() {
            CanonicalEntity candidate = seed(store, EntityType.PERSON, "Adam Smith", "adam smith");
            CanonicalEntity placeholder = seed(store, EntityType.PERSON, "Smith", "smith");
            EntityMention m = mention("doc-1", placeholder.getId());

            try (StoreTransaction tx = store.begin("links")) {
                tx.insertMention(m);
                tx.insertCandidateLink(link(m.getId(), candidate.getId()));
                assertThrows(DuplicateCandidateLinkException.class,
                        () -> tx.insertCandidateLink(link(m.getId(), candidate.getId())));
            }
        }

        @Test
        @DisplayName("Should reject rows pointing at unknown canonical entities")
        void testUnknownCanonical() {
            try (StoreTransaction tx = store.begin("bad")) {
                assertThrows(CanonicalStoreException.class, () -> tx.insertMention(mention("doc-1", "missing")));
            }
        }
    }

    @Nested
    @DisplayName("Adjudication writes")
    class Adjudication {

        @Test
        @DisplayName("Should move mentions and missing aliases, then delete the source entity")
        void testMergeOperations() {
            CanonicalEntity target = seed(store, EntityType.PERSON, "Adam Smith", "adam smith", "smith");
            CanonicalEntity placeholder = seed(store, EntityType.PERSON, "John Smith", "john smith", "smith");
            EntityMention m = mention("doc-1", placeholder.getId());
            try (StoreTransaction tx = store.begin("setup")) {
                tx.insertMention(m);
                tx.commit();
            }

            try (StoreTransaction tx = store.begin("merge")) {
                assertThrows(IllegalStateException.class, () -> tx.deleteCanonicalEntity(placeholder.getId()));
                assertEquals(1, tx.reassignMentions(placeholder.getId(), target.getId()));
                assertEquals(1, tx.migrateAliases(placeholder.getId(), target.getId()));
                tx.deleteCanonicalEntity(placeholder.getId());
                tx.commit();
            }

            assertTrue(store.reader().findCanonicalEntity(placeholder.getId()).isEmpty());
            assertEquals(target.getId(), store.reader().findMention(m.getId()).orElseThrow().getCanonicalEntityId());
            assertTrue(store.reader().findAlias(target.getId(), "john smith").isPresent());
            assertEquals(1, store.reader().findAliases(EntityType.PERSON, "smith", 20).size());
        }

        @Test
        @DisplayName("Should update link status and reject unknown links")
        void testUpdateLinkStatus() {
            CanonicalEntity candidate = seed(store, EntityType.PERSON, "Adam Smith", "adam smith");
            CanonicalEntity placeholder = seed(store, EntityType.PERSON, "Smith", "smith");
            EntityMention m = mention("doc-1", placeholder.getId());
            EntityCandidateLink l = link(m.getId(), candidate.getId());
            try (StoreTransaction tx = store.begin("setup")) {
                tx.insertMention(m);
                tx.insertCandidateLink(l);
                tx.commit();
            }

            try (StoreTransaction tx = store.begin("review")) {
                EntityCandidateLink updated = tx.updateCandidateLinkStatus(l.getId(), CandidateLinkStatus.REJECTED);
                assertEquals(CandidateLinkStatus.REJECTED, updated.getStatus());
                assertThrows(IllegalArgumentException.class,
                        () -> tx.updateCandidateLinkStatus("missing", CandidateLinkStatus.ACCEPTED));
                tx.commit();
            }

            assertEquals(0, store.reader().countCandidateLinksByStatus(CandidateLinkStatus.PENDING));
            assertEquals(1, store.reader().findCandidateLinksByStatus(CandidateLinkStatus.REJECTED, 0, 10).size());
        }
    }

    @Test
    @DisplayName("Should find documents mentioning every given entity")
    void testDocumentsMentioningAll() {
        CanonicalEntity a = seed(store, EntityType.PERSON, "Jeffrey Epstein", "jeffrey epstein");
        CanonicalEntity b = seed(store, EntityType.PERSON, "Bill Clinton", "bill clinton");
        try (StoreTransaction tx = store.begin("setup")) {
            tx.insertMention(mention("doc-1", a.getId()));
            tx.insertMention(mention("doc-1", b.getId()));
            tx.insertMention(mention("doc-2", a.getId()));
            tx.insertMention(mention("doc-3", b.getId()));
            tx.commit();
        }

        assertEquals(List.of("doc-1"), store.reader().findDocumentsMentioningAll(List.of(a.getId(), b.getId()), 10));
    }

    @Test
    @DisplayName("Should clear the resolved flag outside a transaction")
    void testMarkUnresolved() {
        try (StoreTransaction tx = store.begin("doc-1")) {
            tx.markDocumentResolved("doc-1");
            tx.commit();
        }
        store.markDocumentUnresolved("doc-1");
        assertFalse(store.reader().isDocumentResolved("doc-1"));
    }
}
