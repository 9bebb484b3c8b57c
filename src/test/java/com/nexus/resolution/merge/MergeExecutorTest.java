package com.nexus.resolution.merge;

import com.nexus.resolution.api.CancellationToken;
import com.nexus.resolution.api.ResolutionCancelledException;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.EntityStatus;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.graph.GraphWriteException;
import com.nexus.resolution.graph.InMemoryCanonicalStore;
import com.nexus.resolution.lock.Lease;
import com.nexus.resolution.lock.LeaseTimeoutException;
import com.nexus.resolution.lock.LocalLeaseManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MergeExecutorTest {

    private InMemoryCanonicalStore store;
    private LocalLeaseManager leaseManager;
    private MergeExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        leaseManager = new LocalLeaseManager();
        executor = MergeExecutor.builder()
                .store(store)
                .leaseManager(leaseManager)
                .retryPolicy(RetryPolicy.noRetry())
                .leaseTimeout(Duration.ofSeconds(2))
                .build();
    }

    private static CandidateEntity candidate(String name, String ingestionId) {
        return CandidateEntity.builder()
                .name(name)
                .type(EntityType.PERSON)
                .ingestionId(ingestionId)
                .build();
    }

    private String create(String name, String ingestionId) {
        return executor.applyDistinct(candidate(name, ingestionId), CancellationToken.create()).canonicalId();
    }

    @Nested
    @DisplayName("Create and merge")
    class CreateAndMerge {

        @Test
        @DisplayName("Distinct candidates create a canonical carrying their name as alias")
        void testCreate() {
            MergeResult result = executor.applyDistinct(candidate("Marie-Ève Girard", "ing-1"), CancellationToken.create());

            assertEquals(MergeResult.Outcome.CREATED, result.outcome());
            CanonicalEntity created = store.findById(result.canonicalId()).orElseThrow();
            assertEquals("Marie-Ève Girard", created.getPrimaryName());
            assertEquals("marie eve girard", created.getNormalizedName());
            assertTrue(created.hasAlias("marie eve girard"));
            assertTrue(created.hasIngestion("ing-1"));
        }

        @Test
        @DisplayName("A same-name canonical created after scoring absorbs the candidate")
        void testCreateRedirectsToUnscoredSameName() {
            String first = create("Marie-Eve Girard", "ing-1");

            MergeResult second = executor.applyDistinct(candidate("Marie Eve Girard", "ing-2"), Set.of(),
                    CancellationToken.create());

            assertEquals(MergeResult.Outcome.MERGED, second.outcome());
            assertEquals(first, second.canonicalId());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("A same-name canonical that was scored is never merged into")
        void testScoredSameNameStaysDistinct() {
            String first = create("John Smith", "ing-1");

            MergeResult second = executor.applyDistinct(candidate("John Smith", "ing-2"), List.of(first),
                    CancellationToken.create());

            assertEquals(MergeResult.Outcome.CREATED, second.outcome());
            assertNotEquals(first, second.canonicalId());
            assertEquals(2, store.findByNormalizedName(EntityType.PERSON, "john smith").size());
        }

        @Test
        @DisplayName("A scored canonical merged away since scoring still counts as scored")
        void testScoredSurvivorStaysDistinct() {
            String scored = create("John Smith", "ing-1");
            String survivor = executor.applyConfirmedDistinct(candidate("John Smith", "ing-2"),
                    CancellationToken.create()).canonicalId();
            executor.mergeCanonicals(scored, survivor, "analyst", "same person");

            MergeResult result = executor.applyDistinct(candidate("John Smith", "ing-3"), List.of(scored),
                    CancellationToken.create());

            assertEquals(MergeResult.Outcome.CREATED, result.outcome());
            assertNotEquals(survivor, result.canonicalId());
        }

        @Test
        @DisplayName("A confirmed distinct candidate gets its own canonical despite a same-name one")
        void testConfirmedDistinct() {
            String first = create("John Smith", "ing-1");

            MergeResult second = executor.applyConfirmedDistinct(candidate("John Smith", "ing-2"),
                    CancellationToken.create());
            MergeResult replay = executor.applyConfirmedDistinct(candidate("John Smith", "ing-2"),
                    CancellationToken.create());

            assertEquals(MergeResult.Outcome.CREATED, second.outcome());
            assertNotEquals(first, second.canonicalId());
            assertEquals(MergeResult.Outcome.ALREADY_APPLIED, replay.outcome());
            assertEquals(second.canonicalId(), replay.canonicalId());
            assertEquals(2, store.findActive(EntityType.PERSON).size());
        }

        @Test
        @DisplayName("Edge writes are retried like canonical writes")
        void testCreateRelationshipRetried() {
            InMemoryCanonicalStore flaky = new InMemoryCanonicalStore() {
                private int calls;

                @Override
                public Relationship createRelationship(String subjectId, String predicate, String objectId,
                                                       double confidence, String provenance) {
                    if (++calls == 1) {
                        throw new GraphWriteException("transient");
                    }
                    return super.createRelationship(subjectId, predicate, objectId, confidence, provenance);
                }
            };
            MergeExecutor retrying = MergeExecutor.builder()
                    .store(flaky)
                    .retryPolicy(new RetryPolicy(2, Duration.ofMillis(1)))
                    .build();

            Relationship edge = retrying.createRelationship("a", "WORKS_FOR", "b", 0.9, "test");

            assertEquals("WORKS_FOR", edge.getPredicate());
            assertEquals(1, flaky.findRelationships("a").size());
        }

        @Test
        @DisplayName("Merging adds the alias and records the ingestion")
        void testMerge() {
            String id = create("Marie-Eve Girard", "ing-1");

            MergeResult result = executor.applyMerge(candidate("Marie Eve G.", "ing-2"), id, CancellationToken.create());

            assertEquals(MergeResult.Outcome.MERGED, result.outcome());
            assertTrue(result.aliasAdded());
            CanonicalEntity merged = store.findById(id).orElseThrow();
            assertTrue(merged.hasAlias("marie eve g"));
            assertTrue(merged.hasIngestion("ing-2"));
            assertEquals("Marie-Eve Girard", merged.getPrimaryName());
        }

        @Test
        @DisplayName("Replaying an ingestion is a no-op")
        void testIdempotentReplay() {
            String id = create("Marie-Eve Girard", "ing-1");
            executor.applyMerge(candidate("Marie Eve G.", "ing-2"), id, CancellationToken.create());
            CanonicalEntity before = store.findById(id).orElseThrow();

            MergeResult replayMerge = executor.applyMerge(candidate("Marie Eve G.", "ing-2"), id, CancellationToken.create());
            MergeResult replayCreate = executor.applyDistinct(candidate("Marie-Eve Girard", "ing-1"), CancellationToken.create());

            assertEquals(MergeResult.Outcome.ALREADY_APPLIED, replayMerge.outcome());
            assertEquals(MergeResult.Outcome.ALREADY_APPLIED, replayCreate.outcome());
            assertFalse(replayMerge.mutated());
            CanonicalEntity after = store.findById(id).orElseThrow();
            assertEquals(before.getAliases().size(), after.getAliases().size());
            assertEquals(before.getIngestionIds(), after.getIngestionIds());
        }

        @Test
        @DisplayName("Cancellation before the first mutation leaves the graph untouched")
        void testCancelledBeforeMutation() {
            CancellationToken token = CancellationToken.create();
            assertTrue(token.cancel());

            assertThrows(ResolutionCancelledException.class,
                    () -> executor.applyDistinct(candidate("Marie-Eve Girard", "ing-1"), token));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("A committed token can no longer be cancelled")
        void testCommittedToken() {
            CancellationToken token = CancellationToken.create();
            executor.applyDistinct(candidate("Marie-Eve Girard", "ing-1"), token);

            assertTrue(token.isCommitted());
            assertFalse(token.cancel());
        }

        @Test
        @DisplayName("Lease timeouts surface to the caller")
        void testLeaseTimeout() throws Exception {
            String id = create("Marie-Eve Girard", "ing-1");
            MergeExecutor impatient = MergeExecutor.builder()
                    .store(store)
                    .leaseManager(leaseManager)
                    .leaseTimeout(Duration.ofMillis(50))
                    .build();
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                try (Lease ignored = leaseManager.acquire(id, Duration.ofSeconds(1))) {
                    held.countDown();
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            holder.start();
            assertTrue(held.await(2, TimeUnit.SECONDS));
            try {
                assertThrows(LeaseTimeoutException.class,
                        () -> impatient.applyMerge(candidate("Marie Eve G.", "ing-2"), id, CancellationToken.create()));
            } finally {
                release.countDown();
                holder.join(2000);
            }
        }
    }

    @Nested
    @DisplayName("Redirect chains")
    class RedirectChains {

        @Test
        @DisplayName("Merges into a merged-away target land on its survivor")
        void testFollowsRedirect() {
            String a = create("Marie-Eve Girard", "ing-1");
            String b = create("M. E. Girard", "ing-2");
            executor.mergeCanonicals(b, a, "analyst", "same person");

            MergeResult result = executor.applyMerge(candidate("Marie Girard", "ing-3"), b, CancellationToken.create());

            assertEquals(a, result.canonicalId());
            assertTrue(store.findById(a).orElseThrow().hasIngestion("ing-3"));
        }

        @Test
        @DisplayName("Redirect cycles are detected")
        void testCycle() {
            store.createCanonical(CanonicalEntity.builder().id("x").type(EntityType.PERSON).primaryName("x")
                    .status(EntityStatus.MERGED).mergedInto("y").build());
            store.createCanonical(CanonicalEntity.builder().id("y").type(EntityType.PERSON).primaryName("y")
                    .status(EntityStatus.MERGED).mergedInto("x").build());

            MergeChainException e = assertThrows(MergeChainException.class, () -> executor.resolveSurvivor("x"));
            assertEquals("x", e.getCanonicalId());
        }

        @Test
        @DisplayName("Redirects to missing canonicals are detected")
        void testDanglingRedirect() {
            store.createCanonical(CanonicalEntity.builder().id("x").type(EntityType.PERSON).primaryName("x")
                    .status(EntityStatus.MERGED).mergedInto("gone").build());

            assertThrows(MergeChainException.class, () -> executor.resolveSurvivor("x"));
            assertThrows(MergeChainException.class, () -> executor.resolveSurvivor("unknown"));
        }
    }

    @Nested
    @DisplayName("Canonical merges")
    class CanonicalMerges {

        @Test
        @DisplayName("Source becomes a redirect and its aliases, ingestions and edges move")
        void testMergeCanonicals() {
            String a = create("Marie-Eve Girard", "ing-1");
            String b = create("M. E. Girard", "ing-2");
            String org = executor.applyDistinct(CandidateEntity.builder().name("Hydro-Quebec")
                    .type(EntityType.ORGANIZATION).ingestionId("ing-3").build(), CancellationToken.create()).canonicalId();
            store.createRelationship(b, "WORKS_FOR", org, 0.9, "test");
            List<String> notified = new ArrayList<>();
            executor.addMergeListener((source, target) -> notified.add(source + "->" + target));

            MergeResult result = executor.mergeCanonicals(b, a, "analyst", "same person");

            assertEquals(MergeResult.Outcome.CANONICALS_MERGED, result.outcome());
            assertEquals(b, result.absorbedId());
            CanonicalEntity survivor = store.findById(a).orElseThrow();
            assertTrue(survivor.hasAlias("m e girard"));
            assertTrue(survivor.hasIngestion("ing-2"));
            assertEquals(b + "->" + a, notified.get(0));
            assertEquals(a, store.findById(b).orElseThrow().getMergedInto());
            List<Relationship> edges = store.findRelationships(a);
            assertEquals(1, edges.size());
            assertTrue(edges.get(0).sameEdge(a, "WORKS_FOR", org));
        }

        @Test
        @DisplayName("Merging in either direction after a merge is already applied")
        void testNoLoopOnReverseMerge() {
            String a = create("Marie-Eve Girard", "ing-1");
            String b = create("M. E. Girard", "ing-2");
            executor.mergeCanonicals(b, a, "analyst", null);

            assertEquals(MergeResult.Outcome.ALREADY_APPLIED, executor.mergeCanonicals(a, b, "analyst", null).outcome());
            assertEquals(MergeResult.Outcome.ALREADY_APPLIED, executor.mergeCanonicals(b, a, "analyst", null).outcome());
            assertEquals(a, executor.resolveSurvivor(b));
        }

        @Test
        @DisplayName("Self-merge is rejected")
        void testSelfMerge() {
            assertThrows(IllegalArgumentException.class, () -> executor.mergeCanonicals("c1", "c1", "analyst", null));
        }

        @Test
        @DisplayName("A failed redirect restores both canonicals and their edges")
        void testCompensation() {
            FailingRedirectStore failing = new FailingRedirectStore();
            MergeExecutor fragile = MergeExecutor.builder()
                    .store(failing)
                    .retryPolicy(RetryPolicy.noRetry())
                    .build();
            String a = fragile.applyDistinct(candidate("Marie-Eve Girard", "ing-1"), CancellationToken.create()).canonicalId();
            String b = fragile.applyDistinct(candidate("M. E. Girard", "ing-2"), CancellationToken.create()).canonicalId();
            String c = fragile.applyDistinct(candidate("Louise Roy", "ing-3"), CancellationToken.create()).canonicalId();
            Relationship edge = failing.createRelationship(b, "KNOWS", c, 0.8, "test");

            assertThrows(GraphWriteException.class, () -> fragile.mergeCanonicals(b, a, "analyst", null));

            CanonicalEntity target = failing.findById(a).orElseThrow();
            assertFalse(target.hasAlias("m e girard"));
            assertFalse(target.hasIngestion("ing-2"));
            assertTrue(failing.findById(b).orElseThrow().isActive());
            assertEquals(List.of(edge.getId()), failing.findRelationships(b).stream().map(Relationship::getId).toList());
            assertTrue(failing.findRelationships(a).isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent merges into one canonical lose no update")
        void testConcurrentMerges() throws Exception {
            String id = create("Marie-Eve Girard", "ing-0");
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<MergeResult>> futures = new ArrayList<>();
            try {
                for (int i = 1; i <= threads; i++) {
                    CandidateEntity candidate = CandidateEntity.builder()
                            .name("Marie Girard " + i)
                            .type(EntityType.PERSON)
                            .ingestionId("ing-" + i)
                            .attribute("roles", List.of("role-" + i))
                            .build();
                    futures.add(pool.submit(() -> {
                        start.await();
                        return executor.applyMerge(candidate, id, CancellationToken.create());
                    }));
                }
                start.countDown();
                for (Future<MergeResult> future : futures) {
                    assertEquals(MergeResult.Outcome.MERGED, future.get(10, TimeUnit.SECONDS).outcome());
                }
            } finally {
                pool.shutdownNow();
            }

            CanonicalEntity merged = store.findById(id).orElseThrow();
            assertEquals(threads + 1, merged.getIngestionIds().size());
            assertEquals(threads + 1, merged.getAliases().size());
            assertEquals(threads, ((List<?>) merged.getAttribute("roles")).size());
        }

        @Test
        @DisplayName("Concurrent identical candidates create exactly one canonical")
        void testConcurrentCreates() throws Exception {
            int threads = 6;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<MergeResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    CandidateEntity candidate = candidate("Marie-Eve Girard", "ing-" + i);
                    futures.add(pool.submit(() -> {
                        start.await();
                        return executor.applyDistinct(candidate, CancellationToken.create());
                    }));
                }
                start.countDown();
                Set<String> ids = new HashSet<>();
                for (Future<MergeResult> future : futures) {
                    ids.add(future.get(10, TimeUnit.SECONDS).canonicalId());
                }
                assertEquals(1, ids.size());
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, store.findActive(EntityType.PERSON).size());
            assertEquals(threads, store.findActive(EntityType.PERSON).get(0).getIngestionIds().size());
        }

        @Test
        @DisplayName("Crossed canonical merges never deadlock or loop")
        void testCrossedCanonicalMerges() throws Exception {
            String a = create("Marie-Eve Girard", "ing-1");
            String b = create("M. E. Girard", "ing-2");
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<MergeResult> ab = pool.submit(() -> {
                    start.await();
                    return executor.mergeCanonicals(a, b, "one", null);
                });
                Future<MergeResult> ba = pool.submit(() -> {
                    start.await();
                    return executor.mergeCanonicals(b, a, "two", null);
                });
                start.countDown();
                ab.get(10, TimeUnit.SECONDS);
                ba.get(10, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            String survivor = executor.resolveSurvivor(a);
            assertEquals(survivor, executor.resolveSurvivor(b));
            assertEquals(1, store.findActive(EntityType.PERSON).size());
        }
    }

    /**
     * Fails every redirect write, so canonical merges must compensate.
     */
    private static class FailingRedirectStore extends InMemoryCanonicalStore {
        @Override
        public synchronized void markMerged(String sourceId, String targetId) {
            throw new GraphWriteException("redirect write failed");
        }
    }

    @Test
    @DisplayName("Attribute conflicts are counted on the result")
    void testConflictsFlagged() {
        MergeExecutor strict = MergeExecutor.builder()
                .store(store)
                .attributePolicy(new AttributePolicy(Set.of(), Set.of("birthDate")))
                .build();
        String id = strict.applyDistinct(CandidateEntity.builder().name("Marie-Eve Girard").type(EntityType.PERSON)
                .ingestionId("ing-1").attributes(Map.of("birthDate", "1980-04-02")).build(),
                CancellationToken.create()).canonicalId();

        MergeResult result = strict.applyMerge(CandidateEntity.builder().name("Marie Eve G.").type(EntityType.PERSON)
                .ingestionId("ing-2").attributes(Map.of("birthDate", "1981-04-02")).build(), id, CancellationToken.create());

        assertEquals(1, result.conflictsFlagged());
        assertTrue(store.findById(id).orElseThrow().hasConflicts());
    }
}
