package com.nexus.resolution.lock;

import com.nexus.resolution.graph.GraphConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LeaseManagerTest {

    @Nested
    @DisplayName("LocalLeaseManager")
    class LocalLeases {

        @Test
        @DisplayName("Should acquire and release a lease")
        void testAcquireRelease() {
            LocalLeaseManager manager = new LocalLeaseManager();
            try (Lease lease = manager.acquire("c1", Duration.ofSeconds(1))) {
                assertEquals("c1", lease.key());
                assertNotNull(lease.acquiredAt());
                assertTrue(manager.isLocked("c1"));
            }
            assertFalse(manager.isLocked("c1"));
        }

        @Test
        @DisplayName("Closing twice is harmless")
        void testDoubleClose() {
            LocalLeaseManager manager = new LocalLeaseManager();
            Lease lease = manager.acquire("c1", Duration.ofSeconds(1));
            lease.close();
            assertDoesNotThrow(lease::close);
            assertFalse(manager.isLocked("c1"));
        }

        @Test
        @DisplayName("Different keys do not block each other")
        void testDifferentKeys() {
            LocalLeaseManager manager = new LocalLeaseManager();
            try (Lease a = manager.acquire("c1", Duration.ofMillis(100));
                 Lease b = manager.acquire("c2", Duration.ofMillis(100))) {
                assertNotEquals(a.key(), b.key());
            }
        }

        @Test
        @DisplayName("Should time out while another thread holds the key")
        void testTimeout() throws Exception {
            LocalLeaseManager manager = new LocalLeaseManager();
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                try (Lease ignored = manager.acquire("c1", Duration.ofSeconds(1))) {
                    held.countDown();
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            holder.start();
            assertTrue(held.await(2, TimeUnit.SECONDS));

            LeaseTimeoutException e = assertThrows(LeaseTimeoutException.class,
                    () -> manager.acquire("c1", Duration.ofMillis(50)));
            assertEquals("c1", e.getKey());
            assertEquals(Duration.ofMillis(50), e.getTimeout());

            release.countDown();
            holder.join(2000);
        }

        @Test
        @DisplayName("Should serialize holders of the same key")
        void testMutualExclusion() throws Exception {
            LocalLeaseManager manager = new LocalLeaseManager();
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger maxInside = new AtomicInteger();
            int threadCount = 5;
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            try {
                for (int i = 0; i < threadCount; i++) {
                    executor.submit(() -> {
                        try {
                            start.await();
                            try (Lease ignored = manager.acquire("c1", Duration.ofSeconds(5))) {
                                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                                Thread.sleep(10);
                                inside.decrementAndGet();
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                start.countDown();
                assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, maxInside.get());
        }

        @Test
        @DisplayName("Create keys combine type and normalized name")
        void testCreateKey() {
            assertEquals("create:PERSON:marie eve girard", LeaseManager.createKey("PERSON", "marie eve girard"));
        }
    }

    @Nested
    @DisplayName("GraphLeaseManager")
    class GraphLeases {

        private final LeaseConfig fastRetry = new LeaseConfig(Duration.ofSeconds(30), Duration.ofMillis(10));

        @Test
        @DisplayName("Should acquire when the graph reports the caller as owner")
        void testAcquire() {
            LeaseGraph graph = new LeaseGraph(null);
            GraphLeaseManager manager = new GraphLeaseManager(graph, fastRetry);

            Lease lease = manager.acquire("c1", Duration.ofMillis(200));
            lease.close();

            assertEquals("c1", lease.key());
            assertTrue(graph.executed.stream().anyMatch(q -> q.contains("DELETE l")));
            assertEquals("c1", graph.lastDeleteParams.get("key"));
        }

        @Test
        @DisplayName("Should time out while another owner holds the lease")
        void testHeldElsewhere() {
            LeaseGraph graph = new LeaseGraph("other-process");
            GraphLeaseManager manager = new GraphLeaseManager(graph, fastRetry);

            assertThrows(LeaseTimeoutException.class, () -> manager.acquire("c1", Duration.ofMillis(50)));
            assertTrue(graph.attempts.get() > 1);
        }

        @Test
        @DisplayName("Graph errors during acquisition are retried until the deadline")
        void testGraphErrors() {
            LeaseGraph graph = new LeaseGraph(null);
            graph.failQueries = true;
            GraphLeaseManager manager = new GraphLeaseManager(graph, fastRetry);

            assertThrows(LeaseTimeoutException.class, () -> manager.acquire("c1", Duration.ofMillis(30)));
        }

        @Test
        @DisplayName("Expiry is written as epoch millis one TTL ahead")
        void testEpochMillisExpiry() {
            LeaseGraph graph = new LeaseGraph(null);
            GraphLeaseManager manager = new GraphLeaseManager(graph, fastRetry);

            try (Lease lease = manager.acquire("c1", Duration.ofMillis(200))) {
                Map<String, Object> params = graph.queryParams.get(0);
                assertInstanceOf(Long.class, params.get("now"));
                assertInstanceOf(Long.class, params.get("expiresAt"));
                assertEquals(30_000L, (Long) params.get("expiresAt") - (Long) params.get("now"));
            } finally {
                manager.close();
            }
        }

        @Test
        @DisplayName("A held lease is renewed until it is released")
        void testRenewal() throws InterruptedException {
            LeaseGraph graph = new LeaseGraph(null);
            GraphLeaseManager manager = new GraphLeaseManager(graph,
                    new LeaseConfig(Duration.ofMillis(100), Duration.ofMillis(10)));
            try {
                Lease lease = manager.acquire("c1", Duration.ofMillis(200));
                Thread.sleep(300);
                assertTrue(renewals(graph) >= 2, () -> "renewals: " + renewals(graph));

                lease.close();
                Thread.sleep(60);
                long afterRelease = renewals(graph);
                Thread.sleep(200);
                assertEquals(afterRelease, renewals(graph));
            } finally {
                manager.close();
            }
        }

        private long renewals(LeaseGraph graph) {
            return graph.queries.stream().filter(q -> q.contains("SET l.expiresAt = $expiresAt")).count();
        }

        @Test
        @DisplayName("Lease config requires positive durations")
        void testConfigValidation() {
            assertThrows(IllegalArgumentException.class, () -> new LeaseConfig(Duration.ZERO, Duration.ofMillis(10)));
            assertThrows(IllegalArgumentException.class, () -> new LeaseConfig(Duration.ofSeconds(1), null));
        }
    }

    /**
     * Answers lease MERGE queries with a fixed owner, or with the caller's own token when
     * {@code holder} is null.
     */
    private static class LeaseGraph implements GraphConnection {
        final List<String> executed = new ArrayList<>();
        final List<String> queries = new CopyOnWriteArrayList<>();
        final List<Map<String, Object>> queryParams = new CopyOnWriteArrayList<>();
        final AtomicInteger attempts = new AtomicInteger();
        final String holder;
        volatile boolean failQueries;
        Map<String, Object> lastDeleteParams = Map.of();

        LeaseGraph(String holder) {
            this.holder = holder;
        }

        @Override
        public void execute(String query, Map<String, Object> params) {
            executed.add(query);
            if (query.contains("DELETE l")) {
                lastDeleteParams = params;
            }
        }

        @Override
        public List<Map<String, Object>> query(String query, Map<String, Object> params) {
            attempts.incrementAndGet();
            queries.add(query);
            queryParams.add(params);
            if (failQueries) {
                throw new IllegalStateException("connection reset");
            }
            Object owner = holder != null ? holder : params.get("owner");
            return List.of(Map.of("owner", owner));
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public String getGraphName() {
            return "test-graph";
        }

        @Override
        public void createIndexes() {
            // no-op
        }

        @Override
        public void close() {
            // no-op
        }
    }
}
