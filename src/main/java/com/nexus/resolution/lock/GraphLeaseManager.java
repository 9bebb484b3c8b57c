package com.nexus.resolution.lock;

import com.nexus.resolution.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leases stored as {@code :Lease} nodes so that several JVMs writing the same graph
 * serialize merges on a canonical id.
 *
 * <p>Acquisition is an atomic {@code MERGE}: a lease whose {@code expiresAt} (epoch millis)
 * has passed is taken over by the caller. While held, a lease is renewed every half TTL, so a
 * slow merge keeps it. Each acquisition uses a fresh owner token, so graph leases are not
 * reentrant.</p>
 */
public class GraphLeaseManager implements LeaseManager, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GraphLeaseManager.class);

    private final GraphConnection connection;
    private final LeaseConfig config;
    private final String processId;
    private final ScheduledExecutorService renewer;

    public GraphLeaseManager(GraphConnection connection) {
        this(connection, LeaseConfig.defaults());
    }

    public GraphLeaseManager(GraphConnection connection, LeaseConfig config) {
        this.connection = connection;
        this.config = config;
        this.processId = ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        this.renewer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "lease-renewer");
            thread.setDaemon(true);
            return thread;
        });
        createLeaseIndex();
    }

    @Override
    public Lease acquire(String key, Duration timeout) {
        String owner = processId + "-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            if (attemptLease(key, owner)) {
                log.debug("Lease acquired: {} (attempt {})", key, attempts);
                GraphLease lease = new GraphLease(key, owner);
                long period = Math.max(1, config.ttl().toMillis() / 2);
                lease.renewal = renewer.scheduleAtFixedRate(() -> renew(key, owner), period, period,
                        TimeUnit.MILLISECONDS);
                return lease;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("lease.timeout key={} timeoutMs={} attempts={}", key, timeout.toMillis(), attempts);
                throw new LeaseTimeoutException(key, timeout);
            }
            try {
                Thread.sleep(config.retryDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LeaseTimeoutException(key, timeout, e);
            }
        }
    }

    private boolean attemptLease(String key, String owner) {
        long now = System.currentTimeMillis();
        String query = """
                MERGE (l:Lease {key: $key})
                ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
                ON MATCH SET l.owner = CASE WHEN l.expiresAt < $now THEN $owner ELSE l.owner END,
                             l.acquiredAt = CASE WHEN l.expiresAt < $now THEN $now ELSE l.acquiredAt END,
                             l.expiresAt = CASE WHEN l.expiresAt < $now THEN $expiresAt ELSE l.expiresAt END
                RETURN l.owner AS owner
                """;
        try {
            List<Map<String, Object>> rows = connection.query(query, Map.of(
                    "key", key,
                    "owner", owner,
                    "now", now,
                    "expiresAt", now + config.ttl().toMillis()
            ));
            return !rows.isEmpty() && owner.equals(rows.get(0).get("owner"));
        } catch (RuntimeException e) {
            log.warn("Lease attempt failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    private void renew(String key, String owner) {
        String query = """
                MATCH (l:Lease {key: $key, owner: $owner})
                SET l.expiresAt = $expiresAt
                RETURN l.owner AS owner
                """;
        try {
            List<Map<String, Object>> rows = connection.query(query, Map.of(
                    "key", key,
                    "owner", owner,
                    "expiresAt", System.currentTimeMillis() + config.ttl().toMillis()
            ));
            if (rows.isEmpty()) {
                log.warn("lease.lost key={} owner={}", key, owner);
            }
        } catch (RuntimeException e) {
            // the next period tries again
            log.warn("Failed to renew lease {}: {}", key, e.getMessage());
        }
    }

    private void release(String key, String owner) {
        String query = """
                MATCH (l:Lease {key: $key, owner: $owner})
                DELETE l
                """;
        try {
            connection.execute(query, Map.of("key", key, "owner", owner));
            log.debug("Lease released: {}", key);
        } catch (RuntimeException e) {
            // the TTL reclaims it
            log.warn("Failed to release lease {}: {}", key, e.getMessage());
        }
    }

    private void createLeaseIndex() {
        try {
            connection.execute("CREATE INDEX FOR (l:Lease) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("Lease index creation: {}", e.getMessage());
        }
    }

    /**
     * Stops renewing. Leases still held lapse after their TTL.
     */
    @Override
    public void close() {
        renewer.shutdownNow();
    }

    private final class GraphLease implements Lease {
        private final String key;
        private final String owner;
        private final Instant acquiredAt = Instant.now();
        private final AtomicBoolean released = new AtomicBoolean();
        private volatile ScheduledFuture<?> renewal;

        private GraphLease(String key, String owner) {
            this.key = key;
            this.owner = owner;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public Instant acquiredAt() {
            return acquiredAt;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                if (renewal != null) {
                    renewal.cancel(false);
                }
                release(key, owner);
            }
        }
    }
}
