package com.nexus.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process leases backed by one {@link ReentrantLock} per key. Suitable for a single JVM;
 * a lease must be closed by the thread that acquired it.
 */
public class LocalLeaseManager implements LeaseManager {
    private static final Logger log = LoggerFactory.getLogger(LocalLeaseManager.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Lease acquire(String key, Duration timeout) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("lease.timeout key={} timeoutMs={}", key, timeout.toMillis());
                throw new LeaseTimeoutException(key, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LeaseTimeoutException(key, timeout, e);
        }
        log.debug("Lease acquired: {}", key);
        return new LocalLease(key, lock);
    }

    boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    private static final class LocalLease implements Lease {
        private final String key;
        private final ReentrantLock lock;
        private final Instant acquiredAt = Instant.now();
        private final AtomicBoolean released = new AtomicBoolean();

        private LocalLease(String key, ReentrantLock lock) {
            this.key = key;
            this.lock = lock;
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
            if (released.compareAndSet(false, true) && lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Lease released: {}", key);
            }
        }
    }
}
