package com.archflow.core.pool;

import com.archflow.config.PipelineProperties;
import com.archflow.core.llm.ModelClientFactory;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Role-partitioned pool of pre-warmed chat-completion clients.
 * <p>
 * Every role has a fixed capacity created up front. {@link #acquire} hands out a free
 * entry when one exists; when the role is exhausted it fabricates a temporary,
 * unpooled client instead of blocking. With {@code max-temporary >= 0} the number of
 * live temporary clients is capped and an acquire at the cap waits up to
 * {@code temporary-wait} before failing with {@link PoolExhaustedException}.
 * <p>
 * Each role is guarded by its own lock, so acquire/release on one role never
 * contends with another.
 */
public class ModelClientPool {

    private static final Logger log = LoggerFactory.getLogger(ModelClientPool.class);

    private final ModelClientFactory factory;
    private final PipelineMetrics metrics;
    private final int maxTemporary;
    private final Duration temporaryWait;
    private final Duration drainTimeout;
    private final Map<ModelRole, RolePool> pools = new EnumMap<>(ModelRole.class);

    private volatile boolean shutdown;

    public ModelClientPool(ModelClientFactory factory, PipelineProperties.Pool properties, PipelineMetrics metrics) {
        this.factory = factory;
        this.metrics = metrics;
        this.maxTemporary = properties.getMaxTemporary();
        this.temporaryWait = properties.getTemporaryWait();
        this.drainTimeout = properties.getDrainTimeout();
        for (ModelRole role : ModelRole.values()) {
            int size = Math.max(0, properties.sizeFor(role));
            pools.put(role, new RolePool(role, size));
        }
        log.info("Model client pool initialized: MAIN={}, CREATIVE={}, MINI={}, maxTemporary={}",
                properties.getMainSize(), properties.getCreativeSize(), properties.getMiniSize(),
                maxTemporary < 0 ? "unbounded" : maxTemporary);
    }

    /**
     * Leases a client for the given role. The caller must close the returned lease.
     *
     * @throws IllegalStateException  if the pool has been shut down
     * @throws PoolExhaustedException if a temporary-client cap is configured and the wait elapsed
     */
    public PooledClient acquire(ModelRole role) {
        if (shutdown) {
            throw new IllegalStateException("Model client pool is shut down");
        }
        return new PooledClient(pools.get(role).acquire(), this);
    }

    void release(PoolEntry entry) {
        pools.get(entry.role()).release(entry);
    }

    public PoolStats stats() {
        Map<ModelRole, PoolStats.RoleStats> roles = new EnumMap<>(ModelRole.class);
        pools.forEach((role, pool) -> roles.put(role, pool.snapshot()));
        return new PoolStats(roles);
    }

    /**
     * Rejects further acquires and waits up to the drain timeout for leased entries to come back.
     */
    public void shutdown() {
        shutdown = true;
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        for (RolePool pool : pools.values()) {
            if (!pool.awaitDrained(deadline)) {
                log.warn("Pool {} did not drain within {}; {} entries still leased",
                        pool.role, drainTimeout, pool.snapshot().inUse());
            }
        }
        log.info("Model client pool shut down");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private final class RolePool {
        private final ModelRole role;
        private final int capacity;
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();
        private final Deque<PoolEntry> free = new ArrayDeque<>();
        private final Set<PoolEntry> leased = Collections.newSetFromMap(new IdentityHashMap<>());
        private int temporaryLive;

        RolePool(ModelRole role, int capacity) {
            this.role = role;
            this.capacity = capacity;
            for (int i = 0; i < capacity; i++) {
                free.addLast(new PoolEntry(role, factory.create(role), Instant.now(), false));
            }
        }

        PoolEntry acquire() {
            lock.lock();
            try {
                long remaining = temporaryWait.toNanos();
                while (true) {
                    PoolEntry entry = free.pollFirst();
                    if (entry != null) {
                        entry.inUse(true);
                        leased.add(entry);
                        return entry;
                    }
                    if (maxTemporary < 0 || temporaryLive < maxTemporary) {
                        temporaryLive++;
                        break;
                    }
                    if (remaining <= 0) {
                        throw new PoolExhaustedException(role, "Pool " + role + " exhausted: "
                                + capacity + " pooled and " + temporaryLive + " temporary clients in use");
                    }
                    try {
                        remaining = changed.awaitNanos(remaining);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("Interrupted while waiting for a " + role + " client");
                    }
                }
            } finally {
                lock.unlock();
            }
            return createTemporary();
        }

        private PoolEntry createTemporary() {
            log.warn("Pool {} exhausted (size={}), creating temporary client", role, capacity);
            metrics.incrementTemporaryClients(role.name());
            try {
                PoolEntry entry = new PoolEntry(role, factory.create(role), Instant.now(), true);
                entry.inUse(true);
                return entry;
            } catch (RuntimeException e) {
                releaseTemporarySlot();
                throw e;
            }
        }

        void release(PoolEntry entry) {
            if (entry.isTemporary()) {
                releaseTemporarySlot();
                return;
            }
            lock.lock();
            try {
                if (leased.remove(entry)) {
                    entry.inUse(false);
                    free.addLast(entry);
                    changed.signalAll();
                } else {
                    log.warn("Ignoring release of {} entry that is not leased", role);
                }
            } finally {
                lock.unlock();
            }
        }

        private void releaseTemporarySlot() {
            lock.lock();
            try {
                temporaryLive--;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        PoolStats.RoleStats snapshot() {
            lock.lock();
            try {
                return new PoolStats.RoleStats(capacity, leased.size(), free.size(), temporaryLive);
            } finally {
                lock.unlock();
            }
        }

        boolean awaitDrained(long deadlineNanos) {
            lock.lock();
            try {
                while (!leased.isEmpty()) {
                    long remaining = deadlineNanos - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    changed.awaitNanos(remaining);
                }
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } finally {
                lock.unlock();
            }
        }
    }
}
