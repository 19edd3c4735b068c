package com.archflow.core.pool;

import com.archflow.core.llm.ChatCompletionClient;
import com.archflow.core.llm.ModelRole;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A lease on one pool entry. Closing the lease returns the entry to the pool;
 * closing it again is a no-op.
 */
public final class PooledClient implements AutoCloseable {

    private final PoolEntry entry;
    private final ModelClientPool pool;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PooledClient(PoolEntry entry, ModelClientPool pool) {
        this.entry = entry;
        this.pool = pool;
    }

    public ChatCompletionClient client() {
        return entry.client();
    }

    public ModelRole role() {
        return entry.role();
    }

    public boolean isTemporary() {
        return entry.isTemporary();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.release(entry);
        }
    }

    @Override
    public void close() {
        release();
    }
}
