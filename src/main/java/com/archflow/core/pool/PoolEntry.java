package com.archflow.core.pool;

import com.archflow.core.llm.ChatCompletionClient;
import com.archflow.core.llm.ModelRole;

import java.time.Instant;

/**
 * One chat-completion client owned by the {@link ModelClientPool}. The in-use flag is
 * only read and written while the owning role's lock is held.
 */
public final class PoolEntry {

    private final ModelRole role;
    private final ChatCompletionClient client;
    private final Instant createdAt;
    private final boolean temporary;
    private boolean inUse;

    PoolEntry(ModelRole role, ChatCompletionClient client, Instant createdAt, boolean temporary) {
        this.role = role;
        this.client = client;
        this.createdAt = createdAt;
        this.temporary = temporary;
    }

    public ModelRole role() {
        return role;
    }

    public ChatCompletionClient client() {
        return client;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isTemporary() {
        return temporary;
    }

    boolean isInUse() {
        return inUse;
    }

    void inUse(boolean inUse) {
        this.inUse = inUse;
    }
}
