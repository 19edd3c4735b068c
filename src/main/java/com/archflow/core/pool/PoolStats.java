package com.archflow.core.pool;

import com.archflow.core.llm.ModelRole;

import java.util.Map;

/**
 * Point-in-time view of the pool, one entry per role.
 */
public record PoolStats(Map<ModelRole, RoleStats> roles) {

    public PoolStats {
        roles = Map.copyOf(roles);
    }

    public RoleStats role(ModelRole role) {
        return roles.get(role);
    }

    /**
     * @param total     pooled capacity
     * @param inUse     pooled entries currently leased
     * @param available pooled entries on the free list
     * @param temporary live temporary clients; never part of {@code total}
     */
    public record RoleStats(int total, int inUse, int available, int temporary) {}
}
