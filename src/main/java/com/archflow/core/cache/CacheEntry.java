package com.archflow.core.cache;

import com.archflow.core.model.DesignBundle;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached bundle. Entries are never mutated, only replaced.
 */
public record CacheEntry(String fingerprint, DesignBundle bundle, Instant createdAt, Duration ttl) {

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }
}
