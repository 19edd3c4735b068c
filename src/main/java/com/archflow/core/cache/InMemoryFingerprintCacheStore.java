package com.archflow.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Expiry is left to the cache's lazy check and {@link #removeExpired}.
 */
public class InMemoryFingerprintCacheStore implements FingerprintCacheStore {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void set(String fingerprint, CacheEntry entry, Duration ttl) {
        entries.put(fingerprint, entry);
    }

    @Override
    public void delete(String fingerprint) {
        entries.remove(fingerprint);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int removeExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }
}
