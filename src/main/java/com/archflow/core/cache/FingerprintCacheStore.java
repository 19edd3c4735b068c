package com.archflow.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Key/value store behind the result cache. Implementations may throw
 * {@link CacheUnavailableException}; the cache treats that as a miss.
 */
public interface FingerprintCacheStore {

    Optional<CacheEntry> get(String fingerprint);

    void set(String fingerprint, CacheEntry entry, Duration ttl);

    void delete(String fingerprint);

    /**
     * Number of stored entries, or {@code -1} when the store cannot count cheaply.
     */
    int size();

    void clear();

    /**
     * Removes entries that expired before {@code now}.
     *
     * @return number of entries removed
     */
    int removeExpired(Instant now);
}
