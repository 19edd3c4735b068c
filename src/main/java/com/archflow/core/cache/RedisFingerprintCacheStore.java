package com.archflow.core.cache;

import com.archflow.core.model.DesignBundle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed store: one JSON string per fingerprint with a native key TTL.
 */
public class RedisFingerprintCacheStore implements FingerprintCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisFingerprintCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisFingerprintCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key(fingerprint));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis read failed for " + fingerprint, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            StoredEntry stored = objectMapper.readValue(json, StoredEntry.class);
            return Optional.of(new CacheEntry(stored.fingerprint(), stored.bundle(),
                    Instant.ofEpochMilli(stored.createdAt()), Duration.ofMillis(stored.ttlMillis())));
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException("Unreadable cache entry for " + fingerprint, e);
        }
    }

    @Override
    public void set(String fingerprint, CacheEntry entry, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new StoredEntry(entry.fingerprint(), entry.bundle(),
                    entry.createdAt().toEpochMilli(), entry.ttl().toMillis()));
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException("Serialization failed for " + fingerprint, e);
        }
        try {
            redisTemplate.opsForValue().set(key(fingerprint), json, ttl);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis write failed for " + fingerprint, e);
        }
    }

    @Override
    public void delete(String fingerprint) {
        try {
            redisTemplate.delete(key(fingerprint));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis delete failed for " + fingerprint, e);
        }
    }

    @Override
    public int size() {
        return -1;
    }

    @Override
    public void clear() {
        try {
            Set<String> keys = redisTemplate.keys(keyPrefix + "*");
            if (keys != null && !keys.isEmpty()) {
                Long removed = redisTemplate.delete(keys);
                log.info("Cleared {} cached designs from Redis", removed);
            }
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis clear failed", e);
        }
    }

    @Override
    public int removeExpired(Instant now) {
        // Redis expires keys on its own
        return 0;
    }

    private String key(String fingerprint) {
        return keyPrefix + fingerprint;
    }

    record StoredEntry(String fingerprint, DesignBundle bundle, long createdAt, long ttlMillis) {}
}
