package com.archflow.core.cache;

import com.archflow.config.PipelineProperties;
import com.archflow.core.metrics.PipelineMetrics;
import com.archflow.core.model.DesignBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Result cache keyed by request fingerprint.
 * <p>
 * Best effort: any failure of the backing store is logged and treated as a miss
 * (on lookup) or ignored (on store), so a broken cache never fails a run.
 * Expiry is evaluated lazily on lookup.
 */
public class DesignCache {

    private static final Logger log = LoggerFactory.getLogger(DesignCache.class);

    private static final List<String> SHORT_REQUEST_INDICATORS = List.of(
            "my ", "our ", "company", "project", ".com", ".io", ".org", ".net",
            "client", "customer", "acme", "contoso", "$", "million");
    private static final List<String> MEDIUM_REQUEST_INDICATORS = List.of(
            "my ", "our ", "company", "client", "$");

    private final FingerprintCacheStore store;
    private final PipelineProperties.Cache properties;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public DesignCache(FingerprintCacheStore store, PipelineProperties.Cache properties,
                       PipelineMetrics metrics, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<DesignBundle> lookup(String fingerprint) {
        Optional<DesignBundle> bundle = read(fingerprint);
        if (bundle.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        metrics.recordCacheLookup(bundle.isPresent());
        return bundle;
    }

    /**
     * Second look for a caller whose {@link #lookup} already missed. A hit turns that
     * miss into a hit; another miss is not counted again.
     */
    public Optional<DesignBundle> recheck(String fingerprint) {
        Optional<DesignBundle> bundle = read(fingerprint);
        if (bundle.isPresent()) {
            misses.decrementAndGet();
            hits.incrementAndGet();
            metrics.recordCacheLookup(true);
        }
        return bundle;
    }

    private Optional<DesignBundle> read(String fingerprint) {
        Optional<CacheEntry> entry;
        try {
            entry = store.get(fingerprint);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for {}, treating as miss: {}", fingerprint, e.getMessage());
            return Optional.empty();
        }
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (entry.get().isExpired(clock.instant())) {
            log.debug("Cache entry {} expired at {}", fingerprint, entry.get().expiresAt());
            try {
                store.delete(fingerprint);
            } catch (RuntimeException e) {
                log.warn("Could not evict expired cache entry {}: {}", fingerprint, e.getMessage());
            }
            return Optional.empty();
        }
        return Optional.of(entry.get().bundle());
    }

    public void store(String fingerprint, DesignBundle bundle) {
        store(fingerprint, bundle, properties.getTtl());
    }

    public void store(String fingerprint, DesignBundle bundle, Duration ttl) {
        try {
            store.set(fingerprint, new CacheEntry(fingerprint, bundle, clock.instant(), ttl), ttl);
            log.info("Cached design {} (ttl={})", fingerprint, ttl);
        } catch (RuntimeException e) {
            log.warn("Cache store failed for {}: {}", fingerprint, e.getMessage());
        }
    }

    /**
     * Whether a finished design for these requirements is worth caching. With selective
     * caching on, only short generic requests qualify; anything that looks personal
     * (names, domains, budgets) or is long and detailed is skipped.
     */
    public boolean shouldCache(String requirements) {
        if (requirements == null || requirements.isBlank()) {
            return false;
        }
        if (!properties.isSelective()) {
            return true;
        }
        int words = requirements.strip().split("\\s+").length;
        String lower = requirements.toLowerCase(Locale.ROOT);
        if (words < 25) {
            return SHORT_REQUEST_INDICATORS.stream().noneMatch(lower::contains);
        }
        if (words < 50) {
            return MEDIUM_REQUEST_INDICATORS.stream().noneMatch(lower::contains);
        }
        return false;
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        double rate = total > 0 ? Math.round(h * 10000.0 / total) / 100.0 : 0.0;
        int entries;
        try {
            entries = store.size();
        } catch (RuntimeException e) {
            log.warn("Could not count cache entries: {}", e.getMessage());
            entries = -1;
        }
        return new CacheStats(entries, h, m, rate);
    }

    public void clear() {
        try {
            store.clear();
        } catch (RuntimeException e) {
            log.warn("Cache clear failed: {}", e.getMessage());
        }
        hits.set(0);
        misses.set(0);
    }

    public int clearExpired() {
        try {
            int removed = store.removeExpired(clock.instant());
            if (removed > 0) {
                log.info("Removed {} expired cache entries", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Expired-entry sweep failed: {}", e.getMessage());
            return 0;
        }
    }
}
