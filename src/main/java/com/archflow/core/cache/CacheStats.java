package com.archflow.core.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param entries        stored entries, {@code -1} when the store cannot count
 * @param hits           lookups answered from the cache
 * @param misses         lookups that found nothing usable
 * @param hitRatePercent hits over all lookups, two decimals
 */
public record CacheStats(
        int entries,
        long hits,
        long misses,
        @JsonProperty("hit_rate_percent") double hitRatePercent
) {}
