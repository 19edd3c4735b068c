package com.archflow.core.model;

import java.util.Locale;

/**
 * Availability target for a design.
 */
public enum ReliabilityLevel {
    STANDARD("standard"),
    HIGH("high"),
    EXTREME("extreme");

    private final String wireName;

    ReliabilityLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ReliabilityLevel fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return STANDARD;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (ReliabilityLevel value : values()) {
            if (value.wireName.equals(key)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown reliability level: " + raw);
    }
}
