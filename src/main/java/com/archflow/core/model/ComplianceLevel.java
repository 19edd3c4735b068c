package com.archflow.core.model;

import java.util.Locale;

/**
 * Regulatory posture the design must assume.
 */
public enum ComplianceLevel {
    STANDARD("standard"),
    REGULATED("regulated"),
    STRICT("strict");

    private final String wireName;

    ComplianceLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ComplianceLevel fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return STANDARD;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (ComplianceLevel value : values()) {
            if (value.wireName.equals(key)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown compliance level: " + raw);
    }
}
