package com.archflow.core.model;

import java.util.Locale;

/**
 * How opinionated the design agents should be about service choices.
 */
public enum Strictness {
    FLEXIBLE("flexible"),
    BALANCED("balanced"),
    STRICT("strict");

    private final String wireName;

    Strictness(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Strictness fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return BALANCED;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (Strictness value : values()) {
            if (value.wireName.equals(key)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown strictness: " + raw);
    }
}
