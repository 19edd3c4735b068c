package com.archflow.core.model;

import java.util.Locale;

/**
 * Non-functional cost versus performance preference for a design.
 */
public enum CostBias {
    COST_OPTIMIZED("cost_optimized"),
    BALANCED("balanced"),
    PERFORMANCE_OPTIMIZED("performance_optimized");

    private final String wireName;

    CostBias(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Lenient parse: case and separator insensitive, {@code null}/blank maps to {@link #BALANCED}.
     */
    public static CostBias fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return BALANCED;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (CostBias value : values()) {
            if (value.wireName.equals(key)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown cost bias: " + raw);
    }
}
