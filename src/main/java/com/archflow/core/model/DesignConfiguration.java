package com.archflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The configuration enum set that accompanies a design request.
 *
 * @param scenario    free-form scenario preset, normalized to lower case; {@code "custom"} when absent
 * @param costBias    cost versus performance preference
 * @param compliance  regulatory posture
 * @param reliability availability target
 * @param strictness  how opinionated the designers should be
 */
public record DesignConfiguration(
        String scenario,
        @JsonProperty("cost_bias") CostBias costBias,
        ComplianceLevel compliance,
        ReliabilityLevel reliability,
        Strictness strictness
) {

    public static final String CUSTOM_SCENARIO = "custom";

    public DesignConfiguration {
        scenario = normalizeScenario(scenario);
        costBias = costBias != null ? costBias : CostBias.BALANCED;
        compliance = compliance != null ? compliance : ComplianceLevel.STANDARD;
        reliability = reliability != null ? reliability : ReliabilityLevel.STANDARD;
        strictness = strictness != null ? strictness : Strictness.BALANCED;
    }

    public static DesignConfiguration defaults() {
        return new DesignConfiguration(CUSTOM_SCENARIO, null, null, null, null);
    }

    /**
     * Builds a configuration from loosely-typed request input. Keys are matched
     * case-insensitively and may use either snake_case or kebab-case.
     */
    public static DesignConfiguration fromMap(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return defaults();
        }
        Map<String, String> byKey = new TreeMap<>();
        raw.forEach((k, v) -> {
            if (k != null) {
                byKey.put(k.trim().toLowerCase(Locale.ROOT).replace('-', '_'), v);
            }
        });
        return new DesignConfiguration(
                byKey.get("scenario"),
                CostBias.fromWire(byKey.getOrDefault("cost_bias", byKey.get("cost_performance"))),
                ComplianceLevel.fromWire(byKey.get("compliance")),
                ReliabilityLevel.fromWire(byKey.get("reliability")),
                Strictness.fromWire(byKey.get("strictness")));
    }

    /**
     * Key-sorted view used for fingerprinting; independent of how the input was ordered.
     */
    public SortedMap<String, String> canonical() {
        SortedMap<String, String> canonical = new TreeMap<>();
        canonical.put("compliance", compliance.wireName());
        canonical.put("cost_bias", costBias.wireName());
        canonical.put("reliability", reliability.wireName());
        canonical.put("scenario", scenario);
        canonical.put("strictness", strictness.wireName());
        return canonical;
    }

    public boolean isCustomScenario() {
        return CUSTOM_SCENARIO.equals(scenario);
    }

    private static String normalizeScenario(String scenario) {
        if (scenario == null || scenario.isBlank()) {
            return CUSTOM_SCENARIO;
        }
        return String.join(" ", scenario.trim().toLowerCase(Locale.ROOT).split("\\s+"));
    }
}
