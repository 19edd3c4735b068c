package com.archflow.core.nodes;

import com.archflow.core.model.DesignConfiguration;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt context shared by the two design agents.
 */
final class DesignGuidance {

    private DesignGuidance() {}

    static List<String> configurationLines(DesignConfiguration config) {
        List<String> lines = new ArrayList<>();
        if (!config.isCustomScenario()) {
            lines.add("Scenario preset: " + config.scenario() + " (interpret and adapt as needed).");
        }
        lines.add(switch (config.costBias()) {
            case COST_OPTIMIZED -> "Non-functional priority: minimize monthly cost while keeping the design sane.";
            case PERFORMANCE_OPTIMIZED -> "Non-functional priority: favor performance and low latency, even at higher cost.";
            case BALANCED -> "Non-functional priority: balanced cost vs performance.";
        });
        switch (config.compliance()) {
            case REGULATED -> lines.add("Assume a regulated workload (e.g., PCI/HIPAA); call out controls explicitly.");
            case STRICT -> lines.add("Assume very strict compliance/government requirements; be conservative.");
            case STANDARD -> { }
        }
        switch (config.reliability()) {
            case HIGH -> lines.add("Target high availability (around 99.9-99.99%) with appropriate redundancy.");
            case EXTREME -> lines.add("Target extreme reliability with multi-region or multi-AZ resilience.");
            case STANDARD -> { }
        }
        lines.add(switch (config.strictness()) {
            case FLEXIBLE -> "Design can be flexible: mix managed services, containers and Kubernetes if it clearly helps.";
            case BALANCED -> "Be opinionated but pragmatic: prefer managed services and only add complex stacks when justified.";
            case STRICT -> "Be strongly opinionated: stick to native managed services and avoid unnecessary complexity.";
        });
        return lines;
    }

    /**
     * Auditor feedback plus the previous draft of {@code ownField}, or empty on the first pass.
     */
    static String revisionContext(RunState state, DesignField ownField) {
        List<String> feedback = state.revisionFeedback();
        if (feedback.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder("\n\nThis is revision ").append(state.revisionCount())
                .append(". The auditor rejected the previous pass:\n");
        for (int i = 0; i < feedback.size(); i++) {
            sb.append("\n--- Auditor feedback ").append(i + 1).append(" ---\n").append(feedback.get(i)).append('\n');
        }
        state.output(ownField).filter(s -> !s.isBlank()).ifPresent(previous ->
                sb.append("\n--- Previous draft ---\n").append(previous).append('\n'));
        sb.append("\nAddress every point raised and produce a complete revised design.");
        return sb.toString();
    }
}
