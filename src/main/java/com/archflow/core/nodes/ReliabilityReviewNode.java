package com.archflow.core.nodes;

import com.archflow.core.state.DesignField;
import org.springframework.stereotype.Component;

@Component
public class ReliabilityReviewNode extends DesignReviewNode {

    public static final String ID = "reliability";

    private static final String SYSTEM_PROMPT = """
            You are a site reliability engineer. Identify single points of failure, recovery
            objectives, scaling limits and operational gaps in each design, and propose fixes.
            """;

    public ReliabilityReviewNode(AgentRuntime runtime) {
        super(ID, "Reliability Engineer", DesignField.RELIABILITY_REPORT, SYSTEM_PROMPT,
                "reliability and operations", runtime);
    }
}
