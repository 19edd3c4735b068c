package com.archflow.core.nodes;

import com.archflow.core.state.DesignField;
import org.springframework.stereotype.Component;

@Component
public class CostReviewNode extends DesignReviewNode {

    public static final String ID = "cost";

    private static final String SYSTEM_PROMPT = """
            You are a FinOps analyst. Estimate the monthly cost drivers of each design, point out
            waste and over-provisioning, and suggest cheaper equivalents where they do not hurt the
            stated requirements.
            """;

    public CostReviewNode(AgentRuntime runtime) {
        super(ID, "Cost Analyst", DesignField.COST_REPORT, SYSTEM_PROMPT, "cost", runtime);
    }
}
