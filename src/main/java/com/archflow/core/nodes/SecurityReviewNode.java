package com.archflow.core.nodes;

import com.archflow.core.state.DesignField;
import org.springframework.stereotype.Component;

@Component
public class SecurityReviewNode extends DesignReviewNode {

    public static final String ID = "security";

    private static final String SYSTEM_PROMPT = """
            You are a cloud security reviewer. For each design list concrete risks in identity,
            network exposure, data protection, secrets and logging, rate their severity, and
            recommend specific mitigations.
            """;

    public SecurityReviewNode(AgentRuntime runtime) {
        super(ID, "Security Reviewer", DesignField.SECURITY_REPORT, SYSTEM_PROMPT, "security", runtime);
    }
}
