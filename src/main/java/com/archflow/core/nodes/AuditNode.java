package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.RunStatus;
import com.archflow.core.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decision node: aggregates the specialist reports and approves or rejects the pass.
 */
@Component
public class AuditNode extends AbstractAgentNode {

    public static final String ID = "audit";

    private static final String SYSTEM_PROMPT = """
            You are the chief architecture auditor. Weigh both designs against the security, cost
            and reliability reports. If at least one design is sound enough to build, answer with
            APPROVED and a short justification. Otherwise answer NEEDS_REVISION and list the
            blocking issues the designers must fix.
            """;

    public AuditNode(AgentRuntime runtime) {
        super(ID, "Chief Auditor", ModelRole.MAIN, DesignField.AUDIT_REPORT, runtime);
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        String user = section("Primary Design", state.outputOrEmpty(DesignField.DESIGN))
                + section("Alternative Design", state.outputOrEmpty(DesignField.ALTERNATIVE_DESIGN))
                + section("Security Report", state.outputOrEmpty(DesignField.SECURITY_REPORT))
                + section("Cost Report", state.outputOrEmpty(DesignField.COST_REPORT))
                + section("Reliability Report", state.outputOrEmpty(DesignField.RELIABILITY_REPORT));
        return List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(user));
    }

    @Override
    protected StateDelta toDelta(String text, RunState state) {
        return StateDelta.builder()
                .field(DesignField.AUDIT_REPORT, text)
                .status(decide(text))
                .transcript(id(), label(), text)
                .build();
    }

    static RunStatus decide(String auditText) {
        String upper = auditText.toUpperCase(Locale.ROOT);
        return upper.contains("APPROVED") && !upper.contains("NEEDS_REVISION")
                ? RunStatus.APPROVED
                : RunStatus.NEEDS_REVISION;
    }
}
