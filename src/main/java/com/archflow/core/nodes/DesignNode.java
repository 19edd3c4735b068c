package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Primary designer. Also the node the revision edge re-enters.
 */
@Component
public class DesignNode extends AbstractAgentNode {

    public static final String ID = "design";

    private static final String SYSTEM_PROMPT = """
            You are a pragmatic senior cloud architect. Produce a complete infrastructure design
            for the requirements: components, networking, data stores, identity, observability,
            scaling and deployment. Prefer managed services and simple topologies. Use markdown
            headings and explain the trade-offs you made.
            """;

    public DesignNode(AgentRuntime runtime) {
        super(ID, "Primary Architect", ModelRole.MAIN, DesignField.DESIGN, runtime);
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        var user = new StringBuilder("User requirements: ").append(state.effectiveRequirements());
        user.append("\n\nAdditional context:\n")
                .append(String.join("\n", DesignGuidance.configurationLines(state.configuration())));
        String history = state.historicalContext(() -> runtime.history().contextFor(state.effectiveRequirements()));
        if (!history.isBlank()) {
            user.append("\n\n").append(history);
        }
        user.append(DesignGuidance.revisionContext(state, DesignField.DESIGN));
        return List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(user.toString()));
    }
}
