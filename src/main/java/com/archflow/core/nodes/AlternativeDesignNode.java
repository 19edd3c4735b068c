package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Competing designer on the high-temperature pool; runs alongside {@link DesignNode}.
 */
@Component
public class AlternativeDesignNode extends AbstractAgentNode {

    public static final String ID = "alternative_design";

    private static final String SYSTEM_PROMPT = """
            You are a bold, modern cloud architect competing with a conservative colleague.
            Design the same system your own way: take a different but defensible approach,
            make the key differences explicit and justify them. Use markdown headings.
            """;

    public AlternativeDesignNode(AgentRuntime runtime) {
        super(ID, "Alternative Architect", ModelRole.CREATIVE, DesignField.ALTERNATIVE_DESIGN, runtime);
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        String user = "User requirements: " + state.effectiveRequirements()
                + "\n\nAdditional context:\n"
                + String.join("\n", DesignGuidance.configurationLines(state.configuration()))
                + DesignGuidance.revisionContext(state, DesignField.ALTERNATIVE_DESIGN);
        return List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(user));
    }
}
