package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;

import java.util.List;

/**
 * Specialist reviewer that reads both designs and writes one report.
 */
abstract class DesignReviewNode extends AbstractAgentNode {

    private final String systemPrompt;
    private final String perspective;

    DesignReviewNode(String id, String label, DesignField report, String systemPrompt, String perspective,
                     AgentRuntime runtime) {
        super(id, label, ModelRole.MINI, report, runtime);
        this.systemPrompt = systemPrompt;
        this.perspective = perspective;
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        String user = section("Requirements", state.effectiveRequirements())
                + section("Primary Design", state.outputOrEmpty(DesignField.DESIGN))
                + section("Alternative Design", state.outputOrEmpty(DesignField.ALTERNATIVE_DESIGN))
                + "Please review both designs from a " + perspective + " perspective.";
        return List.of(ChatMessage.system(systemPrompt), ChatMessage.user(user));
    }
}
