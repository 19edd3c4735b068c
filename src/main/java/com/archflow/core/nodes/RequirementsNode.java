package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * First stage. Without user answers it either declares the requirements complete or
 * asks clarifying questions (which ends the run as a clarification terminal). With
 * answers it folds them into a refined requirements document.
 */
@Component
public class RequirementsNode extends AbstractAgentNode {

    public static final String ID = "requirements";
    static final String COMPLETE_MARKER = "REQUIREMENTS_COMPLETE";

    private static final String GATHER_PROMPT = """
            You are a cloud solutions architect reviewing a new infrastructure request.
            If the requirements are specific enough to design from, reply with the single line
            REQUIREMENTS_COMPLETE followed by a short restatement of the requirements.
            Otherwise ask 3-5 numbered clarifying questions about scale, data, availability,
            compliance and budget. Do not design anything yet.
            """;

    private static final String REFINE_PROMPT = """
            You are a cloud solutions architect. Combine the original request and the user's
            answers into one concise, complete requirements document that a designer can work from.
            """;

    public RequirementsNode(AgentRuntime runtime) {
        super(ID, "Requirements Analyst", ModelRole.MINI, DesignField.REFINED_REQUIREMENTS, runtime);
    }

    @Override
    public Set<DesignField> outputFields() {
        return Set.of(DesignField.REFINED_REQUIREMENTS, DesignField.CLARIFYING_QUESTIONS);
    }

    @Override
    protected boolean streaming() {
        return false;
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        if (state.userAnswers().isPresent()) {
            return List.of(
                    ChatMessage.system(REFINE_PROMPT),
                    ChatMessage.user(section("Original Requirements", state.requirements())
                            + section("User Answers", state.userAnswers().get())));
        }
        return List.of(
                ChatMessage.system(GATHER_PROMPT),
                ChatMessage.user("User requirements: " + state.requirements()));
    }

    @Override
    protected StateDelta toDelta(String text, RunState state) {
        StateDelta.Builder delta = StateDelta.builder().transcript(id(), label(), text);
        if (state.userAnswers().isPresent()) {
            return delta.field(DesignField.REFINED_REQUIREMENTS, text.strip())
                    .clarificationNeeded(false)
                    .build();
        }
        if (text.contains(COMPLETE_MARKER)) {
            String restated = text.replace(COMPLETE_MARKER, "").strip();
            return delta.field(DesignField.REFINED_REQUIREMENTS, restated.isEmpty() ? state.requirements() : restated)
                    .clarificationNeeded(false)
                    .build();
        }
        return delta.field(DesignField.CLARIFYING_QUESTIONS, text.strip())
                .clarificationNeeded(true)
                .build();
    }
}
