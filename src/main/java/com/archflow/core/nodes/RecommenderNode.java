package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Picks the primary or the alternative design. Output always starts with a
 * {@code RECOMMEND: PRIMARY} or {@code RECOMMEND: ALTERNATIVE} line.
 */
@Component
public class RecommenderNode extends AbstractAgentNode {

    public static final String ID = "recommender";
    public static final String PRIMARY = "RECOMMEND: PRIMARY";
    public static final String ALTERNATIVE = "RECOMMEND: ALTERNATIVE";

    private static final String SYSTEM_PROMPT = """
            You decide which of two architecture designs the user should build. Start your answer
            with exactly "RECOMMEND: PRIMARY" or "RECOMMEND: ALTERNATIVE", then explain the
            decision in a few paragraphs referencing the specialist reports.
            """;

    public RecommenderNode(AgentRuntime runtime) {
        super(ID, "Design Recommender", ModelRole.MAIN, DesignField.RECOMMENDATION, runtime);
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        String user = section("User Requirements", state.effectiveRequirements())
                + section("Primary Design", state.outputOrEmpty(DesignField.DESIGN))
                + section("Alternative Design", state.outputOrEmpty(DesignField.ALTERNATIVE_DESIGN))
                + section("Security Report", state.outputOrEmpty(DesignField.SECURITY_REPORT))
                + section("Cost Report", state.outputOrEmpty(DesignField.COST_REPORT))
                + section("Reliability Report", state.outputOrEmpty(DesignField.RELIABILITY_REPORT))
                + section("Chief Auditor Verdict", state.outputOrEmpty(DesignField.AUDIT_REPORT));
        return List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(user));
    }

    @Override
    protected StateDelta toDelta(String text, RunState state) {
        String normalized = normalize(text);
        return StateDelta.builder()
                .field(DesignField.RECOMMENDATION, normalized)
                .transcript(id(), label(), normalized)
                .build();
    }

    static String normalize(String text) {
        String content = text.strip();
        String upper = content.toUpperCase(Locale.ROOT);
        if (upper.startsWith(PRIMARY) || upper.startsWith(ALTERNATIVE)) {
            return content;
        }
        boolean mentionsPrimary = upper.contains("PRIMARY");
        boolean mentionsAlternative = upper.contains("ALTERNATIVE");
        String verdict = mentionsAlternative && !mentionsPrimary ? ALTERNATIVE : PRIMARY;
        return verdict + "\n\n" + content;
    }

    static boolean recommendsAlternative(String recommendation) {
        return recommendation != null && recommendation.toUpperCase(Locale.ROOT).startsWith(ALTERNATIVE);
    }
}
