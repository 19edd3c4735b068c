package com.archflow.core.nodes;

import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes Terraform for whichever design the recommender picked.
 */
@Component
public class TerraformCoderNode extends AbstractAgentNode {

    public static final String ID = "terraform_coder";

    private static final String SYSTEM_PROMPT = """
            You are an infrastructure-as-code engineer. Produce production-ready Terraform for the
            recommended design: providers, variables, modules and outputs, in fenced hcl blocks
            with one block per file and a short note on how to apply it.
            """;

    public TerraformCoderNode(AgentRuntime runtime) {
        super(ID, "Terraform Engineer", ModelRole.MAIN, DesignField.TERRAFORM_CODE, runtime);
    }

    @Override
    protected List<ChatMessage> messages(RunState state) {
        String recommendation = state.outputOrEmpty(DesignField.RECOMMENDATION);
        DesignField recommended = RecommenderNode.recommendsAlternative(recommendation)
                ? DesignField.ALTERNATIVE_DESIGN
                : DesignField.DESIGN;
        String user = section("User Requirements", state.effectiveRequirements())
                + section("Recommended Design", state.outputOrEmpty(recommended))
                + section("Design Recommendation", recommendation)
                + "Please generate production-ready Terraform code for this architecture.";
        return List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(user));
    }
}
