package com.archflow.core.nodes;

import com.archflow.core.llm.ModelRole;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.StateDelta;

import java.util.Set;

/**
 * One unit of graph work: reads the run state, issues a model call through a pooled
 * client, emits progress events and returns the delta the executor merges.
 * <p>
 * Implementations must not mutate the {@link RunState} directly and must write only
 * the fields listed by {@link #outputFields()}.
 */
public interface AgentNode {

    String id();

    ModelRole role();

    Set<DesignField> outputFields();

    /**
     * @throws NodeExecutionException          when the model call failed after retries
     * @throws java.util.concurrent.CancellationException when the run was cancelled
     */
    StateDelta execute(RunState state, NodeContext context);
}
