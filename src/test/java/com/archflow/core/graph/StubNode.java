package com.archflow.core.graph;

import com.archflow.core.llm.ModelRole;
import com.archflow.core.nodes.AgentNode;
import com.archflow.core.nodes.NodeContext;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.StateDelta;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Agent node whose behaviour is a plain function, for exercising the executor without a model.
 */
class StubNode implements AgentNode {

    private final String id;
    private final Set<DesignField> fields;
    private final BiFunction<RunState, Integer, StateDelta> body;
    private final AtomicInteger calls = new AtomicInteger();

    StubNode(String id, Set<DesignField> fields, BiFunction<RunState, Integer, StateDelta> body) {
        this.id = id;
        this.fields = fields;
        this.body = body;
    }

    /** Writes {@code "<id>#<call>"} to its single field. */
    static StubNode writing(String id, DesignField field) {
        return new StubNode(id, Set.of(field),
                (state, call) -> StateDelta.builder().field(field, id + "#" + call).build());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ModelRole role() {
        return ModelRole.MINI;
    }

    @Override
    public Set<DesignField> outputFields() {
        return fields;
    }

    @Override
    public StateDelta execute(RunState state, NodeContext context) {
        context.checkCancelled();
        return body.apply(state, calls.incrementAndGet());
    }

    int calls() {
        return calls.get();
    }
}
