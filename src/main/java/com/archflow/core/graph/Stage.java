package com.archflow.core.graph;

import com.archflow.core.nodes.AgentNode;

import java.util.List;

/**
 * A step of the pipeline graph: one node, a parallel group, or the decision node
 * whose status drives the revision edge.
 */
public record Stage(String name, Kind kind, List<AgentNode> nodes) {

    public enum Kind {
        SINGLE,
        PARALLEL,
        DECISION
    }

    public Stage {
        nodes = List.copyOf(nodes);
    }

    public static Stage single(String name, AgentNode node) {
        return new Stage(name, Kind.SINGLE, List.of(node));
    }

    public static Stage parallel(String name, AgentNode... nodes) {
        return new Stage(name, Kind.PARALLEL, List.of(nodes));
    }

    public static Stage decision(String name, AgentNode node) {
        return new Stage(name, Kind.DECISION, List.of(node));
    }

    public boolean isDecision() {
        return kind == Kind.DECISION;
    }
}
