package com.archflow.core.graph;

import com.archflow.core.nodes.AgentNode;
import com.archflow.core.state.DesignField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of the agent graph: stages in topological order plus at most one
 * revision edge from the decision stage back to an earlier stage.
 * <p>
 * Validated on {@link Builder#build()}: stage names and node ids are unique, every
 * output field has exactly one writer, and the revision edge leaves the only decision
 * stage and points strictly backwards.
 */
public final class PipelineGraph {

    private final List<Stage> stages;
    private final String revisionSource;
    private final String revisionTarget;

    private PipelineGraph(List<Stage> stages, String revisionSource, String revisionTarget) {
        this.stages = List.copyOf(stages);
        this.revisionSource = revisionSource;
        this.revisionTarget = revisionTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Stage> stages() {
        return stages;
    }

    public Optional<String> revisionTarget() {
        return Optional.ofNullable(revisionTarget);
    }

    public Optional<String> revisionSource() {
        return Optional.ofNullable(revisionSource);
    }

    public int indexOf(String stageName) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).name().equals(stageName)) {
                return i;
            }
        }
        return -1;
    }

    public static final class Builder {
        private final List<Stage> stages = new ArrayList<>();
        private String revisionSource;
        private String revisionTarget;

        private Builder() {
        }

        public Builder stage(Stage stage) {
            stages.add(stage);
            return this;
        }

        public Builder single(String name, AgentNode node) {
            return stage(Stage.single(name, node));
        }

        public Builder parallel(String name, AgentNode... nodes) {
            return stage(Stage.parallel(name, nodes));
        }

        public Builder decision(String name, AgentNode node) {
            return stage(Stage.decision(name, node));
        }

        public Builder revisionEdge(String fromDecisionStage, String toStage) {
            this.revisionSource = fromDecisionStage;
            this.revisionTarget = toStage;
            return this;
        }

        public PipelineGraph build() {
            if (stages.isEmpty()) {
                throw new GraphDefinitionException("Graph has no stages");
            }
            Set<String> names = new HashSet<>();
            Set<String> nodeIds = new HashSet<>();
            Map<DesignField, String> writers = new EnumMap<>(DesignField.class);
            int decisions = 0;
            for (Stage stage : stages) {
                if (!names.add(stage.name())) {
                    throw new GraphDefinitionException("Duplicate stage name: " + stage.name());
                }
                if (stage.nodes().isEmpty()) {
                    throw new GraphDefinitionException("Stage " + stage.name() + " has no nodes");
                }
                if (stage.kind() != Stage.Kind.PARALLEL && stage.nodes().size() != 1) {
                    throw new GraphDefinitionException("Stage " + stage.name() + " must hold exactly one node");
                }
                if (stage.isDecision()) {
                    decisions++;
                }
                for (AgentNode node : stage.nodes()) {
                    if (!nodeIds.add(node.id())) {
                        throw new GraphDefinitionException("Duplicate node id: " + node.id());
                    }
                    for (DesignField field : node.outputFields()) {
                        String previous = writers.putIfAbsent(field, node.id());
                        if (previous != null) {
                            throw new GraphDefinitionException("Field " + field.wireName()
                                    + " written by both " + previous + " and " + node.id());
                        }
                    }
                }
            }
            if (decisions > 1) {
                throw new GraphDefinitionException("Graph has " + decisions + " decision stages; at most one is allowed");
            }
            validateRevisionEdge();
            return new PipelineGraph(stages, revisionSource, revisionTarget);
        }

        private void validateRevisionEdge() {
            if (revisionSource == null && revisionTarget == null) {
                return;
            }
            int from = indexOf(revisionSource);
            int to = indexOf(revisionTarget);
            if (from < 0 || !stages.get(from).isDecision()) {
                throw new GraphDefinitionException("Revision edge must leave the decision stage, not " + revisionSource);
            }
            if (to < 0 || to >= from) {
                throw new GraphDefinitionException("Revision edge must point to an earlier stage, not " + revisionTarget);
            }
        }

        private int indexOf(String name) {
            for (int i = 0; i < stages.size(); i++) {
                if (stages.get(i).name().equals(name)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
