package com.archflow.core.graph;

import com.archflow.core.events.EventSink;
import com.archflow.core.model.ErrorKind;
import com.archflow.core.nodes.AgentNode;
import com.archflow.core.nodes.NodeContext;
import com.archflow.core.nodes.NodeExecutionException;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.RunStatus;
import com.archflow.core.state.StateDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a {@link PipelineGraph} against a {@link RunState}.
 * <p>
 * Stages run in order. Parallel groups fan out on the executor and fan in at a
 * barrier; their deltas are merged only after every member finished, in declaration
 * order. If the first stage asks for clarification the run stops there. After the
 * decision stage an {@code APPROVED} status moves on; {@code NEEDS_REVISION} jumps
 * back along the revision edge until {@code maxRevisions} is used up.
 */
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final ExecutorService executor;
    private final int maxRevisions;

    public GraphExecutor(ExecutorService executor, int maxRevisions) {
        this.executor = executor;
        this.maxRevisions = maxRevisions;
    }

    /**
     * Executes the graph to a terminal state.
     *
     * @return the final state: {@code COMPLETE}, or {@code PENDING} with
     *         {@code clarificationNeeded} set when the run stopped for clarification
     * @throws PipelineExecutionException on node failure, revision exhaustion or a bad decision status
     * @throws CancellationException      when the run was cancelled
     */
    public RunState execute(PipelineGraph graph, RunState state, RunContext run, EventSink sink) {
        List<Stage> stages = graph.stages();
        NodeContext nodeContext = new NodeContext(state.runId(), sink, run::isCancelled);
        int index = 0;
        while (index < stages.size()) {
            run.checkCancelled();
            Stage stage = stages.get(index);
            log.debug("Entering stage {} ({})", stage.name(), stage.kind());

            if (stage.kind() == Stage.Kind.PARALLEL) {
                runParallel(stage, state, run, nodeContext);
            } else {
                AgentNode node = stage.nodes().get(0);
                merge(stage, node, runNode(stage, node, state, nodeContext), state);
            }

            if (index == 0 && state.clarificationNeeded()) {
                log.info("Run {} needs clarification; stopping after stage {}", state.runId(), stage.name());
                return state;
            }

            if (stage.isDecision()) {
                index = nextAfterDecision(graph, stage, state);
            } else {
                index++;
            }
        }
        state.status(RunStatus.COMPLETE);
        return state;
    }

    private int nextAfterDecision(PipelineGraph graph, Stage stage, RunState state) {
        AgentNode decider = stage.nodes().get(0);
        RunStatus status = state.status();
        if (status == RunStatus.APPROVED) {
            return graph.indexOf(stage.name()) + 1;
        }
        if (status != RunStatus.NEEDS_REVISION) {
            throw new GraphDefinitionException(stage.name(), decider.id(),
                    "Decision stage " + stage.name() + " left unexpected status " + status);
        }
        String target = graph.revisionTarget().orElseThrow(() -> new GraphDefinitionException(stage.name(),
                decider.id(), "Decision requested a revision but the graph has no revision edge"));
        if (state.revisionCount() >= maxRevisions) {
            throw new RevisionLimitExceededException(stage.name(), decider.id(), state.revisionCount() + 1);
        }
        state.recordRevision(feedbackOf(decider, state));
        state.status(RunStatus.PENDING);
        log.info("Run {} sent back to stage {} (revision {}/{})",
                state.runId(), target, state.revisionCount(), maxRevisions);
        return graph.indexOf(target);
    }

    private static String feedbackOf(AgentNode decider, RunState state) {
        var sb = new StringBuilder();
        for (DesignField field : decider.outputFields()) {
            state.output(field).ifPresent(sb::append);
        }
        return sb.toString();
    }

    private StateDelta runNode(Stage stage, AgentNode node, RunState state, NodeContext context) {
        try {
            return node.execute(state, context);
        } catch (NodeExecutionException e) {
            throw new PipelineExecutionException(e.kind(), stage.name(), node.id(), e.getMessage(), e);
        } catch (CancellationException | PipelineExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Agent {} failed unexpectedly", node.id(), e);
            throw new PipelineExecutionException(ErrorKind.INTERNAL_ERROR, stage.name(), node.id(), e.getMessage(), e);
        }
    }

    private void runParallel(Stage stage, RunState state, RunContext run, NodeContext context) {
        var completion = new ExecutorCompletionService<StateDelta>(executor);
        Map<Future<StateDelta>, AgentNode> submitted = new HashMap<>();
        for (AgentNode node : stage.nodes()) {
            Future<StateDelta> future = completion.submit(() -> runNode(stage, node, state, context));
            submitted.put(future, node);
            run.register(future);
        }

        Map<AgentNode, StateDelta> deltas = new HashMap<>();
        try {
            for (int i = 0; i < submitted.size(); i++) {
                Future<StateDelta> done = completion.take();
                deltas.put(submitted.get(done), done.get());
            }
        } catch (InterruptedException e) {
            cancelAll(submitted.keySet());
            Thread.currentThread().interrupt();
            throw new CancellationException("Run " + run.runId() + " interrupted in stage " + stage.name());
        } catch (ExecutionException e) {
            cancelAll(submitted.keySet());
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new PipelineExecutionException(ErrorKind.INTERNAL_ERROR, stage.name(), null,
                    String.valueOf(cause), cause);
        } catch (CancellationException e) {
            cancelAll(submitted.keySet());
            throw e;
        } finally {
            submitted.keySet().forEach(run::deregister);
        }

        for (AgentNode node : stage.nodes()) {
            merge(stage, node, deltas.get(node), state);
        }
    }

    private static void merge(Stage stage, AgentNode node, StateDelta delta, RunState state) {
        for (DesignField field : delta.fields().keySet()) {
            if (!node.outputFields().contains(field)) {
                throw new GraphDefinitionException(stage.name(), node.id(),
                        "Node " + node.id() + " wrote field " + field.wireName() + " it does not own");
            }
        }
        state.apply(delta);
    }

    private static void cancelAll(Iterable<Future<StateDelta>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
