package com.archflow.core.graph;

import com.archflow.core.events.EventSink;
import com.archflow.core.llm.TransientServiceException;
import com.archflow.core.model.DesignRequest;
import com.archflow.core.model.ErrorKind;
import com.archflow.core.nodes.NodeExecutionException;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.RunStatus;
import com.archflow.core.state.StateDelta;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GraphExecutor}.
 */
class GraphExecutorTest {

    private ExecutorService executor;
    private RunState state;
    private RunContext run;
    private EventSink sink;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        state = new RunState("ARCH-2026-0001", "fp", new DesignRequest("Build a web app", null));
        run = new RunContext(state.runId());
        sink = new EventSink(state.runId());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static StubNode auditSaying(RunStatus... verdicts) {
        return new StubNode("audit", Set.of(DesignField.AUDIT_REPORT), (s, call) -> {
            RunStatus verdict = verdicts[Math.min(call, verdicts.length) - 1];
            return StateDelta.builder()
                    .field(DesignField.AUDIT_REPORT, "verdict " + call + ": " + verdict)
                    .status(verdict)
                    .build();
        });
    }

    private PipelineGraph graph(StubNode requirements, StubNode design, StubNode alternative,
                                StubNode audit, StubNode recommender) {
        return PipelineGraph.builder()
                .single("requirements", requirements)
                .parallel("designs", design, alternative)
                .decision("audit", audit)
                .single("recommend", recommender)
                .revisionEdge("audit", "designs")
                .build();
    }

    @Nested
    @DisplayName("straight-through runs")
    class StraightThrough {

        @Test
        @DisplayName("runs every stage once and completes")
        void completes() {
            var requirements = StubNode.writing("requirements", DesignField.REFINED_REQUIREMENTS);
            var design = StubNode.writing("design", DesignField.DESIGN);
            var alternative = StubNode.writing("alternative_design", DesignField.ALTERNATIVE_DESIGN);
            var recommender = StubNode.writing("recommender", DesignField.RECOMMENDATION);

            RunState result = new GraphExecutor(executor, 1).execute(
                    graph(requirements, design, alternative, auditSaying(RunStatus.APPROVED), recommender),
                    state, run, sink);

            assertEquals(RunStatus.COMPLETE, result.status());
            assertEquals("design#1", result.output(DesignField.DESIGN).orElseThrow());
            assertEquals("recommender#1", result.output(DesignField.RECOMMENDATION).orElseThrow());
            assertEquals(0, result.revisionCount());
        }

        @Test
        @DisplayName("parallel siblings do not see each other's output before the barrier")
        void barrierIsolation() {
            var firstDone = new CountDownLatch(1);
            var sawSibling = new AtomicBoolean(true);
            var design = new StubNode("design", Set.of(DesignField.DESIGN), (s, call) -> {
                firstDone.countDown();
                return StateDelta.builder().field(DesignField.DESIGN, "primary").build();
            });
            var alternative = new StubNode("alternative_design", Set.of(DesignField.ALTERNATIVE_DESIGN), (s, call) -> {
                try {
                    assertTrue(firstDone.await(5, TimeUnit.SECONDS));
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                sawSibling.set(s.output(DesignField.DESIGN).isPresent());
                return StateDelta.builder().field(DesignField.ALTERNATIVE_DESIGN, "alternative").build();
            });
            PipelineGraph graph = PipelineGraph.builder().parallel("designs", design, alternative).build();

            RunState result = new GraphExecutor(executor, 1).execute(graph, state, run, sink);

            assertFalse(sawSibling.get());
            assertEquals("primary", result.output(DesignField.DESIGN).orElseThrow());
            assertEquals("alternative", result.output(DesignField.ALTERNATIVE_DESIGN).orElseThrow());
        }
    }

    @Nested
    @DisplayName("revision loop")
    class Revisions {

        @Test
        @DisplayName("a rejected pass re-runs the designs with the audit feedback")
        void revisesOnce() {
            var requirements = StubNode.writing("requirements", DesignField.REFINED_REQUIREMENTS);
            var design = StubNode.writing("design", DesignField.DESIGN);
            var alternative = StubNode.writing("alternative_design", DesignField.ALTERNATIVE_DESIGN);
            var recommender = StubNode.writing("recommender", DesignField.RECOMMENDATION);
            var audit = auditSaying(RunStatus.NEEDS_REVISION, RunStatus.APPROVED);

            RunState result = new GraphExecutor(executor, 1).execute(
                    graph(requirements, design, alternative, audit, recommender), state, run, sink);

            assertEquals(RunStatus.COMPLETE, result.status());
            assertEquals(1, result.revisionCount());
            assertEquals(1, requirements.calls());
            assertEquals(2, design.calls());
            assertEquals(2, audit.calls());
            assertEquals("design#2", result.output(DesignField.DESIGN).orElseThrow());
            assertEquals(1, result.revisionFeedback().size());
            assertTrue(result.revisionFeedback().get(0).contains("NEEDS_REVISION"));
        }

        @Test
        @DisplayName("fails with RevisionLimitExceeded once the bound is used up")
        void revisionLimit() {
            var design = StubNode.writing("design", DesignField.DESIGN);
            var alternative = StubNode.writing("alternative_design", DesignField.ALTERNATIVE_DESIGN);
            var recommender = StubNode.writing("recommender", DesignField.RECOMMENDATION);
            var audit = auditSaying(RunStatus.NEEDS_REVISION);

            var ex = assertThrows(RevisionLimitExceededException.class, () -> new GraphExecutor(executor, 1).execute(
                    graph(StubNode.writing("requirements", DesignField.REFINED_REQUIREMENTS),
                            design, alternative, audit, recommender), state, run, sink));

            assertEquals(ErrorKind.REVISION_LIMIT_EXCEEDED, ex.kind());
            assertEquals("audit", ex.stage());
            assertEquals(2, ex.attempts());
            assertEquals(2, audit.calls());
            assertEquals(0, recommender.calls());
        }

        @Test
        @DisplayName("a bound of zero fails on the first rejection")
        void zeroRevisions() {
            var audit = auditSaying(RunStatus.NEEDS_REVISION);
            var design = StubNode.writing("design", DesignField.DESIGN);

            assertThrows(RevisionLimitExceededException.class, () -> new GraphExecutor(executor, 0).execute(
                    graph(StubNode.writing("requirements", DesignField.REFINED_REQUIREMENTS), design,
                            StubNode.writing("alternative_design", DesignField.ALTERNATIVE_DESIGN), audit,
                            StubNode.writing("recommender", DesignField.RECOMMENDATION)), state, run, sink));
            assertEquals(1, design.calls());
        }

        @Test
        @DisplayName("a decision that leaves no verdict is a graph definition error")
        void missingVerdict() {
            var audit = StubNode.writing("audit", DesignField.AUDIT_REPORT);

            var ex = assertThrows(GraphDefinitionException.class, () -> new GraphExecutor(executor, 1).execute(
                    PipelineGraph.builder().decision("audit", audit).build(), state, run, sink));
            assertEquals(ErrorKind.GRAPH_DEFINITION_ERROR, ex.kind());
        }
    }

    @Nested
    @DisplayName("early exits")
    class EarlyExits {

        @Test
        @DisplayName("clarification after the first stage stops the run")
        void clarification() {
            var requirements = new StubNode("requirements",
                    Set.of(DesignField.REFINED_REQUIREMENTS, DesignField.CLARIFYING_QUESTIONS),
                    (s, call) -> StateDelta.builder()
                            .field(DesignField.CLARIFYING_QUESTIONS, "How many users?")
                            .clarificationNeeded(true)
                            .build());
            var design = StubNode.writing("design", DesignField.DESIGN);

            RunState result = new GraphExecutor(executor, 1).execute(
                    graph(requirements, design, StubNode.writing("alternative_design", DesignField.ALTERNATIVE_DESIGN),
                            auditSaying(RunStatus.APPROVED), StubNode.writing("recommender", DesignField.RECOMMENDATION)),
                    state, run, sink);

            assertTrue(result.clarificationNeeded());
            assertEquals(RunStatus.PENDING, result.status());
            assertEquals(0, design.calls());
            assertEquals("How many users?", result.output(DesignField.CLARIFYING_QUESTIONS).orElseThrow());
        }

        @Test
        @DisplayName("a failing parallel sibling fails the stage and nothing downstream runs")
        void parallelFailure() {
            var design = new StubNode("design", Set.of(DesignField.DESIGN), (s, call) -> {
                throw new NodeExecutionException("design", ErrorKind.TRANSIENT_SERVICE_ERROR,
                        new TransientServiceException(TransientServiceException.Cause.TIMEOUT, "timed out"));
            });
            var recommender = StubNode.writing("recommender", DesignField.RECOMMENDATION);

            var ex = assertThrows(PipelineExecutionException.class, () -> new GraphExecutor(executor, 1).execute(
                    graph(StubNode.writing("requirements", DesignField.REFINED_REQUIREMENTS), design,
                            StubNode.writing("alternative_design", DesignField.ALTERNATIVE_DESIGN),
                            auditSaying(RunStatus.APPROVED), recommender), state, run, sink));

            assertEquals(ErrorKind.TRANSIENT_SERVICE_ERROR, ex.kind());
            assertEquals("designs", ex.stage());
            assertEquals("design", ex.nodeId());
            assertEquals(0, recommender.calls());
            assertTrue(state.output(DesignField.ALTERNATIVE_DESIGN).isEmpty());
        }

        @Test
        @DisplayName("unexpected node exceptions become internal errors")
        void internalError() {
            var broken = new StubNode("design", Set.of(DesignField.DESIGN), (s, call) -> {
                throw new IllegalStateException("boom");
            });

            var ex = assertThrows(PipelineExecutionException.class, () -> new GraphExecutor(executor, 1).execute(
                    PipelineGraph.builder().single("designs", broken).build(), state, run, sink));
            assertEquals(ErrorKind.INTERNAL_ERROR, ex.kind());
        }

        @Test
        @DisplayName("writing a field the node does not own is rejected")
        void foreignField() {
            var rogue = new StubNode("design", Set.of(DesignField.DESIGN),
                    (s, call) -> StateDelta.builder().field(DesignField.COST_REPORT, "cheap").build());

            assertThrows(GraphDefinitionException.class, () -> new GraphExecutor(executor, 1).execute(
                    PipelineGraph.builder().single("designs", rogue).build(), state, run, sink));
            assertTrue(state.output(DesignField.COST_REPORT).isEmpty());
        }

        @Test
        @DisplayName("a cancelled run stops before the next stage")
        void cancelled() {
            var design = StubNode.writing("design", DesignField.DESIGN);
            run.cancel();

            assertThrows(CancellationException.class, () -> new GraphExecutor(executor, 1).execute(
                    PipelineGraph.builder().single("designs", design).build(), state, run, sink));
            assertEquals(0, design.calls());
        }
    }
}
