package com.archflow.core.engine;

import com.archflow.config.PipelineProperties;
import com.archflow.core.cache.CacheEntry;
import com.archflow.core.cache.DesignCache;
import com.archflow.core.cache.FingerprintCacheStore;
import com.archflow.core.cache.InMemoryFingerprintCacheStore;
import com.archflow.core.events.EventStream;
import com.archflow.core.events.EventType;
import com.archflow.core.events.StreamEvent;
import com.archflow.core.graph.DesignPipelineGraph;
import com.archflow.core.graph.GraphExecutor;
import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.PermanentServiceException;
import com.archflow.core.llm.ScriptedModelClientFactory;
import com.archflow.core.metrics.PipelineMetrics;
import com.archflow.core.model.DesignBundle;
import com.archflow.core.model.DesignConfiguration;
import com.archflow.core.model.DesignRequest;
import com.archflow.core.model.ErrorKind;
import com.archflow.core.model.PipelineResult;
import com.archflow.core.nodes.AgentRuntime;
import com.archflow.core.nodes.AlternativeDesignNode;
import com.archflow.core.nodes.AuditNode;
import com.archflow.core.nodes.CostReviewNode;
import com.archflow.core.nodes.DesignNode;
import com.archflow.core.nodes.RecommenderNode;
import com.archflow.core.nodes.ReliabilityReviewNode;
import com.archflow.core.nodes.RequirementsNode;
import com.archflow.core.nodes.SecurityReviewNode;
import com.archflow.core.nodes.TerraformCoderNode;
import com.archflow.core.nodes.TestRuntimes;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.archflow.core.llm.ScriptedModelClientFactory.systemPrompt;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of {@link PipelineService} over the real design graph with a scripted model.
 */
class PipelineServiceTest {

    private static final String WEB_APP = "Build a web app";

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;
    private ExecutorService executor;
    private final AtomicInteger requirementsCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Answers like a cooperative model: complete requirements, an approving audit, a primary pick. */
    private String cooperative(List<ChatMessage> messages) {
        String system = systemPrompt(messages);
        if (system.contains("reviewing a new infrastructure request")) {
            requirementsCalls.incrementAndGet();
            return "REQUIREMENTS_COMPLETE\nA small public web application with a managed database.";
        }
        if (system.contains("chief architecture auditor")) {
            return "APPROVED: the primary design is sound.";
        }
        if (system.contains("decide which of two architecture designs")) {
            return "RECOMMEND: PRIMARY\n\nSimpler to operate.";
        }
        if (system.contains("infrastructure-as-code engineer")) {
            return "```hcl\nresource \"aws_s3_bucket\" \"site\" {}\n```";
        }
        return "Report: " + system.lines().findFirst().orElse("");
    }

    private record Harness(PipelineService service, ScriptedModelClientFactory factory, DesignCache cache) {}

    private Harness harness(Function<List<ChatMessage>, String> responder) {
        return harness(responder, new InMemoryFingerprintCacheStore());
    }

    private Harness harness(Function<List<ChatMessage>, String> responder, FingerprintCacheStore store) {
        var factory = new ScriptedModelClientFactory(responder);
        AgentRuntime runtime = TestRuntimes.runtime(factory, metrics, 0);
        var graph = new DesignPipelineGraph(
                new RequirementsNode(runtime),
                new DesignNode(runtime),
                new AlternativeDesignNode(runtime),
                new SecurityReviewNode(runtime),
                new CostReviewNode(runtime),
                new ReliabilityReviewNode(runtime),
                new AuditNode(runtime),
                new RecommenderNode(runtime),
                new TerraformCoderNode(runtime));
        var cache = new DesignCache(store, new PipelineProperties.Cache(),
                metrics, Clock.systemUTC());
        var service = new PipelineService(cache, new GraphExecutor(executor, 1), graph, executor, metrics);
        return new Harness(service, factory, cache);
    }

    private static List<StreamEvent> drain(RunHandle handle) {
        List<StreamEvent> events = new ArrayList<>();
        try (EventStream stream = handle.events()) {
            stream.forEachRemaining(events::add);
        }
        return events;
    }

    @Nested
    @DisplayName("full runs")
    class FullRuns {

        @Test
        @DisplayName("'Build a web app' produces a complete approved bundle")
        void buildWebApp() {
            Harness h = harness(PipelineServiceTest.this::cooperative);

            RunHandle handle = h.service().submit(new DesignRequest(WEB_APP, DesignConfiguration.defaults()));
            PipelineResult result = handle.await();

            assertEquals(PipelineResult.Outcome.COMPLETE, result.outcome());
            assertFalse(result.cached());
            DesignBundle bundle = result.bundle();
            assertEquals("approved", bundle.auditStatus());
            assertFalse(bundle.design().isBlank());
            assertFalse(bundle.alternativeDesign().isBlank());
            assertFalse(bundle.securityReport().isBlank());
            assertFalse(bundle.costReport().isBlank());
            assertFalse(bundle.reliabilityReport().isBlank());
            assertTrue(bundle.recommendation().startsWith("RECOMMEND: PRIMARY"));
            assertTrue(bundle.terraformCode().contains("aws_s3_bucket"));
            assertEquals(0, bundle.revisionCount());
            assertFalse(bundle.clarificationNeeded());
            assertTrue(handle.runId().startsWith("ARCH-"));
        }

        @Test
        @DisplayName("the feed starts with the requirements agent and ends with one complete event")
        void feedOrder() {
            Harness h = harness(PipelineServiceTest.this::cooperative);
            RunHandle handle = h.service().submit(new DesignRequest(WEB_APP, null));
            handle.await();

            List<StreamEvent> events = drain(handle);

            assertEquals(EventType.AGENT_START, events.get(0).type());
            assertEquals(RequirementsNode.ID, events.get(0).agent());
            assertEquals(EventType.COMPLETE, events.get(events.size() - 1).type());
            assertEquals(1, events.stream().filter(StreamEvent::isTerminal).count());
            assertEquals(9, events.stream().filter(e -> e.type() == EventType.AGENT_START).count());
            for (int i = 1; i < events.size(); i++) {
                assertTrue(events.get(i).sequence() > events.get(i - 1).sequence());
            }
        }

        @Test
        @DisplayName("a clarification terminal returns questions and is not cached")
        void clarification() {
            Harness h = harness(messages -> systemPrompt(messages).contains("reviewing a new infrastructure request")
                    ? "1. How many users?\n2. Which cloud?"
                    : "unused");

            PipelineResult result = h.service().submit(new DesignRequest(WEB_APP, null)).await();

            assertEquals(PipelineResult.Outcome.COMPLETE, result.outcome());
            assertTrue(result.bundle().clarificationNeeded());
            assertEquals("1. How many users?\n2. Which cloud?", result.bundle().clarifyingQuestions());
            assertEquals(1, h.factory().callCount());
            assertFalse(h.service().submit(new DesignRequest(WEB_APP, null)).isCached());
        }

        @Test
        @DisplayName("a permanent model failure ends the run with an error event")
        void permanentFailure() {
            Harness h = harness(messages -> {
                if (systemPrompt(messages).contains("infrastructure-as-code engineer")) {
                    throw new PermanentServiceException("invalid request");
                }
                return cooperative(messages);
            });

            RunHandle handle = h.service().submit(new DesignRequest(WEB_APP, null));
            PipelineResult result = handle.await();

            assertEquals(PipelineResult.Outcome.ERROR, result.outcome());
            assertEquals(ErrorKind.PERMANENT_SERVICE_ERROR, result.errorKind());
            assertEquals(DesignPipelineGraph.TERRAFORM_STAGE, result.failedStage());
            assertEquals(TerraformCoderNode.ID, result.failedNode());

            List<StreamEvent> events = drain(handle);
            StreamEvent last = events.get(events.size() - 1);
            assertEquals(EventType.ERROR, last.type());
            assertTrue(last.message().contains("PermanentServiceError"));
            assertFalse(h.service().submit(new DesignRequest(WEB_APP, null)).isCached());
        }
    }

    @Nested
    @DisplayName("result cache")
    class Caching {

        @Test
        @DisplayName("a repeated request is served from the cache without any model call")
        void secondSubmissionHitsCache() {
            Harness h = harness(PipelineServiceTest.this::cooperative);
            PipelineResult first = h.service().submit(new DesignRequest(WEB_APP, null)).await();
            int callsAfterFirst = h.factory().callCount();

            RunHandle second = h.service().submit(new DesignRequest("  build A WEB app ", null));
            PipelineResult cached = second.await();

            assertTrue(second.isCached());
            assertTrue(cached.cached());
            assertEquals(first.bundle(), cached.bundle());
            assertEquals(callsAfterFirst, h.factory().callCount());
            assertEquals(List.of(EventType.CACHE_HIT, EventType.COMPLETE),
                    drain(second).stream().map(StreamEvent::type).toList());
            assertEquals(1, h.cache().stats().hits());
        }

        @Test
        @DisplayName("different configuration is a different cache key")
        void configurationChangesKey() {
            Harness h = harness(PipelineServiceTest.this::cooperative);
            h.service().submit(new DesignRequest(WEB_APP, null)).await();

            RunHandle other = h.service().submit(new DesignRequest(WEB_APP,
                    DesignConfiguration.fromMap(Map.of("compliance", "regulated"))));
            other.await();

            assertFalse(other.isCached());
        }
    }

    @Nested
    @DisplayName("single-flight")
    class SingleFlight {

        @Test
        @DisplayName("concurrent identical submissions share one execution")
        void collapsesConcurrentSubmissions() throws Exception {
            var gate = new CountDownLatch(1);
            Harness h = harness(messages -> {
                if (systemPrompt(messages).contains("reviewing a new infrastructure request")) {
                    try {
                        gate.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("interrupted");
                    }
                }
                return cooperative(messages);
            });

            int callers = 5;
            var start = new CountDownLatch(1);
            List<java.util.concurrent.Future<RunHandle>> submissions = new ArrayList<>();
            ExecutorService clients = Executors.newFixedThreadPool(callers);
            try {
                for (int i = 0; i < callers; i++) {
                    submissions.add(clients.submit(() -> {
                        start.await();
                        return h.service().submit(new DesignRequest(WEB_APP, null));
                    }));
                }
                start.countDown();
                List<RunHandle> handles = new ArrayList<>();
                for (var submission : submissions) {
                    handles.add(submission.get(5, TimeUnit.SECONDS));
                }
                assertEquals(1, h.service().activeRuns());
                gate.countDown();

                String runId = handles.get(0).runId();
                for (RunHandle handle : handles) {
                    assertEquals(runId, handle.runId());
                    assertEquals(PipelineResult.Outcome.COMPLETE, handle.await().outcome());
                }
                assertEquals(1, requirementsCalls.get());
                assertEquals(callers - 1, handles.stream().filter(RunHandle::isAttached).count());
                assertEquals(callers - 1.0, registry.find("archflow.singleflight.attached").counter().count());
                assertEquals(0, h.service().activeRuns());
            } finally {
                gate.countDown();
                clients.shutdownNow();
            }
        }

        @Test
        @DisplayName("a caller that missed the cache while the run finished gets the cached result")
        void missRacingWithFinishedRunDoesNotRunAgain() throws Exception {
            var gate = new CountDownLatch(1);
            var store = new PausingStore();
            Harness h = harness(messages -> {
                if (systemPrompt(messages).contains("reviewing a new infrastructure request")) {
                    try {
                        gate.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("interrupted");
                    }
                }
                return cooperative(messages);
            }, store);

            RunHandle first = h.service().submit(new DesignRequest(WEB_APP, null));
            ExecutorService late = Executors.newSingleThreadExecutor();
            try {
                var lateSubmission = late.submit(() -> {
                    store.paused = Thread.currentThread();
                    return h.service().submit(new DesignRequest(WEB_APP, null));
                });
                assertTrue(store.readDone.await(5, TimeUnit.SECONDS));

                gate.countDown();
                assertEquals(PipelineResult.Outcome.COMPLETE, first.await().outcome());
                assertEquals(0, h.service().activeRuns());
                store.resume.countDown();

                RunHandle second = lateSubmission.get(5, TimeUnit.SECONDS);
                assertTrue(second.isCached());
                assertEquals(PipelineResult.Outcome.COMPLETE, second.await().outcome());
                assertEquals(1, requirementsCalls.get());
                assertEquals(1, h.cache().stats().hits());
                assertEquals(1, h.cache().stats().misses());
            } finally {
                gate.countDown();
                store.resume.countDown();
                late.shutdownNow();
            }
        }
    }

    /** Holds one thread right after its read returns, so a run can finish behind its back. */
    private static final class PausingStore extends InMemoryFingerprintCacheStore {
        private final CountDownLatch readDone = new CountDownLatch(1);
        private final CountDownLatch resume = new CountDownLatch(1);
        private volatile Thread paused;

        @Override
        public Optional<CacheEntry> get(String fingerprint) {
            Optional<CacheEntry> entry = super.get(fingerprint);
            if (Thread.currentThread() == paused) {
                paused = null;
                readDone.countDown();
                try {
                    resume.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return entry;
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("the last subscriber leaving cancels the run without a terminal event")
        void abandonedRunIsCancelled() throws Exception {
            var entered = new CountDownLatch(1);
            Harness h = harness(messages -> {
                if (systemPrompt(messages).contains("reviewing a new infrastructure request")) {
                    entered.countDown();
                    try {
                        new CountDownLatch(1).await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("interrupted");
                    }
                }
                return cooperative(messages);
            });

            RunHandle handle = h.service().submit(new DesignRequest(WEB_APP, null));
            EventStream stream = handle.events();
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            stream.close();

            PipelineResult result = handle.result().get(5, TimeUnit.SECONDS);
            assertEquals(PipelineResult.Outcome.CANCELLED, result.outcome());
            assertTrue(drain(handle).stream().noneMatch(StreamEvent::isTerminal));
            assertEquals(0, h.service().activeRuns());
            assertNotNull(registry.find("archflow.runs.total").tag("status", "cancelled").counter());
        }
    }
}
