package com.archflow.core.engine;

import com.archflow.core.cache.DesignCache;
import com.archflow.core.cache.Fingerprinter;
import com.archflow.core.events.EventSink;
import com.archflow.core.events.StreamEvent;
import com.archflow.core.graph.DesignPipelineGraph;
import com.archflow.core.graph.GraphExecutor;
import com.archflow.core.graph.PipelineExecutionException;
import com.archflow.core.graph.PipelineGraph;
import com.archflow.core.graph.RunContext;
import com.archflow.core.logging.MdcContext;
import com.archflow.core.metrics.PipelineMetrics;
import com.archflow.core.model.DesignBundle;
import com.archflow.core.model.DesignRequest;
import com.archflow.core.model.ErrorKind;
import com.archflow.core.model.PipelineResult;
import com.archflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the engine: fingerprints a request, answers from the result cache
 * when possible, and otherwise runs the design graph, collapsing concurrent requests
 * for the same fingerprint into a single execution.
 * <p>
 * A finished run writes through to the cache (complete, cacheable runs only), leaves
 * the in-flight table, and then publishes its terminal event and closes its sink.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final DesignCache cache;
    private final GraphExecutor graphExecutor;
    private final PipelineGraph graph;
    private final ExecutorService runExecutor;
    private final PipelineMetrics metrics;
    private final ConcurrentHashMap<String, ActiveRun> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public PipelineService(DesignCache cache, GraphExecutor graphExecutor, DesignPipelineGraph designGraph,
                           ExecutorService runExecutor, PipelineMetrics metrics) {
        this(cache, graphExecutor, designGraph.graph(), runExecutor, metrics);
    }

    public PipelineService(DesignCache cache, GraphExecutor graphExecutor, PipelineGraph graph,
                           ExecutorService runExecutor, PipelineMetrics metrics) {
        this.cache = cache;
        this.graphExecutor = graphExecutor;
        this.graph = graph;
        this.runExecutor = runExecutor;
        this.metrics = metrics;
    }

    /**
     * Submits a request and returns immediately. The run, if one is needed, executes
     * in the background; follow it through {@link RunHandle#events()} or
     * {@link RunHandle#await()}.
     */
    public RunHandle submit(DesignRequest request) {
        String fingerprint = Fingerprinter.fingerprint(request);

        Optional<DesignBundle> hit = cache.lookup(fingerprint);
        if (hit.isPresent()) {
            return replayFromCache(fingerprint, hit.get());
        }

        AtomicReference<ActiveRun> created = new AtomicReference<>();
        ActiveRun run = inFlight.computeIfAbsent(fingerprint, fp -> {
            ActiveRun fresh = new ActiveRun(generateRunId(), fp, request);
            created.set(fresh);
            return fresh;
        });

        if (created.get() == null) {
            metrics.incrementSingleFlightAttached();
            log.info("Attached to in-flight run {} for fingerprint {}", run.runId, fingerprint);
            return run.handle(true);
        }

        // a run for this fingerprint may have cached its result and left the table
        // between the first lookup and the claim above
        Optional<DesignBundle> stored = cache.recheck(fingerprint);
        if (stored.isPresent()) {
            inFlight.remove(fingerprint, run);
            // callers that attached in the meantime share this sink and result
            return serveFromCache(run.runId, fingerprint, stored.get(), run.sink, run.result);
        }

        log.info("Starting run {} for fingerprint {} (scenario={})",
                run.runId, fingerprint, request.configuration().scenario());
        runExecutor.execute(() -> execute(run));
        return run.handle(false);
    }

    /**
     * Number of runs currently executing.
     */
    public int activeRuns() {
        return inFlight.size();
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("ARCH-%d-%04d", year, count);
    }

    private RunHandle replayFromCache(String fingerprint, DesignBundle bundle) {
        String runId = generateRunId();
        return serveFromCache(runId, fingerprint, bundle, new EventSink(runId), new CompletableFuture<>());
    }

    private RunHandle serveFromCache(String runId, String fingerprint, DesignBundle bundle,
                                     EventSink sink, CompletableFuture<PipelineResult> result) {
        log.info("Cache hit for fingerprint {}; run {} served without executing the graph", fingerprint, runId);
        sink.publish(StreamEvent.cacheHit(runId, fingerprint));
        sink.publish(StreamEvent.complete(runId, bundle));
        sink.close();
        result.complete(PipelineResult.complete(runId, fingerprint, bundle, true));
        metrics.recordRunResult("cached");
        return new RunHandle(runId, fingerprint, sink, result, true, false);
    }

    private void execute(ActiveRun run) {
        MdcContext.setRun(run.runId);
        run.context.attachRunner();
        long start = System.currentTimeMillis();
        try {
            run.context.checkCancelled();
            RunState state = new RunState(run.runId, run.fingerprint, run.request);
            graphExecutor.execute(graph, state, run.context, run.sink);
            run.context.checkCancelled();

            DesignBundle bundle = state.toBundle();
            if (!state.clarificationNeeded() && cache.shouldCache(run.request.text())) {
                cache.store(run.fingerprint, bundle);
            }
            metrics.recordRevisions(state.revisionCount());
            log.info("Run {} {} in {} ms (revisions={})", run.runId,
                    state.clarificationNeeded() ? "stopped for clarification" : "completed",
                    System.currentTimeMillis() - start, state.revisionCount());
            finish(run, PipelineResult.complete(run.runId, run.fingerprint, bundle, false),
                    StreamEvent.complete(run.runId, bundle),
                    state.clarificationNeeded() ? "clarification" : "complete");
        } catch (CancellationException e) {
            cancelled(run);
        } catch (PipelineExecutionException e) {
            if (run.context.isCancelled()) {
                cancelled(run);
                return;
            }
            log.error("Run {} failed at stage {} (node={}, kind={})",
                    run.runId, e.stage(), e.nodeId(), e.kind().label(), e);
            fail(run, e.kind(), e.stage(), e.nodeId());
        } catch (RuntimeException e) {
            if (run.context.isCancelled()) {
                cancelled(run);
                return;
            }
            log.error("Run {} failed unexpectedly", run.runId, e);
            fail(run, ErrorKind.INTERNAL_ERROR, null, null);
        } finally {
            run.context.detachRunner();
            MdcContext.clear();
        }
    }

    private void fail(ActiveRun run, ErrorKind kind, String stage, String nodeId) {
        PipelineResult result = PipelineResult.error(run.runId, run.fingerprint, kind, stage, nodeId);
        finish(run, result, StreamEvent.error(run.runId, nodeId, result.message()), "error");
    }

    private void cancelled(ActiveRun run) {
        log.info("Run {} cancelled", run.runId);
        finish(run, PipelineResult.cancelled(run.runId, run.fingerprint), null, "cancelled");
    }

    private void finish(ActiveRun run, PipelineResult result, StreamEvent terminal, String status) {
        inFlight.remove(run.fingerprint, run);
        if (terminal != null) {
            run.sink.publish(terminal);
        }
        run.sink.close();
        run.result.complete(result);
        metrics.recordRunResult(status);
    }

    private static final class ActiveRun {
        private final String runId;
        private final String fingerprint;
        private final DesignRequest request;
        private final RunContext context;
        private final EventSink sink;
        private final CompletableFuture<PipelineResult> result = new CompletableFuture<>();

        ActiveRun(String runId, String fingerprint, DesignRequest request) {
            this.runId = runId;
            this.fingerprint = fingerprint;
            this.request = request;
            this.context = new RunContext(runId);
            this.sink = new EventSink(runId, this::abandon);
        }

        private void abandon() {
            if (context.cancel()) {
                log.info("Cancelling run {}: no subscriber left", runId);
            }
        }

        RunHandle handle(boolean attached) {
            return new RunHandle(runId, fingerprint, sink, result, false, attached);
        }
    }
}
