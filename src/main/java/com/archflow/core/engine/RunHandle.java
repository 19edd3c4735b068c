package com.archflow.core.engine;

import com.archflow.core.events.EventSink;
import com.archflow.core.events.EventStream;
import com.archflow.core.model.PipelineResult;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A caller's view of a submitted run. Callers attached to the same run through
 * single-flight get distinct handles that share the run's sink and result.
 */
public final class RunHandle {

    private final String runId;
    private final String fingerprint;
    private final EventSink sink;
    private final CompletableFuture<PipelineResult> result;
    private final boolean cached;
    private final boolean attached;

    RunHandle(String runId, String fingerprint, EventSink sink, CompletableFuture<PipelineResult> result,
              boolean cached, boolean attached) {
        this.runId = runId;
        this.fingerprint = fingerprint;
        this.sink = sink;
        this.result = result;
        this.cached = cached;
        this.attached = attached;
    }

    public String runId() {
        return runId;
    }

    public String fingerprint() {
        return fingerprint;
    }

    /**
     * Opens a live feed that first replays everything the run has published. Closing the
     * feed before the terminal event cancels the run if no other subscriber remains.
     */
    public EventStream events() {
        return sink.subscribe();
    }

    /**
     * The run's terminal result. Completes with outcome {@code CANCELLED} for cancelled runs.
     */
    public CompletableFuture<PipelineResult> result() {
        return result.copy();
    }

    /**
     * Blocks until the run finishes, holding a subscription so the run is not treated
     * as abandoned while this caller waits.
     *
     * @throws CancellationException if the waiting thread is interrupted
     */
    public PipelineResult await() {
        try (EventStream ignored = sink.subscribe()) {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for run " + runId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " failed unexpectedly", e.getCause());
        }
    }

    /** Whether the result came straight from the result cache. */
    public boolean isCached() {
        return cached;
    }

    /** Whether this caller joined a run started by someone else. */
    public boolean isAttached() {
        return attached;
    }
}
