package com.archflow.core.nodes;

import com.archflow.core.events.EventSink;
import com.archflow.core.events.StreamEvent;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * What a node may touch besides the run state: the run's event sink and its
 * cancellation signal.
 */
public final class NodeContext {

    private final String runId;
    private final EventSink sink;
    private final BooleanSupplier cancelled;

    public NodeContext(String runId, EventSink sink, BooleanSupplier cancelled) {
        this.runId = runId;
        this.sink = sink;
        this.cancelled = cancelled;
    }

    public String runId() {
        return runId;
    }

    public void publish(StreamEvent event) {
        sink.publish(event);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    public void checkCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Run " + runId + " cancelled");
        }
    }
}
