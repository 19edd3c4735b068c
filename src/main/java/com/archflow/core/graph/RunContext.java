package com.archflow.core.graph;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation scope of one run. The thread driving the run and every future doing
 * work for it are registered here so {@link #cancel()} can interrupt all of them at once.
 */
public class RunContext {

    private final String runId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private Thread runner;

    public RunContext(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    /**
     * Registers work for the run. Work registered after cancellation is cancelled immediately.
     */
    public void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void deregister(Future<?> future) {
        inFlight.remove(future);
    }

    /**
     * Marks the current thread as the one driving the run until {@link #detachRunner()}.
     */
    public synchronized void attachRunner() {
        runner = Thread.currentThread();
        if (cancelled.get()) {
            runner.interrupt();
        }
    }

    /**
     * Releases the driving thread and clears any interrupt this context delivered to it.
     */
    public synchronized void detachRunner() {
        if (runner == Thread.currentThread()) {
            runner = null;
            Thread.interrupted();
        }
    }

    /**
     * @return {@code true} if this call cancelled the run
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        inFlight.forEach(f -> f.cancel(true));
        synchronized (this) {
            if (runner != null) {
                runner.interrupt();
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Run " + runId + " cancelled");
        }
    }
}
