package com.archflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered broadcast channel for one run.
 * <p>
 * Every published event is appended to the run's history and handed to each live
 * subscriber under one lock, so all subscribers observe the same total order and a
 * subscriber that joins late replays the history first. Publishing after the terminal
 * event is ignored. When the last subscriber detaches before the terminal event the
 * abandon callback fires so the owner can cancel the run.
 */
public class EventSink {

    private static final Logger log = LoggerFactory.getLogger(EventSink.class);

    private final String runId;
    private final Runnable onAbandoned;
    private final List<StreamEvent> history = new ArrayList<>();
    private final List<EventStream> subscribers = new ArrayList<>();
    private long sequence;
    private boolean terminated;
    private boolean closed;

    public EventSink(String runId) {
        this(runId, () -> {});
    }

    public EventSink(String runId, Runnable onAbandoned) {
        this.runId = runId;
        this.onAbandoned = onAbandoned;
    }

    /**
     * Publishes an event to every subscriber.
     *
     * @return {@code false} if the event was dropped because the feed already terminated
     */
    public synchronized boolean publish(StreamEvent event) {
        if (terminated || closed) {
            log.debug("Dropping {} event for run {}: feed already terminated", event.type().wireName(), runId);
            return false;
        }
        StreamEvent sequenced = event.withSequence(sequence++);
        history.add(sequenced);
        for (EventStream subscriber : subscribers) {
            subscriber.deliver(sequenced);
        }
        if (sequenced.isTerminal()) {
            terminated = true;
        }
        return true;
    }

    /**
     * Opens a new subscription that replays everything published so far.
     */
    public synchronized EventStream subscribe() {
        var stream = new EventStream(this);
        history.forEach(stream::deliver);
        if (closed) {
            stream.end();
        } else {
            subscribers.add(stream);
        }
        return stream;
    }

    /**
     * Ends every subscription once its buffered events are consumed. Idempotent.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (EventStream subscriber : subscribers) {
            subscriber.end();
        }
        subscribers.clear();
    }

    void unsubscribe(EventStream stream) {
        boolean abandoned;
        synchronized (this) {
            abandoned = subscribers.remove(stream) && subscribers.isEmpty() && !terminated && !closed;
        }
        if (abandoned) {
            log.info("Last subscriber of run {} disconnected before completion", runId);
            onAbandoned.run();
        }
    }

    public String runId() {
        return runId;
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int subscriberCount() {
        return subscribers.size();
    }

    public synchronized List<StreamEvent> history() {
        return List.copyOf(history);
    }
}
