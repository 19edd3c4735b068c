package com.archflow.core.events;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single subscriber's view of a run's feed: a lazy, finite, consume-once sequence.
 * <p>
 * {@link #hasNext()} blocks until the next event arrives or the feed ends. The feed
 * ends after the sink is closed and every buffered event has been read, or as soon
 * as {@link #close()} is called (closing from another thread unblocks a waiting reader).
 */
public final class EventStream implements Iterator<StreamEvent>, AutoCloseable {

    private static final Object END = new Object();

    private final EventSink sink;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private StreamEvent next;
    private boolean finished;

    EventStream(EventSink sink) {
        this.sink = sink;
    }

    void deliver(StreamEvent event) {
        queue.offer(event);
    }

    void end() {
        queue.offer(END);
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Object item;
        try {
            item = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            finished = true;
            return false;
        }
        if (item == END) {
            finished = true;
            return false;
        }
        next = (StreamEvent) item;
        return true;
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Event stream has ended");
        }
        StreamEvent event = next;
        next = null;
        return event;
    }

    /**
     * Detaches from the sink. If this was the run's last subscriber and the run has not
     * yet published its terminal event, the sink reports the run as abandoned.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.offer(END);
            sink.unsubscribe(this);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
