package com.archflow.dispatch.api;

import com.archflow.core.engine.RunHandle;
import com.archflow.core.events.EventStream;
import com.archflow.core.events.StreamEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges a run's {@link EventStream} to an {@link SseEmitter}: one {@code data:} JSON
 * line per event, in feed order.
 * <p>
 * Each emitter gets a pump thread that drains the run's feed. When the client goes
 * away (completion, timeout, send failure) the feed is closed, which cancels the run
 * if nobody else is following it. Heartbeats are sent as SSE comments (lines starting
 * with ':') to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes (for long-running pipelines). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final long timeoutMs;

    /** Tracks active emitter registrations for heartbeats and cleanup. */
    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger pumpCounter = new AtomicInteger();
    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump-" + pumpCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService() {
        this(DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeatScheduler.shutdown();
        activeRegistrations.forEach(r -> r.stream().close());
        pumps.shutdownNow();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE streaming stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for run {}: {}", registration.runId(), e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams the run's feed from the beginning.
     */
    public SseEmitter createEmitter(RunHandle handle) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventStream stream = handle.events();
        var registration = new EmitterRegistration(handle.runId(), emitter, stream);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", handle.runId());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", handle.runId(), ex.getMessage());
            cleanup(registration);
        });

        pumps.execute(() -> pump(registration));
        log.info("SSE emitter created for run {} (timeout={}ms, cached={}, attached={})",
                handle.runId(), timeoutMs, handle.isCached(), handle.isAttached());
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void pump(EmitterRegistration registration) {
        EventStream stream = registration.stream();
        try {
            while (stream.hasNext()) {
                StreamEvent event = stream.next();
                registration.emitter().send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
            }
            registration.emitter().complete();
            cleanup(registration);
        } catch (IOException | IllegalStateException e) {
            log.debug("Client of run {} went away: {}", registration.runId(), e.getMessage());
            cleanup(registration);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.stream().close();
            log.debug("Cleaned up SSE registration for run {}", registration.runId());
        }
    }

    private record EmitterRegistration(String runId, SseEmitter emitter, EventStream stream) {}
}
