package com.archflow.dispatch.api;

import com.archflow.core.engine.RunHandle;
import com.archflow.core.events.EventSink;
import com.archflow.core.events.StreamEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private static final String RUN = "ARCH-2026-0001";

    private AtomicInteger abandoned;
    private EventSink sink;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        abandoned = new AtomicInteger();
        sink = new EventSink(RUN, abandoned::incrementAndGet);
        service = new SseStreamingService(60_000L);
    }

    @AfterEach
    void tearDown() {
        service.stop();
    }

    private RunHandle handle() {
        RunHandle handle = mock(RunHandle.class);
        when(handle.runId()).thenReturn(RUN);
        when(handle.events()).thenAnswer(invocation -> sink.subscribe());
        return handle;
    }

    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a non-null SseEmitter and subscribes to the run")
        void createsEmitter() {
            SseEmitter emitter = service.createEmitter(handle());

            assertNotNull(emitter);
            assertEquals(1, service.activeEmitterCount());
            assertEquals(1, sink.subscriberCount());
        }

        @Test
        @DisplayName("multiple emitters can follow the same run")
        void multipleEmitters() {
            RunHandle handle = handle();
            SseEmitter first = service.createEmitter(handle);
            SseEmitter second = service.createEmitter(handle);

            assertNotSame(first, second);
            assertEquals(2, sink.subscriberCount());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("the registration goes away once the run's feed ends")
        void endsWithFeed() throws Exception {
            service.createEmitter(handle());

            sink.publish(StreamEvent.agentStart(RUN, "requirements"));
            sink.publish(StreamEvent.complete(RUN, Map.of()));
            sink.close();

            assertTrue(eventually(() -> service.activeEmitterCount() == 0));
            assertEquals(0, abandoned.get());
        }

        @Test
        @DisplayName("shutting down closes open feeds, abandoning unfinished runs")
        void stopAbandonsRun() throws Exception {
            service.createEmitter(handle());
            sink.publish(StreamEvent.agentStart(RUN, "requirements"));

            service.stop();

            assertTrue(eventually(() -> abandoned.get() == 1));
            assertEquals(0, sink.subscriberCount());
        }
    }
}
