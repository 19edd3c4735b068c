package com.archflow.core.llm;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ModelErrorClassifierTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static TransientServiceException.Cause transientCause(Throwable failure) {
        RuntimeException classified = ModelErrorClassifier.classify(failure);
        assertInstanceOf(TransientServiceException.class, classified);
        return ((TransientServiceException) classified).transientCause();
    }

    @Test
    @DisplayName("HTTP 429 is a transient rate limit")
    void rateLimit() {
        assertEquals(TransientServiceException.Cause.RATE_LIMIT,
                transientCause(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "slow down", HttpHeaders.EMPTY, new byte[0], null)));
    }

    @Test
    @DisplayName("HTTP 5xx is a transient service error")
    void serverError() {
        assertEquals(TransientServiceException.Cause.SERVICE_ERROR,
                transientCause(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "bad gateway", HttpHeaders.EMPTY, new byte[0], null)));
    }

    @Test
    @DisplayName("HTTP 504 and 408 are timeouts")
    void gatewayTimeout() {
        assertEquals(TransientServiceException.Cause.TIMEOUT, transientCause(
                HttpServerErrorException.create(HttpStatus.GATEWAY_TIMEOUT, "timeout", HttpHeaders.EMPTY, new byte[0], null)));
        assertEquals(TransientServiceException.Cause.TIMEOUT,
                ((TransientServiceException) ModelErrorClassifier.fromStatus(408, null)).transientCause());
    }

    @Test
    @DisplayName("other 4xx responses are permanent")
    void clientError() {
        assertInstanceOf(PermanentServiceException.class, ModelErrorClassifier.classify(
                HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "bad key", HttpHeaders.EMPTY, new byte[0], null)));
    }

    @Test
    @DisplayName("timeouts anywhere in the cause chain are transient")
    void timeoutInChain() {
        assertEquals(TransientServiceException.Cause.TIMEOUT,
                transientCause(new RuntimeException("wrapped", new TimeoutException("deadline"))));
    }

    @Test
    @DisplayName("Spring AI transient and non-transient exceptions map across")
    void springAiExceptions() {
        assertEquals(TransientServiceException.Cause.RATE_LIMIT,
                transientCause(new TransientAiException("429 rate limit reached")));
        assertEquals(TransientServiceException.Cause.SERVICE_ERROR,
                transientCause(new TransientAiException("upstream overloaded")));
        assertInstanceOf(PermanentServiceException.class,
                ModelErrorClassifier.classify(new NonTransientAiException("invalid model")));
    }

    @Test
    @DisplayName("connection failures are transient")
    void connectionFailure() {
        assertEquals(TransientServiceException.Cause.SERVICE_ERROR,
                transientCause(new ResourceAccessException("connection refused")));
    }

    @Test
    @DisplayName("already classified exceptions pass through")
    void passThrough() {
        var permanent = new PermanentServiceException("nope");
        assertSame(permanent, ModelErrorClassifier.classify(permanent));
    }

    @Test
    @DisplayName("interrupts become cancellations and keep the interrupt flag")
    void interrupted() {
        RuntimeException classified = ModelErrorClassifier.classify(new RuntimeException(new InterruptedException()));
        assertInstanceOf(CancellationException.class, classified);
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    @DisplayName("unknown failures are permanent")
    void unknown() {
        assertInstanceOf(PermanentServiceException.class, ModelErrorClassifier.classify(new IllegalStateException("?")));
    }
}
