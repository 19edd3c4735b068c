package com.archflow.core.llm;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import reactor.core.Exceptions;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever the Spring AI / HTTP stack throws onto the engine's error taxonomy
 * so the node retry policy can tell transient from permanent failures.
 */
public final class ModelErrorClassifier {

    private ModelErrorClassifier() {}

    /**
     * Classifies a failure from a model call.
     *
     * @return a {@link ModelServiceException}, or a {@link CancellationException} when the
     *         calling thread was interrupted (the interrupt flag is restored)
     */
    public static RuntimeException classify(Throwable failure) {
        Throwable root = Exceptions.unwrap(failure);

        for (Throwable t = root; t != null; t = t.getCause()) {
            if (t instanceof ModelServiceException mse) {
                return mse;
            }
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                var cancelled = new CancellationException("Model call interrupted");
                cancelled.initCause(t);
                return cancelled;
            }
            if (t instanceof TimeoutException || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException) {
                return new TransientServiceException(TransientServiceException.Cause.TIMEOUT,
                        "Model call timed out", root);
            }
        }

        for (Throwable t = root; t != null; t = t.getCause()) {
            if (t instanceof RestClientResponseException http) {
                return fromStatus(http.getStatusCode().value(), root);
            }
            if (t instanceof TransientAiException) {
                return isRateLimit(t.getMessage())
                        ? new TransientServiceException(TransientServiceException.Cause.RATE_LIMIT,
                                "Model service rate limit", root)
                        : new TransientServiceException(TransientServiceException.Cause.SERVICE_ERROR,
                                "Model service unavailable", root);
            }
            if (t instanceof NonTransientAiException) {
                return new PermanentServiceException("Model service rejected the request", root);
            }
            if (t instanceof ResourceAccessException) {
                return new TransientServiceException(TransientServiceException.Cause.SERVICE_ERROR,
                        "Model service unreachable", root);
            }
        }

        if (root != null && isRateLimit(root.getMessage())) {
            return new TransientServiceException(TransientServiceException.Cause.RATE_LIMIT,
                    "Model service rate limit", root);
        }
        return new PermanentServiceException("Model call failed: "
                + (root != null ? root.getClass().getSimpleName() : "unknown"), root);
    }

    static RuntimeException fromStatus(int status, Throwable cause) {
        if (status == 429) {
            return new TransientServiceException(TransientServiceException.Cause.RATE_LIMIT,
                    "Model service rate limit (HTTP 429)", cause);
        }
        if (status == 408 || status == 504) {
            return new TransientServiceException(TransientServiceException.Cause.TIMEOUT,
                    "Model service timeout (HTTP " + status + ")", cause);
        }
        if (status >= 500) {
            return new TransientServiceException(TransientServiceException.Cause.SERVICE_ERROR,
                    "Model service error (HTTP " + status + ")", cause);
        }
        return new PermanentServiceException("Model service rejected the request (HTTP " + status + ")", cause);
    }

    private static boolean isRateLimit(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate_limit") || lower.contains("rate limit") || lower.contains("429")
                || lower.contains("too many requests") || lower.contains("quota");
    }
}
