package com.archflow.core.llm;

import com.archflow.core.model.ErrorKind;

/**
 * Retryable model-service failure: timeouts, rate limits and 5xx responses.
 */
public class TransientServiceException extends ModelServiceException {

    public enum Cause {
        TIMEOUT,
        RATE_LIMIT,
        SERVICE_ERROR
    }

    private final Cause transientCause;

    public TransientServiceException(Cause transientCause, String message) {
        this(transientCause, message, null);
    }

    public TransientServiceException(Cause transientCause, String message, Throwable cause) {
        super(message, cause);
        this.transientCause = transientCause;
    }

    public Cause transientCause() {
        return transientCause;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT_SERVICE_ERROR;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
