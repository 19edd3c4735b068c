package com.archflow.core.llm;

import com.archflow.core.model.ErrorKind;

/**
 * Base class for failures reported by the chat-completion service.
 */
public abstract class ModelServiceException extends RuntimeException {

    protected ModelServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public abstract boolean isRetryable();
}
