package com.archflow.core.llm;

import com.archflow.core.model.ErrorKind;

/**
 * Non-retryable model-service failure such as a malformed request or rejected credentials.
 */
public class PermanentServiceException extends ModelServiceException {

    public PermanentServiceException(String message) {
        super(message, null);
    }

    public PermanentServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMANENT_SERVICE_ERROR;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
