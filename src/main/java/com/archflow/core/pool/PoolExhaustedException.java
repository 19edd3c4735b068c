package com.archflow.core.pool;

import com.archflow.core.llm.ModelRole;
import com.archflow.core.llm.TransientServiceException;

/**
 * Raised only when a temporary-client cap is configured and no pooled entry or
 * temporary slot became free within the configured wait.
 */
public class PoolExhaustedException extends TransientServiceException {

    private final ModelRole role;

    public PoolExhaustedException(ModelRole role, String message) {
        super(Cause.SERVICE_ERROR, message);
        this.role = role;
    }

    public ModelRole role() {
        return role;
    }
}
