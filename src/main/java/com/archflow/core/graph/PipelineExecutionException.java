package com.archflow.core.graph;

import com.archflow.core.model.ErrorKind;

/**
 * A run ended in error. Carries the stable error kind and where it happened.
 */
public class PipelineExecutionException extends RuntimeException {

    private final ErrorKind kind;
    private final String stage;
    private final String nodeId;

    public PipelineExecutionException(ErrorKind kind, String stage, String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
        this.nodeId = nodeId;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String stage() {
        return stage;
    }

    public String nodeId() {
        return nodeId;
    }
}
