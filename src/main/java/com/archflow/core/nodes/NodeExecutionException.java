package com.archflow.core.nodes;

import com.archflow.core.model.ErrorKind;

/**
 * A node gave up: its model call failed permanently or kept failing transiently
 * after every retry.
 */
public class NodeExecutionException extends RuntimeException {

    private final String nodeId;
    private final ErrorKind kind;

    public NodeExecutionException(String nodeId, ErrorKind kind, Throwable cause) {
        super("Node " + nodeId + " failed: " + kind.label()
                + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.nodeId = nodeId;
        this.kind = kind;
    }

    public String nodeId() {
        return nodeId;
    }

    public ErrorKind kind() {
        return kind;
    }
}
