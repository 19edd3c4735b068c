package com.archflow.core.model;

/**
 * Error taxonomy surfaced to event-stream consumers. The label is part of the
 * public wire contract and must stay stable.
 */
public enum ErrorKind {
    TRANSIENT_SERVICE_ERROR("TransientServiceError"),
    PERMANENT_SERVICE_ERROR("PermanentServiceError"),
    REVISION_LIMIT_EXCEEDED("RevisionLimitExceeded"),
    GRAPH_DEFINITION_ERROR("GraphDefinitionError"),
    INTERNAL_ERROR("InternalError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
