package com.archflow.core.graph;

import com.archflow.core.model.ErrorKind;

/**
 * The graph is malformed, either when it is built or when a decision node leaves the
 * run in a status the revision predicate does not understand.
 */
public class GraphDefinitionException extends PipelineExecutionException {

    public GraphDefinitionException(String message) {
        this(null, null, message);
    }

    public GraphDefinitionException(String stage, String nodeId, String message) {
        super(ErrorKind.GRAPH_DEFINITION_ERROR, stage, nodeId, message, null);
    }
}
