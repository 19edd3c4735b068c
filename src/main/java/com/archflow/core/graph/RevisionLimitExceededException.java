package com.archflow.core.graph;

import com.archflow.core.model.ErrorKind;

public class RevisionLimitExceededException extends PipelineExecutionException {

    private final int attempts;

    public RevisionLimitExceededException(String stage, String nodeId, int attempts) {
        super(ErrorKind.REVISION_LIMIT_EXCEEDED, stage, nodeId,
                "Decision still rejected after " + attempts + " design attempts", null);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
