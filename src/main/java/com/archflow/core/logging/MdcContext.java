package com.archflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Archflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String NODE_ID = "nodeId";
    public static final String MODEL_ROLE = "modelRole";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setNode(String runId, String nodeId, String modelRole) {
        MDC.put(RUN_ID, runId);
        MDC.put(NODE_ID, nodeId);
        MDC.put(MODEL_ROLE, modelRole);
    }

    public static void clearNode() {
        MDC.remove(NODE_ID);
        MDC.remove(MODEL_ROLE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(NODE_ID);
        MDC.remove(MODEL_ROLE);
    }
}
