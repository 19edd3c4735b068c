package com.archflow.core.model;

/**
 * Terminal result of one submitted run, shared by every caller attached to it.
 *
 * @param runId        run identifier
 * @param fingerprint  normalized-input fingerprint
 * @param outcome      how the run ended
 * @param bundle       the produced bundle; {@code null} unless {@code outcome} is {@code COMPLETE}
 * @param errorKind    error classification; {@code null} unless {@code outcome} is {@code ERROR}
 * @param failedStage  the stage the failing node belongs to; nullable
 * @param failedNode   the failing node id; nullable
 * @param message      short user-visible message for errors
 * @param cached       whether the bundle came from the result cache
 */
public record PipelineResult(
        String runId,
        String fingerprint,
        Outcome outcome,
        DesignBundle bundle,
        ErrorKind errorKind,
        String failedStage,
        String failedNode,
        String message,
        boolean cached
) {

    public enum Outcome {
        COMPLETE,
        ERROR,
        CANCELLED
    }

    public static PipelineResult complete(String runId, String fingerprint, DesignBundle bundle, boolean cached) {
        return new PipelineResult(runId, fingerprint, Outcome.COMPLETE, bundle, null, null, null, null, cached);
    }

    public static PipelineResult error(String runId, String fingerprint, ErrorKind kind,
                                       String stage, String node) {
        String message = stage != null ? kind.label() + " at stage " + stage : kind.label();
        return new PipelineResult(runId, fingerprint, Outcome.ERROR, null, kind, stage, node, message, false);
    }

    public static PipelineResult cancelled(String runId, String fingerprint) {
        return new PipelineResult(runId, fingerprint, Outcome.CANCELLED, null, null, null, null, null, false);
    }

    public boolean isComplete() {
        return outcome == Outcome.COMPLETE;
    }
}
