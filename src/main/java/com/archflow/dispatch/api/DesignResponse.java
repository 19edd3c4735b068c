package com.archflow.dispatch.api;

import com.archflow.core.model.DesignBundle;
import com.archflow.core.model.PipelineResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Outbound JSON body for a blocking design request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesignResponse(
        @JsonProperty("run_id") String runId,
        String fingerprint,
        String outcome,
        boolean cached,
        DesignBundle result,
        @JsonProperty("error_kind") String errorKind,
        String stage,
        String message
) {

    public static DesignResponse from(PipelineResult result) {
        return new DesignResponse(
                result.runId(),
                result.fingerprint(),
                result.outcome().name().toLowerCase(Locale.ROOT),
                result.cached(),
                result.bundle(),
                result.errorKind() != null ? result.errorKind().label() : null,
                result.failedStage(),
                result.message());
    }
}
