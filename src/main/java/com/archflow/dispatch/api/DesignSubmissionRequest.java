package com.archflow.dispatch.api;

import com.archflow.core.model.DesignConfiguration;
import com.archflow.core.model.DesignRequest;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/designs and /api/v1/designs/stream.
 *
 * @param text          free-text requirements
 * @param configuration scenario, cost_bias, compliance, reliability, strictness; nullable entries fall back to defaults
 * @param userAnswers   answers to earlier clarifying questions; nullable
 */
public record DesignSubmissionRequest(
        String text,
        Map<String, String> configuration,
        @JsonProperty("user_answers") String userAnswers
) {

    /**
     * @throws IllegalArgumentException on blank text or an unknown configuration value
     */
    public DesignRequest toDesignRequest() {
        return new DesignRequest(text, DesignConfiguration.fromMap(configuration), userAnswers);
    }
}
