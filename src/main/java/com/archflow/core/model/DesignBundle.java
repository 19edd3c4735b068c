package com.archflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * The artifact produced by a finished pipeline run. This is what the result cache
 * stores and what the terminal {@code complete} event carries as its summary.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesignBundle(
        @JsonProperty("refined_requirements") String refinedRequirements,
        @JsonProperty("clarifying_questions") String clarifyingQuestions,
        @JsonProperty("design") String design,
        @JsonProperty("alternative_design") String alternativeDesign,
        @JsonProperty("security_report") String securityReport,
        @JsonProperty("cost_report") String costReport,
        @JsonProperty("reliability_report") String reliabilityReport,
        @JsonProperty("audit_status") String auditStatus,
        @JsonProperty("audit_report") String auditReport,
        @JsonProperty("recommendation") String recommendation,
        @JsonProperty("terraform_code") String terraformCode,
        @JsonProperty("agent_chat") String agentChat,
        @JsonProperty("revision_count") int revisionCount,
        @JsonProperty("clarification_needed") boolean clarificationNeeded
) implements Serializable {
}
