package com.archflow.core.state;

/**
 * Named per-agent output slots of a {@link RunState}. Each slot has exactly one
 * owning node per revision pass.
 */
public enum DesignField {
    REFINED_REQUIREMENTS("refined_requirements"),
    CLARIFYING_QUESTIONS("clarifying_questions"),
    DESIGN("design"),
    ALTERNATIVE_DESIGN("alternative_design"),
    SECURITY_REPORT("security_report"),
    COST_REPORT("cost_report"),
    RELIABILITY_REPORT("reliability_report"),
    AUDIT_REPORT("audit_report"),
    RECOMMENDATION("recommendation"),
    TERRAFORM_CODE("terraform_code");

    private final String wireName;

    DesignField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
