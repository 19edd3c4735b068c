package com.archflow.core.model;

/**
 * Inbound run request as seen by the engine.
 *
 * @param text          raw free-text requirements
 * @param configuration configuration enum set; defaults are applied when {@code null}
 * @param userAnswers   answers to earlier clarifying questions; nullable
 */
public record DesignRequest(String text, DesignConfiguration configuration, String userAnswers) {

    public DesignRequest {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Requirements text is required");
        }
        configuration = configuration != null ? configuration : DesignConfiguration.defaults();
    }

    public DesignRequest(String text, DesignConfiguration configuration) {
        this(text, configuration, null);
    }

    public boolean hasUserAnswers() {
        return userAnswers != null && !userAnswers.isBlank();
    }
}
