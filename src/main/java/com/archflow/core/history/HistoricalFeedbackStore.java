package com.archflow.core.history;

import java.util.List;

/**
 * Read-only similarity query over past deployment feedback.
 */
public interface HistoricalFeedbackStore {

    /**
     * @param keywords lower-case keywords extracted from the new requirements
     * @param limit    maximum number of records to return
     */
    List<FeedbackRecord> query(List<String> keywords, int limit);
}
