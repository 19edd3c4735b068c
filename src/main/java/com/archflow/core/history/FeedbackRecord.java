package com.archflow.core.history;

import java.util.List;

/**
 * One past deployment outcome as returned by the feedback store.
 *
 * @param summary           short summary of the original requirements
 * @param outcomeRating     satisfaction rating, 1 to 5
 * @param success           whether the deployment succeeded
 * @param modificationsMade what the user changed before deploying; nullable
 * @param issuesEncountered problems hit during deployment
 * @param comments          free-text feedback; nullable
 */
public record FeedbackRecord(
        String summary,
        int outcomeRating,
        boolean success,
        String modificationsMade,
        List<String> issuesEncountered,
        String comments
) {

    public FeedbackRecord {
        issuesEncountered = issuesEncountered != null ? List.copyOf(issuesEncountered) : List.of();
    }

    public FeedbackRecord(String summary, int outcomeRating) {
        this(summary, outcomeRating, outcomeRating >= 3, null, List.of(), null);
    }
}
