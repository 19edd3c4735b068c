package com.archflow.core.history;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Feedback store held in memory; matches records whose summary mentions any keyword.
 */
public class InMemoryFeedbackStore implements HistoricalFeedbackStore {

    private final List<FeedbackRecord> records = new CopyOnWriteArrayList<>();

    public void add(FeedbackRecord record) {
        records.add(record);
    }

    @Override
    public List<FeedbackRecord> query(List<String> keywords, int limit) {
        if (keywords.isEmpty()) {
            return List.of();
        }
        return records.stream()
                .filter(r -> r.summary() != null && mentionsAny(r.summary().toLowerCase(Locale.ROOT), keywords))
                .limit(limit)
                .toList();
    }

    private static boolean mentionsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
