package com.archflow.core.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, thread-safe transcript accumulator. Each {@link #appendAll} call is
 * atomic, so one writer's chunks stay contiguous and in order while chunks from
 * different writers interleave only between calls.
 */
public class Transcript {

    private final List<TranscriptEntry> entries = new ArrayList<>();

    public synchronized void append(TranscriptEntry entry) {
        entries.add(entry);
    }

    public synchronized void appendAll(List<TranscriptEntry> chunk) {
        entries.addAll(chunk);
    }

    public synchronized List<TranscriptEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Renders the transcript in the agent-chat markdown form shown to users.
     */
    public synchronized String render() {
        var sb = new StringBuilder();
        for (TranscriptEntry entry : entries) {
            sb.append("**").append(entry.label()).append(":**\n")
                    .append(entry.text()).append("\n\n");
        }
        return sb.toString();
    }
}
