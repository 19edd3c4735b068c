package com.archflow.core.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One event on a run's live feed. Serializes to the line-per-event wire shape:
 * {@code {type, agent?, content?, field?, summary?, message?, timestamp}}.
 * <p>
 * {@code timestamp} is wall-clock time for display and may step backwards with clock
 * adjustments. Feed order is given by {@code sequence}, which the sink assigns strictly
 * increasing under its lock.
 *
 * @param type      event kind
 * @param runId     owning run; not part of the wire shape
 * @param agent     emitting agent id, {@code null} for run-level events
 * @param content   token text or field value
 * @param field     output field name for {@code field_update}
 * @param summary   terminal summary for {@code complete}, node summary for {@code agent_complete}
 * @param message   human-readable message ({@code error}, {@code cache_hit})
 * @param timestamp wall-clock emission time
 * @param sequence  monotonic position in the run's feed, assigned by the sink
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        EventType type,
        @JsonIgnore String runId,
        String agent,
        String content,
        String field,
        Object summary,
        String message,
        @JsonIgnore Instant timestamp,
        @JsonIgnore long sequence
) {

    public static StreamEvent agentStart(String runId, String agent) {
        return of(EventType.AGENT_START, runId, agent, null, null, null, null);
    }

    public static StreamEvent token(String runId, String agent, String content) {
        return of(EventType.TOKEN, runId, agent, content, null, null, null);
    }

    public static StreamEvent fieldUpdate(String runId, String agent, String field, String content) {
        return of(EventType.FIELD_UPDATE, runId, agent, content, field, null, null);
    }

    public static StreamEvent agentComplete(String runId, String agent, Object summary) {
        return of(EventType.AGENT_COMPLETE, runId, agent, null, null, summary, null);
    }

    public static StreamEvent cacheHit(String runId, String fingerprint) {
        return of(EventType.CACHE_HIT, runId, null, null, null, null, "Cached result for " + fingerprint);
    }

    public static StreamEvent complete(String runId, Object summary) {
        return of(EventType.COMPLETE, runId, null, null, null, summary, null);
    }

    public static StreamEvent error(String runId, String agent, String message) {
        return of(EventType.ERROR, runId, agent, null, null, null, message);
    }

    private static StreamEvent of(EventType type, String runId, String agent, String content,
                                  String field, Object summary, String message) {
        return new StreamEvent(type, runId, agent, content, field, summary, message, Instant.now(), -1);
    }

    StreamEvent withSequence(long sequence) {
        return new StreamEvent(type, runId, agent, content, field, summary, message, timestamp, sequence);
    }

    @JsonProperty("timestamp")
    public String timestampText() {
        return timestamp.toString();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type.isTerminal();
    }
}
