package com.archflow.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of events on a run's live feed.
 */
public enum EventType {
    AGENT_START("agent_start"),
    TOKEN("token"),
    FIELD_UPDATE("field_update"),
    AGENT_COMPLETE("agent_complete"),
    CACHE_HIT("cache_hit"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
