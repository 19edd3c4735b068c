package com.archflow.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The changes one agent node asks the executor to merge into the {@link RunState}.
 */
public final class StateDelta {

    private final Map<DesignField, String> fields;
    private final RunStatus status;
    private final Boolean clarificationNeeded;
    private final List<TranscriptEntry> transcript;

    private StateDelta(Builder builder) {
        this.fields = Collections.unmodifiableMap(new EnumMap<>(builder.fields));
        this.status = builder.status;
        this.clarificationNeeded = builder.clarificationNeeded;
        this.transcript = List.copyOf(builder.transcript);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StateDelta empty() {
        return builder().build();
    }

    public Map<DesignField, String> fields() {
        return fields;
    }

    public Optional<RunStatus> status() {
        return Optional.ofNullable(status);
    }

    public Optional<Boolean> clarificationNeeded() {
        return Optional.ofNullable(clarificationNeeded);
    }

    public List<TranscriptEntry> transcript() {
        return transcript;
    }

    public static final class Builder {
        private final Map<DesignField, String> fields = new EnumMap<>(DesignField.class);
        private RunStatus status;
        private Boolean clarificationNeeded;
        private final List<TranscriptEntry> transcript = new ArrayList<>();

        private Builder() {
        }

        public Builder field(DesignField field, String value) {
            fields.put(field, value);
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder clarificationNeeded(boolean clarificationNeeded) {
            this.clarificationNeeded = clarificationNeeded;
            return this;
        }

        public Builder transcript(String agentId, String label, String text) {
            transcript.add(new TranscriptEntry(agentId, label, text));
            return this;
        }

        public StateDelta build() {
            return new StateDelta(this);
        }
    }
}
