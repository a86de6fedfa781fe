package com.ragpipe.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an activity runs: {@link #LOCAL} on the orchestrator's own task queue,
 * {@link #REMOTE} on another worker pool's named task queue.
 */
public enum ExecutionKind {
    LOCAL,
    REMOTE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses {@code local} / {@code remote} (any case). Returns null for null or blank. */
    @JsonCreator
    public static ExecutionKind fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
