package com.phodal.tracebrain.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Lifecycle status stored under {@link AttributeKeys#TRACE_STATUS}.
 */
public enum TraceStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    NEEDS_REVIEW("needs_review"),
    FAILED("failed");

    private final String value;

    TraceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<TraceStatus> find(String value) {
        for (TraceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TraceStatus fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown trace status: " + value));
    }
}
