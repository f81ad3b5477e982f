package com.phodal.tracebrain.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum EvaluationStatus {
    PENDING_REVIEW("pending_review"),
    COMPLETED("completed");

    private final String value;

    EvaluationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<EvaluationStatus> find(String value) {
        for (EvaluationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EvaluationStatus fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown evaluation status: " + value));
    }
}
