package com.phodal.tracebrain.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Allowed values of {@link AttributeKeys#SPAN_TYPE}.
 */
public enum SpanType {
    USER_REQUEST("user_request"),
    LLM_INFERENCE("llm_inference"),
    TOOL_EXECUTION("tool_execution");

    private final String value;

    SpanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<SpanType> find(String value) {
        for (SpanType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static SpanType fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown span type: " + value));
    }
}
