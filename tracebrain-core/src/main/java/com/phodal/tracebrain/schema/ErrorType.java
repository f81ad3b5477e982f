package com.phodal.tracebrain.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Failure classification stored under {@link AttributeKeys#TRACE_ERROR_TYPE}.
 */
public enum ErrorType {
    NONE("none"),
    TOOL_ERROR("tool_error"),
    LOGIC_LOOP("logic_loop"),
    HALLUCINATION("hallucination"),
    INVALID_FORMAT("invalid_format"),
    MISINTERPRETATION("misinterpretation"),
    CONTEXT_OVERFLOW("context_overflow"),
    TIMEOUT("timeout");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ErrorType> find(String value) {
        for (ErrorType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ErrorType fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown error type: " + value));
    }
}
