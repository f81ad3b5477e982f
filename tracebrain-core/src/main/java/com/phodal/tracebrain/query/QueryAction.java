package com.phodal.tracebrain.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The operations a translated question may ask for.
 */
public enum QueryAction {
    LIST_TRACES("list_traces"),
    GET_TRACE("get_trace"),
    EPISODE_TRACES("episode_traces"),
    STATS("stats"),
    TOOL_USAGE("tool_usage");

    private final String value;

    QueryAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public static Optional<QueryAction> find(String value) {
        for (QueryAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
