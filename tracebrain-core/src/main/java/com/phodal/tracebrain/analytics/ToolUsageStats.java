package com.phodal.tracebrain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Invocation counters for one tool name.
 */
public record ToolUsageStats(
    @JsonProperty("invocation_count") long invocationCount,
    @JsonProperty("avg_duration_ms") double avgDurationMs,
    @JsonProperty("error_count") long errorCount
) {
}
