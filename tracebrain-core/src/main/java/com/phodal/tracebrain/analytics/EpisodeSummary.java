package com.phodal.tracebrain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.schema.TraceStatus;

import java.time.Instant;

/**
 * Roll-up of the traces in one episode.
 *
 * @param avgConfidence mean evaluation confidence, {@code null} when no trace was evaluated
 * @param startTime earliest span start, or earliest trace creation when no spans exist
 * @param durationMs from {@code startTime} to the latest span end
 * @param status combined status, {@code null} when undetermined
 */
public record EpisodeSummary(
    @JsonProperty("episode_id") String episodeId,
    @JsonProperty("trace_count") int traceCount,
    @JsonProperty("evaluated_trace_count") int evaluatedTraceCount,
    @JsonProperty("avg_confidence") Double avgConfidence,
    @JsonProperty("total_tokens") long totalTokens,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("duration_ms") long durationMs,
    TraceStatus status
) {
}
