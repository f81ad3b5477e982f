package com.phodal.tracebrain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate counters over a set of traces.
 *
 * @param avgConfidence {@code null} when no trace carries an evaluation
 * @param avgFeedbackRating {@code null} when no latest feedback has a rating
 */
public record TraceStats(
    @JsonProperty("trace_count") long traceCount,
    @JsonProperty("span_count") long spanCount,
    @JsonProperty("avg_spans_per_trace") double avgSpansPerTrace,
    @JsonProperty("traces_with_feedback") long tracesWithFeedback,
    @JsonProperty("traces_last_24h") long tracesLast24h,
    @JsonProperty("status_breakdown") Map<String, Long> statusBreakdown,
    @JsonProperty("error_type_breakdown") Map<String, Long> errorTypeBreakdown,
    @JsonProperty("evaluated_trace_count") long evaluatedTraceCount,
    @JsonProperty("avg_confidence") Double avgConfidence,
    @JsonProperty("avg_feedback_rating") Double avgFeedbackRating
) {

    public TraceStats {
        statusBreakdown = statusBreakdown == null ? Map.of() : statusBreakdown;
        errorTypeBreakdown = errorTypeBreakdown == null ? Map.of() : errorTypeBreakdown;
    }
}
