package com.phodal.tracebrain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.schema.TraceAttributes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One agent execution run: the forest of spans sharing a trace id, plus
 * trace-level attributes and the feedback log.
 *
 * <p>Instances are immutable snapshots. Every mutation produces a new {@code Trace}
 * that the store commits in one step.</p>
 *
 * @param traceId unique identifier
 * @param createdAt time of first ingestion
 * @param attributes trace-level metadata
 * @param spans spans in ingestion order
 * @param feedbacks feedback entries in append order
 */
public record Trace(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("created_at") Instant createdAt,
    Map<String, Object> attributes,
    List<Span> spans,
    List<Feedback> feedbacks
) {

    public Trace {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        spans = spans == null ? List.of() : List.copyOf(spans);
        feedbacks = feedbacks == null ? List.of() : List.copyOf(feedbacks);
    }

    public static Trace create(String traceId, Instant createdAt) {
        return new Trace(traceId, createdAt, Map.of(), List.of(), List.of());
    }

    public TraceAttributes attributesView() {
        return TraceAttributes.parse(attributes);
    }

    public int spanCount() {
        return spans.size();
    }

    /**
     * The most recently appended feedback entry.
     */
    public Optional<Feedback> latestFeedback() {
        if (feedbacks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(feedbacks.get(feedbacks.size() - 1));
    }

    public Trace withSpans(List<Span> spans) {
        return new Trace(traceId, createdAt, attributes, spans, feedbacks);
    }

    /**
     * Merge attributes over the current ones; incoming keys win.
     */
    public Trace mergeAttributes(Map<String, Object> incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.putAll(incoming);
        return new Trace(traceId, createdAt, merged, spans, feedbacks);
    }

    public Trace appendFeedback(Feedback feedback) {
        List<Feedback> appended = new ArrayList<>(feedbacks);
        appended.add(feedback);
        return new Trace(traceId, createdAt, attributes, spans, appended);
    }
}
