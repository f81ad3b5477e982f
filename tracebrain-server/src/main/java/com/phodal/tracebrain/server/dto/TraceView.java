package com.phodal.tracebrain.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Trace;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response of {@code GET /api/v1/traces/{trace_id}}: every span carries its reconstructed content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceView {

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("created_at")
    private Instant createdAt;

    private Map<String, Object> attributes;

    private List<SpanView> spans;

    private List<Feedback> feedbacks;

    public static TraceView of(Trace trace, Map<String, String> reconstructed) {
        return TraceView.builder()
                .traceId(trace.traceId())
                .createdAt(trace.createdAt())
                .attributes(trace.attributes())
                .spans(trace.spans().stream()
                        .map(span -> SpanView.of(span, reconstructed.getOrDefault(span.spanId(), "")))
                        .toList())
                .feedbacks(trace.feedbacks())
                .build();
    }
}
