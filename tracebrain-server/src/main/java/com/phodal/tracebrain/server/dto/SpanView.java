package com.phodal.tracebrain.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.model.Span;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A stored span together with its reconstructed context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanView {

    @JsonProperty("span_id")
    private String spanId;

    @JsonProperty("parent_id")
    private String parentId;

    private String name;

    @JsonProperty("start_time")
    private Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    private Map<String, Object> attributes;

    @JsonProperty("reconstructed_content")
    private String reconstructedContent;

    public static SpanView of(Span span, String reconstructedContent) {
        return SpanView.builder()
                .spanId(span.spanId())
                .parentId(span.parentId())
                .name(span.name())
                .startTime(span.startTime())
                .endTime(span.endTime())
                .attributes(span.attributes())
                .reconstructedContent(reconstructedContent)
                .build();
    }
}
