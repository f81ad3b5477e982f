package com.phodal.tracebrain.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/traces}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    @JsonProperty("trace_id")
    private String traceId;

    private Map<String, Object> attributes;

    private List<Span> spans;

    private Feedback feedback;
}
