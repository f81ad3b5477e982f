package com.phodal.tracebrain.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationAccepted {

    @JsonProperty("trace_id")
    private String traceId;

    private String status;
}
