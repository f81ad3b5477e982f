package com.phodal.tracebrain.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequest {

    /**
     * Overrides the configured judge model.
     */
    @JsonProperty("judge_model_id")
    private String judgeModelId;
}
