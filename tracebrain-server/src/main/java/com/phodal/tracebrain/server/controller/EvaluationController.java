package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.server.dto.EvaluateRequest;
import com.phodal.tracebrain.server.dto.EvaluationAccepted;
import com.phodal.tracebrain.server.service.EvaluationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/ai_evaluate")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;

    @PostMapping("/{traceId}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public EvaluationAccepted evaluate(@PathVariable String traceId,
                                       @RequestBody(required = false) EvaluateRequest request) {
        evaluationService.submit(traceId, request != null ? request.getJudgeModelId() : null);
        return new EvaluationAccepted(traceId, "accepted");
    }
}
