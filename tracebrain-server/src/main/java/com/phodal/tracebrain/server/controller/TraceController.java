package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.server.dto.FeedbackRequest;
import com.phodal.tracebrain.server.dto.IngestRequest;
import com.phodal.tracebrain.server.dto.PageResponse;
import com.phodal.tracebrain.server.dto.SignalRequest;
import com.phodal.tracebrain.server.dto.SpanContentResponse;
import com.phodal.tracebrain.server.dto.TraceView;
import com.phodal.tracebrain.server.service.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion, retrieval, feedback and review signals for traces.
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class TraceController {

    private final TraceService traceService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Trace ingest(@RequestBody IngestRequest request) {
        return traceService.ingest(request);
    }

    @GetMapping
    public PageResponse<Trace> list(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "error_type", required = false) String errorType,
            @RequestParam(name = "min_rating", required = false) Integer minRating,
            @RequestParam(name = "min_confidence", required = false) Double minConfidence,
            @RequestParam(name = "max_confidence", required = false) Double maxConfidence,
            @RequestParam(name = "start_time", required = false) String startTime,
            @RequestParam(name = "end_time", required = false) String endTime,
            @RequestParam(name = "prompt_contains", required = false) String promptContains,
            @RequestParam(name = "skip", defaultValue = "0") int skip,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return PageResponse.of(traceService.list(
                FilterParams.traceFilter(status, errorType, minRating, minConfidence, maxConfidence, startTime, endTime,
                        promptContains),
                skip, limit));
    }

    @GetMapping("/{traceId}")
    public TraceView get(@PathVariable String traceId) {
        return traceService.get(traceId);
    }

    @GetMapping("/{traceId}/spans/{spanId}/content")
    public SpanContentResponse spanContent(@PathVariable String traceId, @PathVariable String spanId) {
        return traceService.spanContent(traceId, spanId);
    }

    @PostMapping("/{traceId}/feedback")
    @ResponseStatus(HttpStatus.CREATED)
    public Trace feedback(@PathVariable String traceId, @RequestBody FeedbackRequest request) {
        if (request == null) {
            throw new ValidationException("Feedback body is required");
        }
        return traceService.addFeedback(traceId, request.toFeedback());
    }

    @PostMapping("/{traceId}/signal")
    public Trace signal(@PathVariable String traceId, @RequestBody(required = false) SignalRequest request) {
        return traceService.signal(traceId, request != null ? request.getReason() : null);
    }
}
