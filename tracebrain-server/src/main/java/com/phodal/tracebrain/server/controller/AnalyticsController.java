package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.analytics.AnalyticsEngine;
import com.phodal.tracebrain.analytics.ToolUsageStats;
import com.phodal.tracebrain.analytics.TraceStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Aggregates over stored traces. Both endpoints accept the trace listing filters.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsEngine analyticsEngine;

    @GetMapping("/stats")
    public TraceStats stats(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "error_type", required = false) String errorType,
            @RequestParam(name = "min_rating", required = false) Integer minRating,
            @RequestParam(name = "min_confidence", required = false) Double minConfidence,
            @RequestParam(name = "max_confidence", required = false) Double maxConfidence,
            @RequestParam(name = "start_time", required = false) String startTime,
            @RequestParam(name = "end_time", required = false) String endTime,
            @RequestParam(name = "prompt_contains", required = false) String promptContains) {
        return analyticsEngine.stats(
                FilterParams.traceFilter(status, errorType, minRating, minConfidence, maxConfidence, startTime, endTime,
                        promptContains));
    }

    @GetMapping("/analytics/tool_usage")
    public Map<String, ToolUsageStats> toolUsage(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "error_type", required = false) String errorType,
            @RequestParam(name = "min_rating", required = false) Integer minRating,
            @RequestParam(name = "min_confidence", required = false) Double minConfidence,
            @RequestParam(name = "max_confidence", required = false) Double maxConfidence,
            @RequestParam(name = "start_time", required = false) String startTime,
            @RequestParam(name = "end_time", required = false) String endTime,
            @RequestParam(name = "prompt_contains", required = false) String promptContains) {
        return analyticsEngine.toolUsage(
                FilterParams.traceFilter(status, errorType, minRating, minConfidence, maxConfidence, startTime, endTime,
                        promptContains));
    }
}
