package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.analytics.EpisodeDetail;
import com.phodal.tracebrain.analytics.EpisodeFilter;
import com.phodal.tracebrain.analytics.EpisodeSummary;
import com.phodal.tracebrain.server.dto.PageResponse;
import com.phodal.tracebrain.server.service.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/episodes")
@RequiredArgsConstructor
public class EpisodeController {

    private final TraceService traceService;

    @GetMapping
    public PageResponse<EpisodeSummary> list(
            @RequestParam(name = "max_avg_confidence", required = false) Double maxAvgConfidence,
            @RequestParam(name = "skip", defaultValue = "0") int skip,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return PageResponse.of(traceService.episodes(new EpisodeFilter(maxAvgConfidence), skip, limit));
    }

    @GetMapping("/{episodeId}/traces")
    public EpisodeDetail traces(@PathVariable String episodeId) {
        return traceService.episode(episodeId);
    }
}
