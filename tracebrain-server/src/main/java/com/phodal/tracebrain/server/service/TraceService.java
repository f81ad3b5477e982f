package com.phodal.tracebrain.server.service;

import com.phodal.tracebrain.analytics.AnalyticsEngine;
import com.phodal.tracebrain.analytics.EpisodeDetail;
import com.phodal.tracebrain.analytics.EpisodeFilter;
import com.phodal.tracebrain.analytics.EpisodeSummary;
import com.phodal.tracebrain.error.ConflictException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.model.Episode;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.TraceStatus;
import com.phodal.tracebrain.server.config.TraceBrainProperties;
import com.phodal.tracebrain.server.dto.IngestRequest;
import com.phodal.tracebrain.server.dto.SpanContentResponse;
import com.phodal.tracebrain.server.dto.TraceView;
import com.phodal.tracebrain.store.Deadline;
import com.phodal.tracebrain.store.Page;
import com.phodal.tracebrain.store.TraceFilter;
import com.phodal.tracebrain.store.TraceStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-facing operations on stored traces, with their Prometheus counters.
 */
@Slf4j
@Service
public class TraceService {

    private final TraceStore traceStore;
    private final AnalyticsEngine analyticsEngine;
    private final TraceBrainProperties properties;

    private final Counter ingestedSpansCounter;
    private final Counter rejectedIngestCounter;
    private final Counter feedbackCounter;
    private final Counter signalCounter;

    public TraceService(TraceStore traceStore, AnalyticsEngine analyticsEngine,
                        TraceBrainProperties properties, MeterRegistry meterRegistry) {
        this.traceStore = traceStore;
        this.analyticsEngine = analyticsEngine;
        this.properties = properties;

        this.ingestedSpansCounter = Counter.builder("tracebrain.ingest.spans")
                .description("Spans submitted in accepted ingestion batches")
                .register(meterRegistry);
        this.rejectedIngestCounter = Counter.builder("tracebrain.ingest.rejected")
                .description("Ingestion batches rejected as invalid or conflicting")
                .register(meterRegistry);
        this.feedbackCounter = Counter.builder("tracebrain.feedback.total")
                .description("Human feedback entries appended")
                .register(meterRegistry);
        this.signalCounter = Counter.builder("tracebrain.signals.total")
                .description("Traces flagged for review")
                .register(meterRegistry);
    }

    public Trace ingest(IngestRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        try {
            Trace trace = traceStore.ingest(request.getTraceId(), request.getSpans(), request.getAttributes(),
                    request.getFeedback(), deadline());
            int submitted = request.getSpans() != null ? request.getSpans().size() : 0;
            ingestedSpansCounter.increment(submitted);
            if (request.getFeedback() != null) {
                feedbackCounter.increment();
            }
            return trace;
        } catch (ValidationException | ConflictException e) {
            rejectedIngestCounter.increment();
            throw e;
        }
    }

    public TraceView get(String traceId) {
        Trace trace = traceStore.get(traceId);
        return TraceView.of(trace, traceStore.reconstructAll(trace));
    }

    public Page<Trace> list(TraceFilter filter, int skip, int limit) {
        return traceStore.list(filter, skip, limit);
    }

    public SpanContentResponse spanContent(String traceId, String spanId) {
        return new SpanContentResponse(traceId, spanId, traceStore.reconstruct(traceId, spanId));
    }

    public Trace addFeedback(String traceId, Feedback feedback) {
        Trace trace = traceStore.addFeedback(traceId, feedback, deadline());
        feedbackCounter.increment();
        return trace;
    }

    /**
     * Mark a trace as needing review and keep the reason alongside it.
     */
    public Trace signal(String traceId, String reason) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(AttributeKeys.TRACE_STATUS, TraceStatus.NEEDS_REVIEW.getValue());
        if (reason != null && !reason.isBlank()) {
            attributes.put(AttributeKeys.TRACE_SIGNAL_REASON, reason);
        }
        Trace trace = traceStore.updateAttributes(traceId, attributes, deadline());
        signalCounter.increment();
        log.info("Trace {} flagged for review: {}", traceId, reason);
        return trace;
    }

    public Page<EpisodeSummary> episodes(EpisodeFilter filter, int skip, int limit) {
        return analyticsEngine.episodes(filter, skip, limit);
    }

    public EpisodeDetail episode(String episodeId) {
        Episode episode = traceStore.episodeTraces(episodeId);
        return new EpisodeDetail(analyticsEngine.summarize(episode), episode.traces());
    }

    private Deadline deadline() {
        return properties.requestDeadline();
    }
}
