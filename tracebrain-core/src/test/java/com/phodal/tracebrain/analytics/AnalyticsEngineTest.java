package com.phodal.tracebrain.analytics;

import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AiEvaluation;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.EvaluationStatus;
import com.phodal.tracebrain.schema.SpanType;
import com.phodal.tracebrain.schema.TokenUsage;
import com.phodal.tracebrain.schema.TraceStatus;
import com.phodal.tracebrain.store.Deadline;
import com.phodal.tracebrain.store.InMemoryTraceRepository;
import com.phodal.tracebrain.store.MutableClock;
import com.phodal.tracebrain.store.Page;
import com.phodal.tracebrain.store.TraceFilter;
import com.phodal.tracebrain.store.TraceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private TraceStore store;
    private AnalyticsEngine analytics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new TraceStore(new InMemoryTraceRepository(), new ReconstructionEngine(), clock);
        analytics = new AnalyticsEngine(store, clock);
    }

    private static Span tool(String id, String toolName, long durationMs, boolean error) {
        Span.Builder builder = Span.builder().spanId(id).name(id)
            .startTime(T0).endTime(T0.plusMillis(durationMs))
            .attribute(AttributeKeys.SPAN_TYPE, SpanType.TOOL_EXECUTION.getValue());
        if (toolName != null) {
            builder.attribute(AttributeKeys.TOOL_NAME, toolName);
        }
        if (error) {
            builder.attribute(AttributeKeys.OTEL_STATUS_CODE, "ERROR");
        }
        return builder.build();
    }

    private static Map<String, Object> attributes(TraceStatus status, String episode, Double confidence) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (status != null) {
            attrs.put(AttributeKeys.TRACE_STATUS, status.getValue());
        }
        if (episode != null) {
            attrs.put(AttributeKeys.EPISODE_ID, episode);
        }
        if (confidence != null) {
            attrs.put(AttributeKeys.AI_EVALUATION,
                new AiEvaluation(3, confidence, EvaluationStatus.PENDING_REVIEW, null).toAttribute());
        }
        return attrs;
    }

    @Test
    void shouldCountToolInvocationsMostUsedFirst() {
        store.ingest("t1", List.of(
            tool("a", "search", 100, false),
            tool("b", "calculator", 10, false),
            tool("c", "search", 300, true)
        ));
        store.ingest("t2", List.of(
            tool("a", "search", 200, false),
            tool("b", null, 50, false),
            Span.builder().spanId("c").name("think").at(T0).type(SpanType.LLM_INFERENCE).build()
        ));

        Map<String, ToolUsageStats> usage = analytics.toolUsage(TraceFilter.none());

        assertEquals(List.of("search", "calculator", "unknown"), List.copyOf(usage.keySet()));
        ToolUsageStats search = usage.get("search");
        assertEquals(3, search.invocationCount());
        assertEquals(200.0, search.avgDurationMs(), 1e-9);
        assertEquals(1, search.errorCount());
        assertEquals(5, usage.values().stream().mapToLong(ToolUsageStats::invocationCount).sum(),
            "totals equal the number of tool_execution spans");
    }

    @Test
    void shouldComputeStats() {
        store.ingest("old", List.of(tool("a", "x", 1, false)), attributes(TraceStatus.FAILED, null, 0.2), null, Deadline.none());
        store.addFeedback("old", Feedback.of(2, null), Deadline.none());

        clock.advance(Duration.ofDays(2));
        store.ingest("new", List.of(tool("a", "x", 1, false), tool("b", "x", 1, false), tool("c", "x", 1, false)),
            attributes(TraceStatus.COMPLETED, null, 0.8), null, Deadline.none());
        store.addFeedback("new", Feedback.of(4, null), Deadline.none());
        store.ingest("bare", List.of());

        TraceStats stats = analytics.stats(TraceFilter.none());

        assertEquals(3, stats.traceCount());
        assertEquals(4, stats.spanCount());
        assertEquals(4.0 / 3, stats.avgSpansPerTrace(), 1e-9);
        assertEquals(2, stats.tracesWithFeedback());
        assertEquals(2, stats.tracesLast24h());
        assertEquals(Map.of("failed", 1L, "completed", 1L), stats.statusBreakdown());
        assertEquals(2, stats.evaluatedTraceCount());
        assertEquals(0.5, stats.avgConfidence(), 1e-9);
        assertEquals(3.0, stats.avgFeedbackRating(), 1e-9);
    }

    @Test
    void shouldReportNullAveragesWithoutData() {
        store.ingest("t", List.of());

        TraceStats stats = analytics.stats(TraceFilter.none());

        assertEquals(1, stats.traceCount());
        assertNull(stats.avgConfidence());
        assertNull(stats.avgFeedbackRating());
        assertEquals(0, analytics.stats(TraceFilter.builder().status(TraceStatus.RUNNING).build()).traceCount());
    }

    @Test
    void shouldSummarizeEpisode() {
        Span first = Span.builder().spanId("a").name("a").startTime(T0).endTime(T0.plusSeconds(2))
            .attribute(AttributeKeys.USAGE, TokenUsage.of(10, 5).toAttribute()).build();
        Span second = Span.builder().spanId("b").name("b").startTime(T0.plusSeconds(5)).endTime(T0.plusSeconds(9))
            .attribute(AttributeKeys.USAGE, Map.of("prompt_tokens", 20, "completion_tokens", 1, "total_tokens", 30))
            .build();
        store.ingest("t1", List.of(first), attributes(TraceStatus.COMPLETED, "ep", 0.9), null, Deadline.none());
        clock.advance(Duration.ofSeconds(1));
        store.ingest("t2", List.of(second), attributes(TraceStatus.NEEDS_REVIEW, "ep", null), null, Deadline.none());

        EpisodeSummary summary = analytics.summarize(store.episodeTraces("ep"));

        assertEquals("ep", summary.episodeId());
        assertEquals(2, summary.traceCount());
        assertEquals(1, summary.evaluatedTraceCount());
        assertEquals(0.9, summary.avgConfidence(), 1e-9);
        assertEquals(45, summary.totalTokens());
        assertEquals(T0, summary.startTime());
        assertEquals(9000, summary.durationMs());
        assertEquals(TraceStatus.NEEDS_REVIEW, summary.status());
    }

    @Test
    void shouldCombineEpisodeStatus() {
        store.ingest("a", List.of(), attributes(TraceStatus.COMPLETED, "done", null), null, Deadline.none());
        store.ingest("b", List.of(), attributes(TraceStatus.COMPLETED, "done", null), null, Deadline.none());
        store.ingest("c", List.of(), attributes(TraceStatus.COMPLETED, "mixed", null), null, Deadline.none());
        store.ingest("d", List.of(), attributes(null, "mixed", null), null, Deadline.none());
        store.ingest("e", List.of(), attributes(TraceStatus.RUNNING, "bad", null), null, Deadline.none());
        store.ingest("f", List.of(), attributes(TraceStatus.FAILED, "bad", null), null, Deadline.none());

        assertEquals(TraceStatus.COMPLETED, analytics.summarize(store.episodeTraces("done")).status());
        assertNull(analytics.summarize(store.episodeTraces("mixed")).status());
        assertEquals(TraceStatus.FAILED, analytics.summarize(store.episodeTraces("bad")).status());
        assertNull(analytics.summarize(store.episodeTraces("mixed")).avgConfidence());
    }

    @Test
    void shouldListEpisodesBelowConfidence() {
        store.ingest("a1", List.of(), attributes(null, "low", 0.2), null, Deadline.none());
        store.ingest("a2", List.of(), attributes(null, "low", 0.4), null, Deadline.none());
        clock.advance(Duration.ofMinutes(1));
        store.ingest("b1", List.of(), attributes(null, "high", 0.9), null, Deadline.none());
        clock.advance(Duration.ofMinutes(1));
        store.ingest("c1", List.of(), attributes(null, "unevaluated", null), null, Deadline.none());
        store.ingest("loose", List.of());

        Page<EpisodeSummary> all = analytics.episodes(EpisodeFilter.none(), 0, 10);
        assertEquals(List.of("unevaluated", "high", "low"),
            all.items().stream().map(EpisodeSummary::episodeId).toList());

        Page<EpisodeSummary> low = analytics.episodes(new EpisodeFilter(0.5), 0, 10);
        assertEquals(1, low.total());
        assertEquals("low", low.items().get(0).episodeId());
        assertEquals(0.3, low.items().get(0).avgConfidence(), 1e-9);

        assertEquals(0, analytics.episodes(new EpisodeFilter(0.3), 0, 10).total(), "bound is strict");
    }

    @Test
    void shouldTreatTracesAsSnapshotWhenComputingFromList() {
        Trace trace = store.ingest("t", List.of(tool("a", "grep", 5, false)));

        assertEquals(1, analytics.toolUsage(List.of(trace)).get("grep").invocationCount());
        assertEquals(1, analytics.stats(List.of(trace)).spanCount());
    }
}
