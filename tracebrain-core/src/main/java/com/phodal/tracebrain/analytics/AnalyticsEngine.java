package com.phodal.tracebrain.analytics;

import com.phodal.tracebrain.model.Episode;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AiEvaluation;
import com.phodal.tracebrain.schema.SpanAttributes;
import com.phodal.tracebrain.schema.SpanType;
import com.phodal.tracebrain.schema.TokenUsage;
import com.phodal.tracebrain.schema.TraceAttributes;
import com.phodal.tracebrain.schema.TraceStatus;
import com.phodal.tracebrain.store.Page;
import com.phodal.tracebrain.store.TraceFilter;
import com.phodal.tracebrain.store.TraceStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only aggregates over committed traces.
 *
 * <p>Every call works on one {@link TraceStore#snapshot(TraceFilter)} and never takes trace locks.</p>
 */
public class AnalyticsEngine {

    public static final String UNKNOWN_TOOL = "unknown";

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final TraceStore traceStore;
    private final Clock clock;

    public AnalyticsEngine(TraceStore traceStore) {
        this(traceStore, Clock.systemUTC());
    }

    public AnalyticsEngine(TraceStore traceStore, Clock clock) {
        this.traceStore = traceStore;
        this.clock = clock;
    }

    public TraceStats stats(TraceFilter filter) {
        return stats(traceStore.snapshot(filter));
    }

    /**
     * Compute stats for an already selected set of traces.
     */
    public TraceStats stats(List<Trace> traces) {
        Instant recentSince = clock.instant().minus(RECENT_WINDOW);

        long spanCount = 0;
        long withFeedback = 0;
        long recent = 0;
        long evaluated = 0;
        double confidenceSum = 0;
        long rated = 0;
        long ratingSum = 0;
        Map<String, Long> statusBreakdown = new TreeMap<>();
        Map<String, Long> errorTypeBreakdown = new TreeMap<>();

        for (Trace trace : traces) {
            spanCount += trace.spanCount();
            if (!trace.feedbacks().isEmpty()) {
                withFeedback++;
            }
            Integer rating = trace.latestFeedback().map(Feedback::rating).orElse(null);
            if (rating != null) {
                rated++;
                ratingSum += rating;
            }
            if (!trace.createdAt().isBefore(recentSince)) {
                recent++;
            }

            TraceAttributes attributes = trace.attributesView();
            attributes.status().ifPresent(status -> statusBreakdown.merge(status.getValue(), 1L, Long::sum));
            attributes.errorType().ifPresent(type -> errorTypeBreakdown.merge(type.getValue(), 1L, Long::sum));
            if (attributes.evaluation().isPresent()) {
                evaluated++;
                confidenceSum += attributes.evaluation().get().confidence();
            }
        }

        long traceCount = traces.size();
        return new TraceStats(
            traceCount,
            spanCount,
            traceCount == 0 ? 0.0 : (double) spanCount / traceCount,
            withFeedback,
            recent,
            statusBreakdown,
            errorTypeBreakdown,
            evaluated,
            evaluated == 0 ? null : confidenceSum / evaluated,
            rated == 0 ? null : (double) ratingSum / rated
        );
    }

    public Map<String, ToolUsageStats> toolUsage(TraceFilter filter) {
        return toolUsage(traceStore.snapshot(filter));
    }

    /**
     * Per-tool counters over {@code tool_execution} spans, most used first.
     * Ties keep tool names in alphabetical order.
     */
    public Map<String, ToolUsageStats> toolUsage(List<Trace> traces) {
        Map<String, long[]> counters = new TreeMap<>();
        for (Trace trace : traces) {
            for (Span span : trace.spans()) {
                SpanAttributes attributes = span.attributesView();
                if (attributes.type() != SpanType.TOOL_EXECUTION) {
                    continue;
                }
                String tool = attributes.toolName().filter(name -> !name.isBlank()).orElse(UNKNOWN_TOOL);
                long[] counter = counters.computeIfAbsent(tool, key -> new long[3]);
                counter[0]++;
                counter[1] += span.durationMs();
                if (attributes.isError()) {
                    counter[2]++;
                }
            }
        }

        List<Map.Entry<String, long[]>> entries = new ArrayList<>(counters.entrySet());
        entries.sort(Comparator.comparingLong((Map.Entry<String, long[]> entry) -> entry.getValue()[0]).reversed());

        Map<String, ToolUsageStats> usage = new LinkedHashMap<>();
        for (Map.Entry<String, long[]> entry : entries) {
            long[] counter = entry.getValue();
            usage.put(entry.getKey(), new ToolUsageStats(counter[0], (double) counter[1] / counter[0], counter[2]));
        }
        return usage;
    }

    public EpisodeSummary summarize(Episode episode) {
        int evaluated = 0;
        double confidenceSum = 0;
        long totalTokens = 0;
        Instant firstStart = null;
        Instant lastEnd = null;
        Set<TraceStatus> statuses = EnumSet.noneOf(TraceStatus.class);
        boolean allHaveStatus = true;

        for (Trace trace : episode.traces()) {
            TraceAttributes attributes = trace.attributesView();
            if (attributes.evaluation().isPresent()) {
                AiEvaluation evaluation = attributes.evaluation().get();
                evaluated++;
                confidenceSum += evaluation.confidence();
            }
            if (attributes.status().isPresent()) {
                statuses.add(attributes.status().get());
            } else {
                allHaveStatus = false;
            }

            for (Span span : trace.spans()) {
                totalTokens += span.attributesView().usage().map(TokenUsage::totalTokens).orElse(0L);
                if (firstStart == null || span.startTime().isBefore(firstStart)) {
                    firstStart = span.startTime();
                }
                if (lastEnd == null || span.endTime().isAfter(lastEnd)) {
                    lastEnd = span.endTime();
                }
            }
            if (trace.spans().isEmpty() && (firstStart == null || trace.createdAt().isBefore(firstStart))) {
                firstStart = trace.createdAt();
            }
        }

        long durationMs = firstStart != null && lastEnd != null
            ? Math.max(0, Duration.between(firstStart, lastEnd).toMillis())
            : 0;

        return new EpisodeSummary(
            episode.episodeId(),
            episode.traces().size(),
            evaluated,
            evaluated == 0 ? null : confidenceSum / evaluated,
            totalTokens,
            firstStart,
            durationMs,
            combinedStatus(statuses, allHaveStatus && !episode.traces().isEmpty())
        );
    }

    private static TraceStatus combinedStatus(Set<TraceStatus> statuses, boolean allHaveStatus) {
        if (statuses.contains(TraceStatus.FAILED)) {
            return TraceStatus.FAILED;
        }
        if (statuses.contains(TraceStatus.NEEDS_REVIEW)) {
            return TraceStatus.NEEDS_REVIEW;
        }
        if (statuses.contains(TraceStatus.RUNNING)) {
            return TraceStatus.RUNNING;
        }
        if (allHaveStatus && statuses.equals(EnumSet.of(TraceStatus.COMPLETED))) {
            return TraceStatus.COMPLETED;
        }
        return null;
    }

    /**
     * Episodes found among committed traces, most recently started first.
     */
    public Page<EpisodeSummary> episodes(EpisodeFilter filter, int skip, int limit) {
        Page.checkWindow(skip, limit, TraceStore.MAX_PAGE_SIZE);
        EpisodeFilter effective = filter != null ? filter : EpisodeFilter.none();

        Map<String, List<Trace>> grouped = new LinkedHashMap<>();
        List<Trace> oldestFirst = new ArrayList<>(traceStore.snapshot(TraceFilter.none()));
        oldestFirst.sort(Comparator.comparing(Trace::createdAt).thenComparing(Trace::traceId));
        for (Trace trace : oldestFirst) {
            trace.attributesView().episodeId()
                .ifPresent(id -> grouped.computeIfAbsent(id, key -> new ArrayList<>()).add(trace));
        }

        List<EpisodeSummary> summaries = new ArrayList<>();
        grouped.forEach((id, traces) -> {
            EpisodeSummary summary = summarize(new Episode(id, traces));
            if (effective.matches(summary)) {
                summaries.add(summary);
            }
        });
        summaries.sort(Comparator.comparing(EpisodeSummary::startTime, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(EpisodeSummary::episodeId));
        return Page.of(summaries, skip, limit);
    }
}
