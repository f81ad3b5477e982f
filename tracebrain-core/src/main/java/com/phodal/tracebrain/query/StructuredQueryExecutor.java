package com.phodal.tracebrain.query;

import com.phodal.tracebrain.analytics.AnalyticsEngine;
import com.phodal.tracebrain.analytics.EpisodeDetail;
import com.phodal.tracebrain.model.Episode;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.store.Page;
import com.phodal.tracebrain.store.TraceStore;

import java.util.List;

/**
 * Runs validated structured queries against the store and the analytics engine.
 */
public class StructuredQueryExecutor {

    private final TraceStore traceStore;
    private final AnalyticsEngine analyticsEngine;

    public StructuredQueryExecutor(TraceStore traceStore, AnalyticsEngine analyticsEngine) {
        this.traceStore = traceStore;
        this.analyticsEngine = analyticsEngine;
    }

    public QueryResult execute(StructuredQuery query) {
        return switch (query.action()) {
            case LIST_TRACES -> {
                Page<Trace> page = traceStore.list(query.filter(), 0, query.effectiveLimit());
                yield new QueryResult(query, page.items(), page.total());
            }
            case GET_TRACE -> new QueryResult(query, traceStore.get(query.traceId()), null);
            case EPISODE_TRACES -> {
                Episode episode = traceStore.episodeTraces(query.episodeId());
                List<Trace> traces = episode.traces();
                List<Trace> limited = traces.subList(0, Math.min(traces.size(), query.effectiveLimit()));
                yield new QueryResult(query,
                    new EpisodeDetail(analyticsEngine.summarize(episode), limited), (long) traces.size());
            }
            case STATS -> new QueryResult(query, analyticsEngine.stats(query.filter()), null);
            case TOOL_USAGE -> new QueryResult(query, analyticsEngine.toolUsage(query.filter()), null);
        };
    }
}
