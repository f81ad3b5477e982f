package com.phodal.tracebrain.query;

import com.phodal.tracebrain.analytics.AnalyticsEngine;
import com.phodal.tracebrain.analytics.EpisodeDetail;
import com.phodal.tracebrain.analytics.ToolUsageStats;
import com.phodal.tracebrain.analytics.TraceStats;
import com.phodal.tracebrain.error.NotFoundException;
import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.TraceStatus;
import com.phodal.tracebrain.store.Deadline;
import com.phodal.tracebrain.store.InMemoryTraceRepository;
import com.phodal.tracebrain.store.MutableClock;
import com.phodal.tracebrain.store.TraceFilter;
import com.phodal.tracebrain.store.TraceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StructuredQueryExecutorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TraceStore store;
    private StructuredQueryExecutor executor;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0);
        store = new TraceStore(new InMemoryTraceRepository(), new ReconstructionEngine(), clock);
        executor = new StructuredQueryExecutor(store, new AnalyticsEngine(store, clock));

        for (int i = 0; i < 3; i++) {
            store.ingest("t" + i,
                List.of(Span.builder().spanId("s").name("tool").at(T0).tool("search").build()),
                Map.of(AttributeKeys.TRACE_STATUS, i == 0 ? "failed" : "completed", AttributeKeys.EPISODE_ID, "ep"),
                null, Deadline.none());
            clock.advance(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldListWithFilterAndLimit() {
        StructuredQuery query = new StructuredQuery(QueryAction.LIST_TRACES,
            TraceFilter.builder().status(TraceStatus.COMPLETED).build(), null, null, 1);

        QueryResult result = executor.execute(query);

        assertEquals(2L, result.total());
        @SuppressWarnings("unchecked")
        List<Trace> traces = (List<Trace>) result.result();
        assertEquals(List.of("t2"), traces.stream().map(Trace::traceId).toList());
    }

    @Test
    void shouldGetSingleTrace() {
        QueryResult result = executor.execute(new StructuredQuery(QueryAction.GET_TRACE, null, "t1", null, null));

        assertEquals("t1", ((Trace) result.result()).traceId());
        assertThrows(NotFoundException.class,
            () -> executor.execute(new StructuredQuery(QueryAction.GET_TRACE, null, "zz", null, null)));
    }

    @Test
    void shouldReturnEpisodeWithSummary() {
        QueryResult result = executor.execute(new StructuredQuery(QueryAction.EPISODE_TRACES, null, null, "ep", 2));

        EpisodeDetail detail = (EpisodeDetail) result.result();
        assertEquals(3, detail.summary().traceCount());
        assertEquals(TraceStatus.FAILED, detail.summary().status());
        assertEquals(List.of("t0", "t1"), detail.traces().stream().map(Trace::traceId).toList());
        assertEquals(3L, result.total());
    }

    @Test
    void shouldRunAggregates() {
        TraceStats stats = (TraceStats) executor.execute(StructuredQuery.of(QueryAction.STATS)).result();
        assertEquals(3, stats.traceCount());

        @SuppressWarnings("unchecked")
        Map<String, ToolUsageStats> usage =
            (Map<String, ToolUsageStats>) executor.execute(StructuredQuery.of(QueryAction.TOOL_USAGE)).result();
        assertEquals(3, usage.get("search").invocationCount());
    }
}
