package com.phodal.tracebrain.store;

import com.phodal.tracebrain.model.Trace;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps trace snapshots in memory. Traces are immutable, so a reference swap is the commit.
 */
public class InMemoryTraceRepository implements TraceRepository {

    private final Map<String, Trace> traces = new ConcurrentHashMap<>();

    @Override
    public Optional<Trace> findById(String traceId) {
        return Optional.ofNullable(traces.get(traceId));
    }

    @Override
    public List<Trace> findAll() {
        return List.copyOf(traces.values());
    }

    @Override
    public void save(Trace trace) {
        traces.put(trace.traceId(), trace);
    }

    @Override
    public long count() {
        return traces.size();
    }
}
