package com.phodal.tracebrain.store;

import com.phodal.tracebrain.model.Trace;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Persistence backend for traces.
 *
 * <p>Implementations must make {@link #save(Trace)} atomic per trace: readers observe either
 * the previous snapshot or the new one, never a mix. {@link TraceStore} serialises all writes
 * for a given trace id, so implementations do not need to detect lost updates themselves.</p>
 */
public interface TraceRepository {

    Optional<Trace> findById(String traceId);

    /**
     * All committed traces, in no particular order.
     */
    List<Trace> findAll();

    default List<Trace> find(Predicate<Trace> filter) {
        return findAll().stream()
            .filter(filter)
            .toList();
    }

    /**
     * Replace the stored snapshot of {@code trace.traceId()} with {@code trace}.
     */
    void save(Trace trace);

    long count();
}
