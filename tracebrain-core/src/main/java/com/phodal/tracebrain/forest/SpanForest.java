package com.phodal.tracebrain.forest;

import com.phodal.tracebrain.error.CycleDetectedException;
import com.phodal.tracebrain.error.DanglingParentException;
import com.phodal.tracebrain.error.NotFoundException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.model.Span;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of the spans of one trace, indexed by span id, with child adjacency.
 *
 * <p>A {@code SpanForest} only exists for a valid set of spans: every parent id resolves
 * inside the set and no parent chain revisits a node. Children are kept in the order
 * the spans were supplied, which is the sibling order used everywhere.</p>
 */
public final class SpanForest {

    private enum Mark { VISITING, DONE }

    private final Map<String, Span> arena;
    private final Map<String, List<String>> children;
    private final List<String> roots;

    private SpanForest(Map<String, Span> arena, Map<String, List<String>> children, List<String> roots) {
        this.arena = arena;
        this.children = children;
        this.roots = roots;
    }

    /**
     * Build and validate a forest.
     *
     * @throws ValidationException on a missing or repeated span id
     * @throws DanglingParentException when a parent id does not resolve
     * @throws CycleDetectedException when a parent chain loops
     */
    public static SpanForest of(Collection<Span> spans) {
        Map<String, Span> arena = new LinkedHashMap<>();
        for (Span span : spans) {
            if (span.spanId() == null || span.spanId().isBlank()) {
                throw new ValidationException("Span is missing span_id");
            }
            if (arena.putIfAbsent(span.spanId(), span) != null) {
                throw new ValidationException("Duplicate span id '" + span.spanId() + "'", span.spanId());
            }
        }

        Map<String, List<String>> children = new HashMap<>();
        List<String> roots = new ArrayList<>();
        for (Span span : arena.values()) {
            String parentId = span.parentId();
            if (parentId == null) {
                roots.add(span.spanId());
                continue;
            }
            if (!arena.containsKey(parentId)) {
                throw new DanglingParentException(span.spanId(), parentId);
            }
            children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(span.spanId());
        }

        detectCycles(arena);

        Map<String, List<String>> frozen = new HashMap<>();
        children.forEach((parent, kids) -> frozen.put(parent, List.copyOf(kids)));
        return new SpanForest(Collections.unmodifiableMap(arena), frozen, List.copyOf(roots));
    }

    private static void detectCycles(Map<String, Span> arena) {
        Map<String, Mark> marks = new HashMap<>();
        for (String start : arena.keySet()) {
            if (marks.get(start) == Mark.DONE) {
                continue;
            }
            List<String> path = new ArrayList<>();
            String current = start;
            while (current != null && marks.get(current) != Mark.DONE) {
                if (marks.get(current) == Mark.VISITING) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
                    cycle.add(current);
                    throw new CycleDetectedException(start, cycle);
                }
                marks.put(current, Mark.VISITING);
                path.add(current);
                current = arena.get(current).parentId();
            }
            for (String visited : path) {
                marks.put(visited, Mark.DONE);
            }
        }
    }

    public int size() {
        return arena.size();
    }

    public boolean contains(String spanId) {
        return arena.containsKey(spanId);
    }

    public Span get(String spanId) {
        Span span = arena.get(spanId);
        if (span == null) {
            throw new NotFoundException("Span '" + spanId + "' is not part of this forest");
        }
        return span;
    }

    /**
     * All spans in the order they were supplied.
     */
    public Collection<Span> spans() {
        return arena.values();
    }

    public List<String> roots() {
        return roots;
    }

    public List<String> children(String spanId) {
        get(spanId);
        return children.getOrDefault(spanId, List.of());
    }

    /**
     * The chain from the root down to {@code spanId}, both ends included.
     */
    public List<Span> ancestors(String spanId) {
        List<Span> chain = new ArrayList<>();
        Span current = get(spanId);
        while (current != null) {
            chain.add(current);
            current = current.parentId() != null ? arena.get(current.parentId()) : null;
        }
        Collections.reverse(chain);
        return chain;
    }

    public int depth(String spanId) {
        return ancestors(spanId).size() - 1;
    }
}
