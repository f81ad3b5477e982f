package com.phodal.tracebrain.forest;

import com.phodal.tracebrain.model.Span;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rebuilds full span content from delta content.
 *
 * <p>Spans carry only the text they produced themselves. The full content of a span is the
 * concatenation of the deltas on its ancestor chain, root first and the span itself last.
 * Nothing is cached: content is recomputed on every call from the forest snapshot.</p>
 */
public class ReconstructionEngine {

    /**
     * Validate a set of spans and assemble them into a forest.
     */
    public SpanForest build(Collection<Span> spans) {
        return SpanForest.of(spans);
    }

    /**
     * Full content of one span. O(depth).
     */
    public String reconstruct(SpanForest forest, String spanId) {
        StringBuilder content = new StringBuilder();
        for (Span span : forest.ancestors(spanId)) {
            span.attributesView().delta().ifPresent(content::append);
        }
        return content.toString();
    }

    /**
     * Full content of every span, keyed by span id in forest order.
     * Walks each tree once, extending the parent's content with the child's delta.
     */
    public Map<String, String> reconstructAll(SpanForest forest) {
        Map<String, String> computed = new LinkedHashMap<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String root : forest.roots()) {
            computed.put(root, forest.get(root).attributesView().delta().orElse(""));
            pending.push(root);
        }
        while (!pending.isEmpty()) {
            String parent = pending.pop();
            String prefix = computed.get(parent);
            for (String child : forest.children(parent)) {
                computed.put(child, prefix + forest.get(child).attributesView().delta().orElse(""));
                pending.push(child);
            }
        }

        Map<String, String> ordered = new LinkedHashMap<>();
        for (Span span : forest.spans()) {
            ordered.put(span.spanId(), computed.get(span.spanId()));
        }
        return ordered;
    }
}
