package com.phodal.tracebrain.forest;

import com.phodal.tracebrain.error.CycleDetectedException;
import com.phodal.tracebrain.error.DanglingParentException;
import com.phodal.tracebrain.error.ErrorCode;
import com.phodal.tracebrain.error.NotFoundException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.model.Span;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReconstructionEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ReconstructionEngine engine = new ReconstructionEngine();

    private static Span span(String id, String parentId, String delta) {
        Span.Builder builder = Span.builder().spanId(id).parentId(parentId).name(id).at(T0);
        if (delta != null) {
            builder.delta(delta);
        }
        return builder.build();
    }

    @Test
    void shouldConcatenateDeltasFromRootToNode() {
        SpanForest forest = engine.build(List.of(
            span("a", null, "Hello "),
            span("b", "a", "World")
        ));

        assertEquals("Hello World", engine.reconstruct(forest, "b"));
        assertEquals("Hello ", engine.reconstruct(forest, "a"));
    }

    @Test
    void shouldSkipNodesWithoutDelta() {
        SpanForest forest = engine.build(List.of(
            span("root", null, null),
            span("mid", "root", "42"),
            span("leaf", "mid", null)
        ));

        assertEquals("", engine.reconstruct(forest, "root"));
        assertEquals("42", engine.reconstruct(forest, "leaf"));
    }

    @Test
    void shouldAcceptChildBeforeParentInInput() {
        SpanForest forest = engine.build(List.of(
            span("child", "parent", "b"),
            span("parent", null, "a")
        ));

        assertEquals("ab", engine.reconstruct(forest, "child"));
        assertEquals(List.of("parent"), forest.roots());
    }

    @Test
    void shouldReconstructEverySpanLikeSingleLookups() {
        SpanForest forest = engine.build(List.of(
            span("r", null, "1"),
            span("x", "r", "2"),
            span("y", "r", "3"),
            span("z", "x", "4"),
            span("other", null, "9")
        ));

        Map<String, String> all = engine.reconstructAll(forest);

        assertEquals(List.of("r", "x", "y", "z", "other"), List.copyOf(all.keySet()));
        for (String id : all.keySet()) {
            assertEquals(engine.reconstruct(forest, id), all.get(id));
        }
        assertEquals("124", all.get("z"));
    }

    @Test
    void shouldKeepChildrenInIngestionOrder() {
        SpanForest forest = engine.build(List.of(
            span("r", null, null),
            span("c2", "r", null),
            span("c1", "r", null),
            span("c3", "r", null)
        ));

        assertEquals(List.of("c2", "c1", "c3"), forest.children("r"));
    }

    @Test
    void shouldExposeAncestorsAndDepth() {
        SpanForest forest = engine.build(List.of(
            span("a", null, null),
            span("b", "a", null),
            span("c", "b", null)
        ));

        assertEquals(List.of("a", "b", "c"), forest.ancestors("c").stream().map(Span::spanId).toList());
        assertEquals(0, forest.depth("a"));
        assertEquals(2, forest.depth("c"));
    }

    @Test
    void shouldRejectDanglingParent() {
        DanglingParentException error = assertThrows(DanglingParentException.class,
            () -> engine.build(List.of(span("a", null, null), span("b", "missing", null))));

        assertEquals("b", error.getSpanId());
        assertEquals("missing", error.getParentId());
        assertEquals(ErrorCode.DANGLING_PARENT, error.getCode());
    }

    @Test
    void shouldRejectCycle() {
        CycleDetectedException error = assertThrows(CycleDetectedException.class,
            () -> engine.build(List.of(span("a", "c", null), span("b", "a", null), span("c", "b", null))));

        assertTrue(error.getCycle().containsAll(List.of("a", "b", "c")));
        assertInstanceOf(ValidationException.class, error);
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThrows(ValidationException.class,
            () -> engine.build(List.of(span("a", null, "x"), span("a", null, "y"))));
    }

    @Test
    void shouldReportUnknownSpan() {
        SpanForest forest = engine.build(List.of(span("a", null, null)));

        assertThrows(NotFoundException.class, () -> engine.reconstruct(forest, "nope"));
    }
}
