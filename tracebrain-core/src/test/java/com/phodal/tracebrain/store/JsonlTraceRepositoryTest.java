package com.phodal.tracebrain.store;

import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.TraceStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonlTraceRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static TraceStore storeOver(JsonlTraceRepository repository) {
        return new TraceStore(repository, new ReconstructionEngine(), new MutableClock(T0));
    }

    @Test
    void shouldCreateJsonlFileUnderWorkspace(@TempDir Path workspace) throws Exception {
        JsonlTraceRepository repository = JsonlTraceRepository.forWorkspace(workspace);
        TraceStore store = storeOver(repository);

        store.ingest("t1", List.of(Span.builder().spanId("a").name("a").at(T0).delta("Hi").build()));

        Path traceFile = workspace.resolve(".tracebrain").resolve("traces.jsonl");
        assertEquals(traceFile, repository.getTracePath());
        assertTrue(Files.exists(traceFile), "Trace JSONL file should be created");
        List<String> lines = Files.readAllLines(traceFile, StandardCharsets.UTF_8);
        assertEquals(1, lines.stream().filter(l -> !l.isBlank()).count());
        assertTrue(lines.get(0).contains("\"trace_id\":\"t1\""));
        assertTrue(lines.get(0).contains("\"span_id\":\"a\""));
    }

    @Test
    void shouldReloadLatestSnapshotPerTrace(@TempDir Path workspace) {
        TraceStore store = storeOver(JsonlTraceRepository.forWorkspace(workspace));
        store.ingest("t1", List.of(Span.builder().spanId("a").name("a").at(T0).delta("Hello ").build()));
        store.ingest("t1", List.of(Span.builder().spanId("b").parentId("a").name("b").at(T0).delta("World").build()));
        store.addFeedback("t1", Feedback.of(4, "fine"), Deadline.none());
        store.updateAttributes("t1", Map.of(AttributeKeys.TRACE_STATUS, "completed"), Deadline.none());

        TraceStore reopened = storeOver(JsonlTraceRepository.forWorkspace(workspace));

        Trace trace = reopened.get("t1");
        assertEquals(2, trace.spanCount());
        assertEquals(1, trace.feedbacks().size());
        assertEquals(T0, trace.createdAt());
        assertEquals(TraceStatus.COMPLETED, trace.attributesView().status().orElseThrow());
        assertEquals("Hello World", reopened.reconstruct("t1", "b"));
    }

    @Test
    void shouldSkipCorruptLines(@TempDir Path workspace) throws Exception {
        JsonlTraceRepository repository = JsonlTraceRepository.forWorkspace(workspace);
        storeOver(repository).ingest("t1", List.of());
        Files.writeString(repository.getTracePath(), "{\"trace_id\": \"torn",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        JsonlTraceRepository reopened = JsonlTraceRepository.forWorkspace(workspace);

        assertEquals(1, reopened.count());
        assertTrue(reopened.findById("t1").isPresent());
    }

    @Test
    void shouldKeepTraceCommittedAfterTornLine(@TempDir Path workspace) throws Exception {
        JsonlTraceRepository repository = JsonlTraceRepository.forWorkspace(workspace);
        storeOver(repository).ingest("t1", List.of());
        Files.writeString(repository.getTracePath(), "{\"trace_id\":\"t2\",\"crea",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        TraceStore afterCrash = storeOver(JsonlTraceRepository.forWorkspace(workspace));
        afterCrash.ingest("t3", List.of(Span.builder().spanId("a").name("a").at(T0).build()));

        JsonlTraceRepository reopened = JsonlTraceRepository.forWorkspace(workspace);
        assertTrue(reopened.findById("t1").isPresent());
        assertTrue(reopened.findById("t3").isPresent(), "trace committed after the torn line must survive reload");
        assertFalse(reopened.findById("t2").isPresent());
        assertEquals(2, reopened.count());
        assertFalse(Files.readString(repository.getTracePath(), StandardCharsets.UTF_8).contains("\"crea"));
    }

    @Test
    void shouldTerminateCompleteLastLine(@TempDir Path workspace) throws Exception {
        JsonlTraceRepository repository = JsonlTraceRepository.forWorkspace(workspace);
        storeOver(repository).ingest("t1", List.of());
        Path file = repository.getTracePath();
        Files.writeString(file, Files.readString(file, StandardCharsets.UTF_8).strip(), StandardCharsets.UTF_8);

        storeOver(JsonlTraceRepository.forWorkspace(workspace)).ingest("t2", List.of());

        JsonlTraceRepository reopened = JsonlTraceRepository.forWorkspace(workspace);
        assertTrue(reopened.findById("t1").isPresent());
        assertTrue(reopened.findById("t2").isPresent());
    }

    @Test
    void shouldCompactToOneLinePerTrace(@TempDir Path workspace) throws Exception {
        JsonlTraceRepository repository = JsonlTraceRepository.forWorkspace(workspace);
        TraceStore store = storeOver(repository);
        store.ingest("t1", List.of());
        store.ingest("t2", List.of());
        store.addFeedback("t1", Feedback.of(3, null), Deadline.none());

        repository.compact();

        List<String> lines = Files.readAllLines(repository.getTracePath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.stream().filter(l -> !l.isBlank()).count());
        assertEquals(1, JsonlTraceRepository.forWorkspace(workspace).findById("t1").orElseThrow().feedbacks().size());
    }
}
