package com.phodal.tracebrain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracebrain.error.StorageException;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.util.TraceJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trace repository backed by a JSONL file (one JSON object per line).
 *
 * <p>Every commit appends the full snapshot of the changed trace as one line; on open the file
 * is replayed and the last line per trace id wins. A final line without its line separator is
 * repaired on open: it is terminated when it holds a complete snapshot and cut off otherwise, so
 * the next append always starts on a fresh line. {@link #compact()} rewrites the file with one
 * line per trace.</p>
 *
 * <p>Default storage path: {@code .tracebrain/traces.jsonl}</p>
 */
public class JsonlTraceRepository implements TraceRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonlTraceRepository.class);

    public static final String DEFAULT_TRACE_DIR = ".tracebrain";
    public static final String DEFAULT_TRACE_FILE = "traces.jsonl";

    private final Path tracePath;
    private final ObjectMapper objectMapper;
    private final Object writeLock = new Object();
    private final Map<String, Trace> index = new ConcurrentHashMap<>();

    public JsonlTraceRepository(Path tracePath) {
        this.tracePath = tracePath;
        this.objectMapper = TraceJson.createObjectMapper();
        load();
    }

    public static JsonlTraceRepository forWorkspace(Path workspacePath) {
        return new JsonlTraceRepository(workspacePath.resolve(DEFAULT_TRACE_DIR).resolve(DEFAULT_TRACE_FILE));
    }

    public static JsonlTraceRepository forFile(Path filePath) {
        return new JsonlTraceRepository(filePath);
    }

    public Path getTracePath() {
        return tracePath;
    }

    private void load() {
        if (!Files.exists(tracePath)) {
            return;
        }
        repairTail();
        try (BufferedReader reader = Files.newBufferedReader(tracePath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;
                try {
                    Trace trace = objectMapper.readValue(line, Trace.class);
                    index.put(trace.traceId(), trace);
                } catch (Exception e) {
                    log.warn("Failed to parse trace snapshot at line {}: {}", lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read trace file " + tracePath, e);
        }
        log.info("Loaded {} traces from {}", index.size(), tracePath);
    }

    /**
     * Make sure the file ends with a line separator.
     */
    private void repairTail() {
        try (FileChannel channel = FileChannel.open(tracePath, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            long lineStart = lastLineStart(channel, size);
            if (lineStart == size) {
                return;
            }
            ByteBuffer tail = ByteBuffer.allocate(Math.toIntExact(size - lineStart));
            readFully(channel, tail, lineStart);
            String line = new String(tail.array(), StandardCharsets.UTF_8);
            if (!line.isBlank() && isSnapshot(line)) {
                channel.write(ByteBuffer.wrap(System.lineSeparator().getBytes(StandardCharsets.UTF_8)), size);
                log.warn("Terminated unfinished last line of {}", tracePath);
            } else {
                channel.truncate(lineStart);
                log.warn("Dropped torn last line of {} ({} bytes)", tracePath, size - lineStart);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to repair trace file " + tracePath, e);
        }
    }

    /**
     * Offset just past the last {@code '\n'}, or 0 when there is none.
     */
    private static long lastLineStart(FileChannel channel, long size) throws IOException {
        ByteBuffer chunk = ByteBuffer.allocate(8192);
        long end = size;
        while (end > 0) {
            int length = (int) Math.min(chunk.capacity(), end);
            long start = end - length;
            chunk.clear().limit(length);
            readFully(channel, chunk, start);
            for (int i = length - 1; i >= 0; i--) {
                if (chunk.get(i) == '\n') {
                    return start + i + 1;
                }
            }
            end = start;
        }
        return 0;
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long offset = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset);
            if (read < 0) {
                throw new IOException("Unexpected end of file at offset " + offset);
            }
            offset += read;
        }
    }

    private boolean isSnapshot(String line) {
        try {
            return objectMapper.readValue(line, Trace.class).traceId() != null;
        } catch (IOException e) {
            return false;
        }
    }

    private void ensureDirectoryExists() throws IOException {
        Path dir = tracePath.getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created trace directory: {}", dir);
        }
    }

    @Override
    public Optional<Trace> findById(String traceId) {
        return Optional.ofNullable(index.get(traceId));
    }

    @Override
    public List<Trace> findAll() {
        return List.copyOf(index.values());
    }

    @Override
    public void save(Trace trace) {
        synchronized (writeLock) {
            try {
                ensureDirectoryExists();
                String json = objectMapper.writeValueAsString(trace);
                Files.writeString(
                    tracePath,
                    json + System.lineSeparator(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                );
            } catch (IOException e) {
                throw new StorageException("Failed to append trace " + trace.traceId(), e);
            }
            index.put(trace.traceId(), trace);
            log.debug("Appended snapshot of trace {} ({} spans)", trace.traceId(), trace.spanCount());
        }
    }

    @Override
    public long count() {
        return index.size();
    }

    /**
     * Rewrite the file so it holds only the latest snapshot of each trace.
     */
    public void compact() {
        synchronized (writeLock) {
            Path temp = tracePath.resolveSibling(tracePath.getFileName() + ".compact");
            try {
                ensureDirectoryExists();
                try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                    for (Trace trace : index.values()) {
                        writer.write(objectMapper.writeValueAsString(trace));
                        writer.newLine();
                    }
                }
                Files.move(temp, tracePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.info("Compacted trace store {} to {} traces", tracePath, index.size());
            } catch (IOException e) {
                throw new StorageException("Failed to compact " + tracePath, e);
            }
        }
    }
}
