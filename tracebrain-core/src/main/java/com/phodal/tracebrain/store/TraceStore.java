package com.phodal.tracebrain.store;

import com.phodal.tracebrain.error.ConflictException;
import com.phodal.tracebrain.error.NotFoundException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.forest.SpanForest;
import com.phodal.tracebrain.model.Episode;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.SpanAttributes;
import com.phodal.tracebrain.schema.TraceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns trace storage: validated, idempotent ingestion, the feedback log, and filtered reads.
 *
 * <p>Every mutation of a trace runs under that trace's lock, builds a complete new snapshot,
 * validates it, and commits it with a single {@link TraceRepository#save(Trace)}. A failure at
 * any step leaves the stored trace untouched.</p>
 */
public class TraceStore {
    private static final Logger log = LoggerFactory.getLogger(TraceStore.class);

    public static final int MAX_PAGE_SIZE = 1000;

    /**
     * Newest first; ties broken by id so paging is stable.
     */
    public static final Comparator<Trace> NEWEST_FIRST = Comparator
        .comparing(Trace::createdAt).reversed()
        .thenComparing(Trace::traceId);

    private final TraceRepository repository;
    private final ReconstructionEngine reconstructionEngine;
    private final Clock clock;
    private final TraceLocks locks = new TraceLocks();

    public TraceStore(TraceRepository repository) {
        this(repository, new ReconstructionEngine(), Clock.systemUTC());
    }

    public TraceStore(TraceRepository repository, ReconstructionEngine reconstructionEngine, Clock clock) {
        this.repository = repository;
        this.reconstructionEngine = reconstructionEngine;
        this.clock = clock;
    }

    public Trace ingest(String traceId, List<Span> spans) {
        return ingest(traceId, spans, null, null, Deadline.none());
    }

    /**
     * Create or extend a trace.
     *
     * <p>New spans are merged into the stored forest. Resubmitting a span identical to the stored
     * one is a no-op; the same span id with different content is a conflict. Trace attributes
     * are merged over the stored ones. The batch is checked as a whole before anything is saved.</p>
     *
     * @param traceId trace to create or extend
     * @param spans spans of this batch, in ingestion order
     * @param attributes trace-level attributes to merge, may be {@code null}
     * @param feedback feedback entry to append, may be {@code null}
     * @param deadline gives up, without any state change, once passed
     * @return the committed trace
     * @throws ValidationException on malformed spans, attributes, dangling parents or cycles
     * @throws ConflictException when a span id is reused with different content
     */
    public Trace ingest(String traceId, List<Span> spans, Map<String, Object> attributes,
                        Feedback feedback, Deadline deadline) {
        requireTraceId(traceId);
        List<Span> batch = spans != null ? spans : List.of();
        try {
            for (Span span : batch) {
                checkSpan(span);
            }
            TraceAttributes.parse(attributes);
            Feedback stamped = feedback != null ? stampFeedback(feedback) : null;

            return locks.withLock(traceId, deadline, "ingest", () -> {
                Optional<Trace> existing = repository.findById(traceId);
                Trace base = existing.orElseGet(() -> Trace.create(traceId, clock.instant()));

                List<Span> merged = mergeSpans(traceId, base.spans(), batch);
                reconstructionEngine.build(merged);

                Trace next = base.withSpans(merged).mergeAttributes(attributes);
                TraceAttributes.parse(next.attributes());
                if (stamped != null) {
                    next = next.appendFeedback(stamped);
                }

                deadline.check("ingest");
                repository.save(next);
                log.debug("Ingested {} spans into trace {} ({} stored, {})",
                    batch.size(), traceId, next.spanCount(), existing.isPresent() ? "updated" : "created");
                return next;
            });
        } catch (ValidationException | ConflictException e) {
            log.warn("Rejected ingestion for trace {}: {}", traceId, e.getMessage());
            throw e;
        }
    }

    private List<Span> mergeSpans(String traceId, List<Span> stored, List<Span> batch) {
        Map<String, Span> byId = new LinkedHashMap<>();
        for (Span span : stored) {
            byId.put(span.spanId(), span);
        }
        List<Span> merged = new ArrayList<>(stored);
        for (Span span : batch) {
            Span prior = byId.get(span.spanId());
            if (prior == null) {
                byId.put(span.spanId(), span);
                merged.add(span);
            } else if (!prior.equals(span)) {
                throw new ConflictException(traceId, span.spanId());
            }
        }
        return merged;
    }

    private void checkSpan(Span span) {
        if (span == null) {
            throw new ValidationException("Span entry must not be null");
        }
        String spanId = span.spanId();
        if (spanId == null || spanId.isBlank()) {
            throw new ValidationException("Span is missing span_id");
        }
        if (span.name() == null || span.name().isBlank()) {
            throw new ValidationException("Span '" + spanId + "' is missing name", spanId);
        }
        if (span.startTime() == null || span.endTime() == null) {
            throw new ValidationException("Span '" + spanId + "' requires start_time and end_time", spanId);
        }
        if (span.startTime().isAfter(span.endTime())) {
            throw new ValidationException("Span '" + spanId + "' ends before it starts", spanId);
        }
        if (spanId.equals(span.parentId())) {
            throw new ValidationException("Span '" + spanId + "' is its own parent", spanId);
        }
        SpanAttributes.parse(spanId, span.attributes());
    }

    private Feedback stampFeedback(Feedback feedback) {
        if (feedback.rating() != null && (feedback.rating() < 1 || feedback.rating() > 5)) {
            throw new ValidationException("Feedback rating must be within 1..5, got " + feedback.rating());
        }
        return feedback.timestamp() != null ? feedback : feedback.withTimestamp(clock.instant());
    }

    /**
     * Append a feedback entry. Earlier entries are never touched.
     *
     * @throws NotFoundException for an unknown trace
     */
    public Trace addFeedback(String traceId, Feedback feedback, Deadline deadline) {
        requireTraceId(traceId);
        if (feedback == null) {
            throw new ValidationException("Feedback body is required");
        }
        Feedback stamped = stampFeedback(feedback);
        return locks.withLock(traceId, deadline, "addFeedback", () -> {
            Trace trace = repository.findById(traceId).orElseThrow(() -> NotFoundException.trace(traceId));
            Trace next = trace.appendFeedback(stamped);
            deadline.check("addFeedback");
            repository.save(next);
            log.debug("Appended feedback #{} to trace {}", next.feedbacks().size(), traceId);
            return next;
        });
    }

    /**
     * Merge trace-level attributes into an existing trace, e.g. a signal or an evaluation result.
     *
     * @throws NotFoundException for an unknown trace
     */
    public Trace updateAttributes(String traceId, Map<String, Object> attributes, Deadline deadline) {
        requireTraceId(traceId);
        TraceAttributes.parse(attributes);
        return locks.withLock(traceId, deadline, "updateAttributes", () -> {
            Trace trace = repository.findById(traceId).orElseThrow(() -> NotFoundException.trace(traceId));
            Trace next = trace.mergeAttributes(attributes);
            TraceAttributes.parse(next.attributes());
            deadline.check("updateAttributes");
            repository.save(next);
            log.debug("Updated attributes {} of trace {}", attributes.keySet(), traceId);
            return next;
        });
    }

    public Optional<Trace> find(String traceId) {
        if (traceId == null) {
            return Optional.empty();
        }
        return repository.findById(traceId);
    }

    /**
     * @throws NotFoundException for an unknown trace
     */
    public Trace get(String traceId) {
        return find(traceId).orElseThrow(() -> NotFoundException.trace(traceId));
    }

    /**
     * Filtered traces, newest first, cut to an offset window.
     */
    public Page<Trace> list(TraceFilter filter, int skip, int limit) {
        Page.checkWindow(skip, limit, MAX_PAGE_SIZE);
        return Page.of(snapshot(filter), skip, limit);
    }

    /**
     * All committed traces matching {@code filter}, newest first.
     */
    public List<Trace> snapshot(TraceFilter filter) {
        TraceFilter effective = filter != null ? filter : TraceFilter.none();
        List<Trace> matching = new ArrayList<>(repository.find(effective::matches));
        matching.sort(NEWEST_FIRST);
        return matching;
    }

    /**
     * Traces of one episode, oldest first.
     *
     * @throws NotFoundException when no trace belongs to the episode
     */
    public Episode episodeTraces(String episodeId) {
        if (episodeId == null || episodeId.isBlank()) {
            throw new ValidationException("episode_id is required");
        }
        List<Trace> traces = new ArrayList<>(repository.find(trace ->
            trace.attributesView().episodeId().filter(episodeId::equals).isPresent()));
        if (traces.isEmpty()) {
            throw NotFoundException.episode(episodeId);
        }
        traces.sort(Comparator.comparing(Trace::createdAt).thenComparing(Trace::traceId));
        return new Episode(episodeId, traces);
    }

    public SpanForest forest(Trace trace) {
        return reconstructionEngine.build(trace.spans());
    }

    /**
     * Full content of one span of a stored trace.
     */
    public String reconstruct(String traceId, String spanId) {
        Trace trace = get(traceId);
        SpanForest forest = forest(trace);
        if (!forest.contains(spanId)) {
            throw NotFoundException.span(traceId, spanId);
        }
        return reconstructionEngine.reconstruct(forest, spanId);
    }

    public Map<String, String> reconstructAll(Trace trace) {
        return reconstructionEngine.reconstructAll(forest(trace));
    }

    public long count() {
        return repository.count();
    }

    private static void requireTraceId(String traceId) {
        if (traceId == null || traceId.isBlank()) {
            throw new ValidationException("trace_id is required");
        }
    }
}
