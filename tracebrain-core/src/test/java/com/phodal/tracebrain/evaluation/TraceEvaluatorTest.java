package com.phodal.tracebrain.evaluation;

import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.llm.CompletionOptions;
import com.phodal.tracebrain.llm.LanguageModelProvider;
import com.phodal.tracebrain.llm.ModelInvoker;
import com.phodal.tracebrain.llm.RetryPolicy;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AiEvaluation;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.EvaluationStatus;
import com.phodal.tracebrain.schema.SpanType;
import com.phodal.tracebrain.schema.TraceAttributes;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceEvaluatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ModelInvoker invoker = new ModelInvoker(
        new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofSeconds(2)));

    private static Trace calculatorTrace() {
        return new Trace("T1", T0,
            Map.of(AttributeKeys.SYSTEM_PROMPT, "You are a calculator"),
            List.of(
                Span.builder().spanId("s1").name("user asks").at(T0).type(SpanType.USER_REQUEST).build(),
                Span.builder().spanId("s2").parentId("s1").name("think").at(T0)
                    .type(SpanType.LLM_INFERENCE).delta("42").build(),
                Span.builder().spanId("s3").parentId("s2").name("calculator").at(T0).tool("calculator")
                    .attribute(AttributeKeys.OTEL_STATUS_CODE, "ERROR")
                    .attribute(AttributeKeys.OTEL_STATUS_DESCRIPTION, "overflow").build()),
            List.of(Feedback.of(2, "wrong tool")));
    }

    private TraceEvaluator evaluator(LanguageModelProvider provider) {
        return new TraceEvaluator(provider, invoker, new ReconstructionEngine());
    }

    @Test
    void shouldDescribeTraceToJudge() {
        AtomicReference<String> prompt = new AtomicReference<>();
        AtomicReference<CompletionOptions> options = new AtomicReference<>();
        TraceEvaluator evaluator = evaluator((p, o) -> {
            prompt.set(p);
            options.set(o);
            return "{\"rating\": 4, \"confidence\": 0.85, \"feedback\": \"Correct answer.\"}";
        });

        AiEvaluation evaluation = evaluator.evaluate(calculatorTrace(), "judge-model");

        assertEquals(4, evaluation.rating());
        assertEquals(0.85, evaluation.confidence(), 1e-9);
        assertEquals(EvaluationStatus.COMPLETED, evaluation.status());
        assertEquals("Correct answer.", evaluation.feedback());
        assertEquals("judge-model", options.get().model());
        assertTrue(prompt.get().contains("You are a calculator"));
        assertTrue(prompt.get().contains("tool=calculator ERROR: overflow"));
        assertTrue(prompt.get().contains("42"));
        assertTrue(prompt.get().contains("wrong tool"));
    }

    @Test
    void shouldDescribeSpansDepthFirstWithLeafContext() {
        Trace trace = new Trace("T2", T0, Map.of(), List.of(
            Span.builder().spanId("root").name("plan").at(T0).delta("Hello ").build(),
            Span.builder().spanId("b").parentId("root").name("second").at(T0).delta("there").build(),
            Span.builder().spanId("a").parentId("root").name("first").at(T0).delta("World").build()),
            List.of());

        String description = evaluator((p, o) -> "{}").describe(trace);

        assertTrue(description.indexOf("- plan") < description.indexOf("  - second"));
        assertTrue(description.indexOf("  - second") < description.indexOf("  - first"));
        assertTrue(description.contains("context: Hello World"));
        assertTrue(description.contains("context: Hello there"));
    }

    @Test
    void shouldMarkLowConfidenceForReview() {
        AiEvaluation evaluation = evaluator((p, o) -> "```json\n{\"rating\": 2, \"confidence\": 0.5}\n```")
            .evaluate(calculatorTrace());

        assertEquals(EvaluationStatus.PENDING_REVIEW, evaluation.status());
        assertNull(evaluation.feedback());
    }

    @Test
    void shouldRetryOutOfRangeAnswerThenFail() {
        AtomicInteger calls = new AtomicInteger();
        TraceEvaluator evaluator = evaluator((p, o) -> {
            calls.incrementAndGet();
            return "{\"rating\": 9, \"confidence\": 0.9}";
        });

        assertThrows(ProviderException.class, () -> evaluator.evaluate(calculatorTrace()));
        assertEquals(2, calls.get());
    }

    @Test
    void shouldRejectMissingConfidence() {
        assertThrows(ProviderException.class,
            () -> evaluator((p, o) -> "{\"rating\": 3}").evaluate(calculatorTrace()));
    }

    @Test
    void shouldRequireProvider() {
        TraceEvaluator evaluator = evaluator(null);

        assertFalse(evaluator.isEnabled());
        ProviderException error = assertThrows(ProviderException.class, () -> evaluator.evaluate(calculatorTrace()));
        assertFalse(error.isRetryable());
    }

    @Test
    void shouldProduceAttributesAcceptedBySchema() {
        AiEvaluation evaluation = new AiEvaluation(5, 0.95, EvaluationStatus.COMPLETED, "ok");

        TraceAttributes parsed = TraceAttributes.parse(TraceEvaluator.toAttributes(evaluation));

        assertEquals(evaluation, parsed.evaluation().orElseThrow());
    }
}
