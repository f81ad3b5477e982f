package com.phodal.tracebrain.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.forest.SpanForest;
import com.phodal.tracebrain.llm.CompletionOptions;
import com.phodal.tracebrain.llm.LanguageModelProvider;
import com.phodal.tracebrain.llm.ModelInvoker;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Span;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AiEvaluation;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.EvaluationStatus;
import com.phodal.tracebrain.schema.SpanAttributes;
import com.phodal.tracebrain.schema.TraceAttributes;
import com.phodal.tracebrain.util.TraceJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Asks a judge model to rate a trace.
 *
 * <p>The judge answers with {@code rating}, {@code confidence} and {@code feedback}. The review
 * status is not trusted from the model: it is {@code completed} when confidence reaches
 * {@link #REVIEW_THRESHOLD}, otherwise {@code pending_review}.</p>
 */
public class TraceEvaluator {
    private static final Logger log = LoggerFactory.getLogger(TraceEvaluator.class);

    public static final double REVIEW_THRESHOLD = 0.8;

    private static final int MAX_CONTENT_CHARS = 2000;

    static final String SYSTEM_PROMPT = """
        You review the execution trace of an AI agent.
        Judge whether the agent understood the request, used its tools correctly and reached a correct answer.
        Answer with one JSON object and nothing else:
          {"rating": <integer 1..5>, "confidence": <number 0..1>, "feedback": "<one short paragraph>"}
        """;

    private final LanguageModelProvider provider;
    private final ModelInvoker invoker;
    private final ReconstructionEngine reconstructionEngine;
    private final ObjectMapper objectMapper = TraceJson.createObjectMapper();

    /**
     * @param provider judge backend, {@code null} when none is configured
     */
    public TraceEvaluator(LanguageModelProvider provider, ModelInvoker invoker, ReconstructionEngine reconstructionEngine) {
        this.provider = provider;
        this.invoker = invoker;
        this.reconstructionEngine = reconstructionEngine;
    }

    public boolean isEnabled() {
        return provider != null;
    }

    public AiEvaluation evaluate(Trace trace) {
        return evaluate(trace, null);
    }

    /**
     * @param judgeModel model override for the judge, {@code null} for the configured one
     * @throws ProviderException when no judge is configured or every attempt failed
     */
    public AiEvaluation evaluate(Trace trace, String judgeModel) {
        if (provider == null) {
            throw new ProviderException("No language model provider is configured", false, null);
        }
        CompletionOptions options = CompletionOptions.json(SYSTEM_PROMPT).withModel(judgeModel);
        AiEvaluation evaluation = invoker.invoke("trace evaluation", provider, describe(trace), options, this::parse);
        log.info("Evaluated trace {}: rating={}, confidence={}, status={}",
            trace.traceId(), evaluation.rating(), evaluation.confidence(), evaluation.status().getValue());
        return evaluation;
    }

    /**
     * Trace-level attributes that record {@code evaluation} on a trace.
     */
    public static Map<String, Object> toAttributes(AiEvaluation evaluation) {
        return Map.of(AttributeKeys.AI_EVALUATION, evaluation.toAttribute());
    }

    AiEvaluation parse(String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(TraceJson.extractObject(raw));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Judge answer is not valid JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new ValidationException("Judge answer is not a JSON object");
        }

        JsonNode confidence = node.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            throw new ValidationException("Judge answer requires a numeric 'confidence'");
        }
        JsonNode rating = node.get("rating");
        Integer ratingValue = null;
        if (rating != null && !rating.isNull()) {
            if (!rating.isIntegralNumber()) {
                throw new ValidationException("Judge 'rating' must be an integer");
            }
            ratingValue = rating.asInt();
        }
        JsonNode feedback = node.get("feedback");
        double confidenceValue = confidence.asDouble();
        EvaluationStatus status = confidenceValue >= REVIEW_THRESHOLD
            ? EvaluationStatus.COMPLETED
            : EvaluationStatus.PENDING_REVIEW;

        return new AiEvaluation(ratingValue, confidenceValue, status,
            feedback != null && !feedback.isNull() ? feedback.asText() : null);
    }

    String describe(Trace trace) {
        SpanForest forest = reconstructionEngine.build(trace.spans());
        TraceAttributes attributes = trace.attributesView();

        StringBuilder sb = new StringBuilder();
        sb.append("Trace ").append(trace.traceId()).append('\n');
        attributes.systemPrompt().ifPresent(prompt -> sb.append("System prompt: ").append(prompt).append('\n'));
        attributes.status().ifPresent(status -> sb.append("Status: ").append(status.getValue()).append('\n'));
        attributes.errorType().ifPresent(type -> sb.append("Error type: ").append(type.getValue()).append('\n'));

        sb.append("\nSpans:\n");
        Deque<String> pending = new ArrayDeque<>();
        pushReversed(pending, forest.roots());
        while (!pending.isEmpty()) {
            String spanId = pending.pop();
            describeSpan(sb, forest, spanId);
            pushReversed(pending, forest.children(spanId));
        }

        trace.latestFeedback().map(Feedback::comment).ifPresent(comment ->
            sb.append("\nHuman feedback: ").append(comment).append('\n'));
        return sb.toString();
    }

    private void describeSpan(StringBuilder sb, SpanForest forest, String spanId) {
        Span span = forest.get(spanId);
        SpanAttributes spanAttributes = span.attributesView();
        String indent = "  ".repeat(forest.depth(spanId));
        sb.append(indent).append("- ").append(span.name());
        if (spanAttributes.type() != null) {
            sb.append(" [").append(spanAttributes.type().getValue()).append(']');
        }
        spanAttributes.toolName().ifPresent(tool -> sb.append(" tool=").append(tool));
        if (spanAttributes.isError()) {
            sb.append(" ERROR");
            spanAttributes.errorDescription().ifPresent(desc -> sb.append(": ").append(desc));
        }
        sb.append('\n');
        spanAttributes.delta().ifPresent(delta -> sb.append(indent).append("  ").append(truncate(delta)).append('\n'));
        // a leaf carries the full context the agent ended with
        if (forest.children(spanId).isEmpty() && forest.depth(spanId) > 0) {
            String context = reconstructionEngine.reconstruct(forest, spanId);
            if (!context.isEmpty()) {
                sb.append(indent).append("  context: ").append(truncate(context)).append('\n');
            }
        }
    }

    private static void pushReversed(Deque<String> stack, List<String> ids) {
        for (int i = ids.size() - 1; i >= 0; i--) {
            stack.push(ids.get(i));
        }
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_CONTENT_CHARS) {
            return text;
        }
        return text.substring(0, MAX_CONTENT_CHARS) + "...";
    }
}
