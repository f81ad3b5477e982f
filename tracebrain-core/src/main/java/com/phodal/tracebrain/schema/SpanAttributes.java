package com.phodal.tracebrain.schema;

import com.phodal.tracebrain.error.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view over the attribute bag of one span.
 *
 * <p>Parsing is strict: a well-known key holding a value of the wrong shape is rejected
 * with a {@link ValidationException} naming the span. Keys the schema does not know are
 * kept in {@link #extensions()} and never interpreted.</p>
 */
public final class SpanAttributes {

    private static final Set<String> KNOWN_KEYS = Set.of(
        AttributeKeys.SPAN_TYPE,
        AttributeKeys.LLM_NEW_CONTENT,
        AttributeKeys.LLM_COMPLETION,
        AttributeKeys.LLM_THOUGHT,
        AttributeKeys.LLM_TOOL_CODE,
        AttributeKeys.LLM_FINAL_ANSWER,
        AttributeKeys.TOOL_NAME,
        AttributeKeys.TOOL_INPUT,
        AttributeKeys.TOOL_OUTPUT,
        AttributeKeys.USAGE,
        AttributeKeys.OTEL_STATUS_CODE,
        AttributeKeys.OTEL_STATUS_DESCRIPTION,
        AttributeKeys.SYSTEM_PROMPT
    );

    private final SpanDetails details;
    private final String delta;
    private final TokenUsage usage;
    private final boolean error;
    private final String errorDescription;
    private final Map<String, Object> extensions;

    private SpanAttributes(SpanDetails details, String delta, TokenUsage usage,
                           boolean error, String errorDescription, Map<String, Object> extensions) {
        this.details = details;
        this.delta = delta;
        this.usage = usage;
        this.error = error;
        this.errorDescription = errorDescription;
        this.extensions = extensions;
    }

    /**
     * Parse and check the attributes of a span.
     *
     * @param spanId used to identify the span in validation errors
     * @param attributes raw attribute bag, may be {@code null}
     */
    public static SpanAttributes parse(String spanId, Map<String, Object> attributes) {
        Map<String, Object> attrs = attributes != null ? attributes : Map.of();

        SpanType type = null;
        String rawType = AttributeValues.string(attrs, AttributeKeys.SPAN_TYPE, spanId);
        if (rawType != null) {
            type = SpanType.find(rawType)
                .orElseThrow(() -> new ValidationException("Unknown span type '" + rawType + "'", spanId));
        }

        String delta = AttributeValues.string(attrs, AttributeKeys.LLM_NEW_CONTENT, spanId);
        TokenUsage usage = TokenUsage.parse(attrs.get(AttributeKeys.USAGE), spanId);

        String statusCode = AttributeValues.string(attrs, AttributeKeys.OTEL_STATUS_CODE, spanId);
        boolean error = "ERROR".equalsIgnoreCase(statusCode);
        Object description = attrs.get(AttributeKeys.OTEL_STATUS_DESCRIPTION);

        SpanDetails details;
        if (type == null) {
            details = new SpanDetails.Unclassified();
        } else {
            details = switch (type) {
                case USER_REQUEST -> new SpanDetails.UserRequest(
                    AttributeValues.string(attrs, AttributeKeys.SYSTEM_PROMPT, spanId));
                case LLM_INFERENCE -> new SpanDetails.LlmInference(
                    AttributeValues.string(attrs, AttributeKeys.LLM_COMPLETION, spanId),
                    AttributeValues.string(attrs, AttributeKeys.LLM_THOUGHT, spanId),
                    AttributeValues.string(attrs, AttributeKeys.LLM_TOOL_CODE, spanId),
                    AttributeValues.string(attrs, AttributeKeys.LLM_FINAL_ANSWER, spanId));
                case TOOL_EXECUTION -> new SpanDetails.ToolExecution(
                    AttributeValues.string(attrs, AttributeKeys.TOOL_NAME, spanId),
                    attrs.get(AttributeKeys.TOOL_INPUT),
                    attrs.get(AttributeKeys.TOOL_OUTPUT));
            };
        }

        Map<String, Object> extensions = new LinkedHashMap<>();
        attrs.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extensions.put(key, value);
            }
        });

        return new SpanAttributes(details, delta, usage, error,
            description != null ? String.valueOf(description) : null,
            Collections.unmodifiableMap(extensions));
    }

    public SpanType type() {
        return details.type();
    }

    public SpanDetails details() {
        return details;
    }

    /**
     * The incremental content this span produced, never the accumulated text.
     */
    public Optional<String> delta() {
        return Optional.ofNullable(delta);
    }

    public Optional<TokenUsage> usage() {
        return Optional.ofNullable(usage);
    }

    public boolean isError() {
        return error;
    }

    public Optional<String> errorDescription() {
        return Optional.ofNullable(errorDescription);
    }

    public Optional<String> toolName() {
        if (details instanceof SpanDetails.ToolExecution tool) {
            return Optional.ofNullable(tool.toolName());
        }
        return Optional.empty();
    }

    public Map<String, Object> extensions() {
        return extensions;
    }
}
