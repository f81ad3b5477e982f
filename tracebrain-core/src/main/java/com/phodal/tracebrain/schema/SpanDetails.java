package com.phodal.tracebrain.schema;

/**
 * Variant-specific payload of a span, selected by {@link AttributeKeys#SPAN_TYPE}.
 */
public interface SpanDetails {

    /**
     * The span type, or {@code null} for spans that did not declare one.
     */
    SpanType type();

    record UserRequest(String systemPrompt) implements SpanDetails {
        @Override
        public SpanType type() {
            return SpanType.USER_REQUEST;
        }
    }

    record LlmInference(
        String completion,
        String thought,
        String toolCode,
        String finalAnswer
    ) implements SpanDetails {
        @Override
        public SpanType type() {
            return SpanType.LLM_INFERENCE;
        }
    }

    record ToolExecution(
        String toolName,
        Object input,
        Object output
    ) implements SpanDetails {
        @Override
        public SpanType type() {
            return SpanType.TOOL_EXECUTION;
        }
    }

    record Unclassified() implements SpanDetails {
        @Override
        public SpanType type() {
            return null;
        }
    }
}
