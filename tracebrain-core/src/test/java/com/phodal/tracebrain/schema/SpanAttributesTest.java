package com.phodal.tracebrain.schema;

import com.phodal.tracebrain.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpanAttributesTest {

    @Test
    void shouldParseToolExecutionVariant() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(AttributeKeys.SPAN_TYPE, "tool_execution");
        attrs.put(AttributeKeys.TOOL_NAME, "calculator");
        attrs.put(AttributeKeys.TOOL_INPUT, Map.of("expression", "6*7"));
        attrs.put(AttributeKeys.TOOL_OUTPUT, "42");
        attrs.put(AttributeKeys.OTEL_STATUS_CODE, "ERROR");
        attrs.put(AttributeKeys.OTEL_STATUS_DESCRIPTION, "division by zero");

        SpanAttributes parsed = SpanAttributes.parse("s3", attrs);

        assertEquals(SpanType.TOOL_EXECUTION, parsed.type());
        SpanDetails.ToolExecution tool = assertInstanceOf(SpanDetails.ToolExecution.class, parsed.details());
        assertEquals("calculator", tool.toolName());
        assertEquals("42", tool.output());
        assertEquals("calculator", parsed.toolName().orElseThrow());
        assertTrue(parsed.isError());
        assertEquals("division by zero", parsed.errorDescription().orElseThrow());
    }

    @Test
    void shouldParseLlmInferenceWithUsage() {
        Map<String, Object> attrs = Map.of(
            AttributeKeys.SPAN_TYPE, "llm_inference",
            AttributeKeys.LLM_NEW_CONTENT, "42",
            AttributeKeys.LLM_THOUGHT, "multiply",
            AttributeKeys.USAGE, Map.of("prompt_tokens", 10, "completion_tokens", 5)
        );

        SpanAttributes parsed = SpanAttributes.parse("s2", attrs);

        SpanDetails.LlmInference inference = assertInstanceOf(SpanDetails.LlmInference.class, parsed.details());
        assertEquals("multiply", inference.thought());
        assertEquals("42", parsed.delta().orElseThrow());
        assertEquals(new TokenUsage(10, 5, 15), parsed.usage().orElseThrow());
        assertFalse(parsed.isError());
    }

    @Test
    void shouldKeepUnknownKeysAsExtensions() {
        SpanAttributes parsed = SpanAttributes.parse("s1", Map.of("custom.flag", true, "note", "x"));

        assertNull(parsed.type());
        assertInstanceOf(SpanDetails.Unclassified.class, parsed.details());
        assertEquals(Map.of("custom.flag", true, "note", "x"), parsed.extensions());
    }

    @Test
    void shouldRejectUnknownSpanTypeNamingTheSpan() {
        ValidationException error = assertThrows(ValidationException.class,
            () -> SpanAttributes.parse("bad-span", Map.of(AttributeKeys.SPAN_TYPE, "planner")));

        assertEquals("bad-span", error.getSpanId());
    }

    @Test
    void shouldRejectNonStringDelta() {
        ValidationException error = assertThrows(ValidationException.class,
            () -> SpanAttributes.parse("s9", Map.of(AttributeKeys.LLM_NEW_CONTENT, List.of("a"))));

        assertEquals("s9", error.getSpanId());
    }

    @Test
    void shouldRejectNegativeOrFractionalTokenCounts() {
        assertThrows(ValidationException.class, () -> SpanAttributes.parse("s",
            Map.of(AttributeKeys.USAGE, Map.of("prompt_tokens", -1))));
        assertThrows(ValidationException.class, () -> SpanAttributes.parse("s",
            Map.of(AttributeKeys.USAGE, Map.of("completion_tokens", 1.5))));
        assertThrows(ValidationException.class, () -> SpanAttributes.parse("s",
            Map.of(AttributeKeys.USAGE, "many")));
    }
}
