package com.phodal.tracebrain.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token accounting stored under {@link AttributeKeys#USAGE}.
 *
 * @param promptTokens tokens sent to the model
 * @param completionTokens tokens produced by the model
 * @param totalTokens total, defaults to prompt + completion when not reported
 */
public record TokenUsage(
    @JsonProperty("prompt_tokens") long promptTokens,
    @JsonProperty("completion_tokens") long completionTokens,
    @JsonProperty("total_tokens") long totalTokens
) {

    public static TokenUsage of(long promptTokens, long completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }

    static TokenUsage parse(Object value, String spanId) {
        Map<String, Object> map = AttributeValues.object(value, AttributeKeys.USAGE, spanId);
        if (map == null) {
            return null;
        }
        long prompt = nonNegative(map.get("prompt_tokens"), "prompt_tokens", spanId);
        long completion = nonNegative(map.get("completion_tokens"), "completion_tokens", spanId);
        Long total = AttributeValues.wholeNumber(map.get("total_tokens"), "total_tokens", spanId);
        if (total != null && total < 0) {
            throw new ValidationException("'total_tokens' must not be negative", spanId);
        }
        return new TokenUsage(prompt, completion, total != null ? total : prompt + completion);
    }

    private static long nonNegative(Object raw, String field, String spanId) {
        Long value = AttributeValues.wholeNumber(raw, field, spanId);
        if (value == null) {
            return 0;
        }
        if (value < 0) {
            throw new ValidationException("'" + field + "' must not be negative", spanId);
        }
        return value;
    }

    public Map<String, Object> toAttribute() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("prompt_tokens", promptTokens);
        map.put("completion_tokens", completionTokens);
        map.put("total_tokens", totalTokens);
        return map;
    }
}
