package com.phodal.tracebrain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.schema.AttributeKeys;
import com.phodal.tracebrain.schema.SpanAttributes;
import com.phodal.tracebrain.schema.SpanType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single unit of agent work: an inference call, a tool invocation or a user turn.
 *
 * @param spanId identifier, unique within its trace
 * @param parentId parent span in the same trace, {@code null} for a root
 * @param name human readable label
 * @param startTime start of the work
 * @param endTime end of the work, never before {@code startTime}
 * @param attributes open attribute bag, see {@link AttributeKeys}
 */
public record Span(
    @JsonProperty("span_id") String spanId,
    @JsonProperty("parent_id") String parentId,
    String name,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    Map<String, Object> attributes
) {

    public Span {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Typed view of the attributes. Stored spans always parse.
     */
    public SpanAttributes attributesView() {
        return SpanAttributes.parse(spanId, attributes);
    }

    public long durationMs() {
        if (startTime != null && endTime != null) {
            return endTime.toEpochMilli() - startTime.toEpochMilli();
        }
        return 0;
    }

    public static class Builder {
        private String spanId;
        private String parentId;
        private String name;
        private Instant startTime;
        private Instant endTime;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        /**
         * Set both timestamps to the same instant.
         */
        public Builder at(Instant instant) {
            this.startTime = instant;
            this.endTime = instant;
            return this;
        }

        public Builder type(SpanType type) {
            this.attributes.put(AttributeKeys.SPAN_TYPE, type.getValue());
            return this;
        }

        public Builder delta(String content) {
            this.attributes.put(AttributeKeys.LLM_NEW_CONTENT, content);
            return this;
        }

        public Builder tool(String toolName) {
            this.attributes.put(AttributeKeys.SPAN_TYPE, SpanType.TOOL_EXECUTION.getValue());
            this.attributes.put(AttributeKeys.TOOL_NAME, toolName);
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Span build() {
            return new Span(spanId, parentId, name, startTime, endTime, attributes);
        }
    }
}
