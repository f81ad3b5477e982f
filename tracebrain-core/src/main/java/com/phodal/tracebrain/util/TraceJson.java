package com.phodal.tracebrain.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phodal.tracebrain.error.ValidationException;

/**
 * Shared Jackson configuration for persisted traces and model responses.
 */
public final class TraceJson {

    private TraceJson() {
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Cut the outermost JSON object out of a model answer, dropping markdown fences and prose around it.
     *
     * @throws ValidationException when the answer holds no object
     */
    public static String extractObject(String raw) {
        if (raw == null) {
            throw new ValidationException("Empty model answer");
        }
        String text = raw.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
            int closingFence = text.lastIndexOf("```");
            if (closingFence >= 0) {
                text = text.substring(0, closingFence);
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ValidationException("Model answer does not contain a JSON object");
        }
        return text.substring(start, end + 1);
    }
}
