package com.phodal.tracebrain.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.schema.ErrorType;
import com.phodal.tracebrain.schema.TraceStatus;
import com.phodal.tracebrain.store.TraceFilter;
import com.phodal.tracebrain.util.TraceJson;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Reads a model answer into a {@link StructuredQuery}.
 *
 * <p>Markdown code fences and text around the outermost JSON object are ignored. Inside the
 * object nothing is coerced: unknown keys, wrong JSON types, unknown enum values, out-of-range
 * numbers and bad timestamps are all rejected with a {@link ValidationException}.
 * A JSON {@code null} counts as an absent key.</p>
 */
public class StructuredQueryParser {

    private static final Set<String> QUERY_KEYS = Set.of("action", "filter", "trace_id", "episode_id", "limit");
    private static final Set<String> FILTER_KEYS = Set.of(
        "status", "error_type", "min_rating", "min_confidence", "max_confidence", "start_time", "end_time",
        "prompt_contains");

    private final ObjectMapper objectMapper;

    public StructuredQueryParser() {
        this(TraceJson.createObjectMapper());
    }

    public StructuredQueryParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StructuredQuery parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Empty model answer");
        }
        JsonNode root = readObject(TraceJson.extractObject(raw));

        checkKeys(root, QUERY_KEYS, "query");
        String actionValue = text(root, "action");
        if (actionValue == null) {
            throw new ValidationException("'action' is required");
        }
        QueryAction action = QueryAction.find(actionValue)
            .orElseThrow(() -> new ValidationException("Unknown action '" + actionValue + "'"));

        TraceFilter filter = null;
        JsonNode filterNode = present(root, "filter");
        if (filterNode != null) {
            if (!filterNode.isObject()) {
                throw new ValidationException("'filter' must be an object");
            }
            filter = parseFilter(filterNode);
        }

        Long limit = wholeNumber(root, "limit");
        if (limit != null && (limit < 1 || limit > StructuredQuery.MAX_LIMIT)) {
            throw new ValidationException("'limit' must be within 1.." + StructuredQuery.MAX_LIMIT);
        }

        return new StructuredQuery(action, filter, text(root, "trace_id"), text(root, "episode_id"),
            limit != null ? limit.intValue() : null);
    }

    private TraceFilter parseFilter(JsonNode node) {
        checkKeys(node, FILTER_KEYS, "filter");
        TraceFilter.Builder builder = TraceFilter.builder();

        String status = text(node, "status");
        if (status != null) {
            builder.status(TraceStatus.find(status)
                .filter(found -> found.getValue().equals(status))
                .orElseThrow(() -> new ValidationException("Unknown status '" + status + "'")));
        }
        String errorType = text(node, "error_type");
        if (errorType != null) {
            builder.errorType(ErrorType.find(errorType)
                .filter(found -> found.getValue().equals(errorType))
                .orElseThrow(() -> new ValidationException("Unknown error_type '" + errorType + "'")));
        }
        Long minRating = wholeNumber(node, "min_rating");
        if (minRating != null) {
            if (minRating < 1 || minRating > 5) {
                throw new ValidationException("'min_rating' must be within 1..5");
            }
            builder.minRating(minRating.intValue());
        }
        builder.minConfidence(decimal(node, "min_confidence"));
        builder.maxConfidence(decimal(node, "max_confidence"));
        builder.startTime(instant(node, "start_time"));
        builder.endTime(instant(node, "end_time"));
        builder.promptContains(text(node, "prompt_contains"));
        return builder.build();
    }

    private JsonNode readObject(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new ValidationException("Model answer is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Model answer is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static void checkKeys(JsonNode node, Set<String> allowed, String where) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            String key = fields.next().getKey();
            if (!allowed.contains(key)) {
                throw new ValidationException("Unknown key '" + key + "' in " + where);
            }
        }
    }

    private static JsonNode present(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ValidationException("'" + field + "' must be a string");
        }
        return value.asText();
    }

    private static Long wholeNumber(JsonNode node, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ValidationException("'" + field + "' must be an integer");
        }
        return value.asLong();
    }

    private static Double decimal(JsonNode node, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isNumber()) {
            throw new ValidationException("'" + field + "' must be a number");
        }
        double number = value.asDouble();
        if (number < 0.0 || number > 1.0) {
            throw new ValidationException("'" + field + "' must be within [0, 1]");
        }
        return number;
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("'" + field + "' is not an ISO-8601 instant: " + value);
        }
    }
}
