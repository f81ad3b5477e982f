package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.schema.ErrorType;
import com.phodal.tracebrain.schema.TraceStatus;
import com.phodal.tracebrain.store.TraceFilter;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Builds a {@link TraceFilter} from query string values.
 * Enum values use their wire form ({@code needs_review}, {@code tool_error}).
 */
final class FilterParams {

    private FilterParams() {
    }

    static TraceFilter traceFilter(String status, String errorType, Integer minRating,
                                   Double minConfidence, Double maxConfidence,
                                   String startTime, String endTime, String promptContains) {
        return TraceFilter.builder()
                .status(status(status))
                .errorType(errorType(errorType))
                .minRating(minRating)
                .minConfidence(minConfidence)
                .maxConfidence(maxConfidence)
                .startTime(instant("start_time", startTime))
                .endTime(instant("end_time", endTime))
                .promptContains(promptContains)
                .build();
    }

    static TraceStatus status(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return TraceStatus.find(value)
                .orElseThrow(() -> new ValidationException("Unknown status: " + value));
    }

    static ErrorType errorType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ErrorType.find(value)
                .orElseThrow(() -> new ValidationException("Unknown error_type: " + value));
    }

    static Instant instant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(name + " must be an ISO-8601 instant, got '" + value + "'");
        }
    }
}
