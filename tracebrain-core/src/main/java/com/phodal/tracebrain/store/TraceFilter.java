package com.phodal.tracebrain.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.model.Feedback;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AiEvaluation;
import com.phodal.tracebrain.schema.ErrorType;
import com.phodal.tracebrain.schema.TraceAttributes;
import com.phodal.tracebrain.schema.TraceStatus;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Predicate over traces. Constraints combine with AND; a {@code null} field is no constraint.
 * A trace that lacks the attribute a constraint reads does not match that constraint.
 *
 * @param status trace status
 * @param errorType trace error classification
 * @param minRating lowest accepted rating of the latest human feedback
 * @param minConfidence lowest accepted AI evaluation confidence
 * @param maxConfidence highest accepted AI evaluation confidence
 * @param startTime earliest creation time, inclusive
 * @param endTime latest creation time, inclusive
 * @param promptContains case-insensitive substring of the trace's system prompt; blank means no constraint
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceFilter(
    TraceStatus status,
    @JsonProperty("error_type") ErrorType errorType,
    @JsonProperty("min_rating") Integer minRating,
    @JsonProperty("min_confidence") Double minConfidence,
    @JsonProperty("max_confidence") Double maxConfidence,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("prompt_contains") String promptContains
) {

    private static final TraceFilter NONE = new TraceFilter(null, null, null, null, null, null, null, null);

    public TraceFilter {
        if (promptContains != null && promptContains.isBlank()) {
            promptContains = null;
        }
        if (minRating != null && (minRating < 1 || minRating > 5)) {
            throw new ValidationException("min_rating must be within 1..5, got " + minRating);
        }
        checkConfidence("min_confidence", minConfidence);
        checkConfidence("max_confidence", maxConfidence);
        if (minConfidence != null && maxConfidence != null && minConfidence > maxConfidence) {
            throw new ValidationException("min_confidence must not exceed max_confidence");
        }
        if (startTime != null && endTime != null && startTime.isAfter(endTime)) {
            throw new ValidationException("start_time must not be after end_time");
        }
    }

    private static void checkConfidence(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new ValidationException(field + " must be within [0, 1], got " + value);
        }
    }

    public static TraceFilter none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return this.equals(NONE);
    }

    public boolean matches(Trace trace) {
        if (startTime != null && trace.createdAt().isBefore(startTime)) {
            return false;
        }
        if (endTime != null && trace.createdAt().isAfter(endTime)) {
            return false;
        }
        if (minRating != null) {
            Integer rating = trace.latestFeedback().map(Feedback::rating).orElse(null);
            if (rating == null || rating < minRating) {
                return false;
            }
        }
        if (status == null && errorType == null && minConfidence == null && maxConfidence == null
                && promptContains == null) {
            return true;
        }

        TraceAttributes attributes = trace.attributesView();
        if (status != null && attributes.status().filter(status::equals).isEmpty()) {
            return false;
        }
        if (errorType != null && attributes.errorType().filter(errorType::equals).isEmpty()) {
            return false;
        }
        if (minConfidence != null || maxConfidence != null) {
            Optional<AiEvaluation> evaluation = attributes.evaluation();
            if (evaluation.isEmpty()) {
                return false;
            }
            double confidence = evaluation.get().confidence();
            if (minConfidence != null && confidence < minConfidence) {
                return false;
            }
            if (maxConfidence != null && confidence > maxConfidence) {
                return false;
            }
        }
        if (promptContains != null) {
            String needle = promptContains.toLowerCase(Locale.ROOT);
            return attributes.systemPrompt()
                .map(prompt -> prompt.toLowerCase(Locale.ROOT).contains(needle))
                .orElse(false);
        }
        return true;
    }

    public static class Builder {
        private TraceStatus status;
        private ErrorType errorType;
        private Integer minRating;
        private Double minConfidence;
        private Double maxConfidence;
        private Instant startTime;
        private Instant endTime;
        private String promptContains;

        public Builder status(TraceStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorType(ErrorType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder minRating(Integer minRating) {
            this.minRating = minRating;
            return this;
        }

        public Builder minConfidence(Double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder maxConfidence(Double maxConfidence) {
            this.maxConfidence = maxConfidence;
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

        public Builder promptContains(String promptContains) {
            this.promptContains = promptContains;
            return this;
        }

        public TraceFilter build() {
            return new TraceFilter(status, errorType, minRating, minConfidence, maxConfidence, startTime, endTime,
                promptContains);
        }
    }
}
