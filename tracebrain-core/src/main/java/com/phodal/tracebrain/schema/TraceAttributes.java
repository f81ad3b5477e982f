package com.phodal.tracebrain.schema;

import com.phodal.tracebrain.error.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view over trace-level attributes: status, priority, error type, episode and evaluation.
 */
public final class TraceAttributes {

    private static final Set<String> KNOWN_KEYS = Set.of(
        AttributeKeys.SYSTEM_PROMPT,
        AttributeKeys.EPISODE_ID,
        AttributeKeys.TRACE_STATUS,
        AttributeKeys.TRACE_PRIORITY,
        AttributeKeys.TRACE_ERROR_TYPE,
        AttributeKeys.TRACE_SIGNAL_REASON,
        AttributeKeys.AI_EVALUATION
    );

    private final TraceStatus status;
    private final ErrorType errorType;
    private final Integer priority;
    private final String episodeId;
    private final String systemPrompt;
    private final String signalReason;
    private final AiEvaluation evaluation;
    private final Map<String, Object> extensions;

    private TraceAttributes(TraceStatus status, ErrorType errorType, Integer priority, String episodeId,
                            String systemPrompt, String signalReason, AiEvaluation evaluation,
                            Map<String, Object> extensions) {
        this.status = status;
        this.errorType = errorType;
        this.priority = priority;
        this.episodeId = episodeId;
        this.systemPrompt = systemPrompt;
        this.signalReason = signalReason;
        this.evaluation = evaluation;
        this.extensions = extensions;
    }

    public static TraceAttributes parse(Map<String, Object> attributes) {
        Map<String, Object> attrs = attributes != null ? attributes : Map.of();

        TraceStatus status = null;
        String rawStatus = AttributeValues.string(attrs, AttributeKeys.TRACE_STATUS, null);
        if (rawStatus != null) {
            status = TraceStatus.find(rawStatus)
                .orElseThrow(() -> new ValidationException("Unknown trace status '" + rawStatus + "'"));
        }

        ErrorType errorType = null;
        String rawErrorType = AttributeValues.string(attrs, AttributeKeys.TRACE_ERROR_TYPE, null);
        if (rawErrorType != null) {
            errorType = ErrorType.find(rawErrorType)
                .orElseThrow(() -> new ValidationException("Unknown error type '" + rawErrorType + "'"));
        }

        Long priority = AttributeValues.wholeNumber(attrs.get(AttributeKeys.TRACE_PRIORITY),
            AttributeKeys.TRACE_PRIORITY, null);
        if (priority != null && (priority < 1 || priority > 5)) {
            throw new ValidationException("Trace priority must be within 1..5, got " + priority);
        }

        Object episode = attrs.get(AttributeKeys.EPISODE_ID);

        Map<String, Object> extensions = new LinkedHashMap<>();
        attrs.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extensions.put(key, value);
            }
        });

        return new TraceAttributes(
            status,
            errorType,
            priority != null ? priority.intValue() : null,
            episode != null ? String.valueOf(episode) : null,
            AttributeValues.string(attrs, AttributeKeys.SYSTEM_PROMPT, null),
            AttributeValues.string(attrs, AttributeKeys.TRACE_SIGNAL_REASON, null),
            AiEvaluation.fromAttribute(attrs.get(AttributeKeys.AI_EVALUATION)),
            Collections.unmodifiableMap(extensions)
        );
    }

    public Optional<TraceStatus> status() {
        return Optional.ofNullable(status);
    }

    public Optional<ErrorType> errorType() {
        return Optional.ofNullable(errorType);
    }

    public Optional<Integer> priority() {
        return Optional.ofNullable(priority);
    }

    public Optional<String> episodeId() {
        return Optional.ofNullable(episodeId);
    }

    public Optional<String> systemPrompt() {
        return Optional.ofNullable(systemPrompt);
    }

    public Optional<String> signalReason() {
        return Optional.ofNullable(signalReason);
    }

    public Optional<AiEvaluation> evaluation() {
        return Optional.ofNullable(evaluation);
    }

    public Map<String, Object> extensions() {
        return extensions;
    }
}
