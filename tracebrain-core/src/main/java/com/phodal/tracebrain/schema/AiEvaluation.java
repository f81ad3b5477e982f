package com.phodal.tracebrain.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phodal.tracebrain.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Judgment attached to a trace under {@link AttributeKeys#AI_EVALUATION}.
 * Produced asynchronously, so most traces start without one.
 *
 * @param rating 1..5, may be absent
 * @param confidence confidence of the judge in [0, 1]
 * @param status whether a human still needs to look at the trace
 * @param feedback free-text explanation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AiEvaluation(
    Integer rating,
    double confidence,
    EvaluationStatus status,
    String feedback
) {

    public AiEvaluation {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Evaluation confidence must be within [0, 1], got " + confidence);
        }
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new ValidationException("Evaluation rating must be within 1..5, got " + rating);
        }
    }

    /**
     * Read an evaluation block from its attribute form.
     */
    public static AiEvaluation fromAttribute(Object value) {
        Map<String, Object> map = AttributeValues.object(value, AttributeKeys.AI_EVALUATION, null);
        if (map == null) {
            return null;
        }
        Double confidence = AttributeValues.decimal(map.get("confidence"), "confidence", null);
        if (confidence == null) {
            throw new ValidationException("Evaluation block requires 'confidence'");
        }
        Long rating = AttributeValues.wholeNumber(map.get("rating"), "rating", null);
        EvaluationStatus status = null;
        Object rawStatus = map.get("status");
        if (rawStatus != null) {
            status = EvaluationStatus.find(String.valueOf(rawStatus))
                .orElseThrow(() -> new ValidationException("Unknown evaluation status: " + rawStatus));
        }
        Object feedback = map.get("feedback");
        return new AiEvaluation(
            rating != null ? rating.intValue() : null,
            confidence,
            status,
            feedback != null ? String.valueOf(feedback) : null
        );
    }

    public Map<String, Object> toAttribute() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (rating != null) {
            map.put("rating", rating);
        }
        map.put("confidence", confidence);
        if (status != null) {
            map.put("status", status.getValue());
        }
        if (feedback != null) {
            map.put("feedback", feedback);
        }
        return map;
    }
}
