package com.phodal.tracebrain.error;

/**
 * Malformed payload, missing field, or a span forest that does not hold together.
 * Rejects the whole ingestion batch.
 */
public class ValidationException extends TraceBrainException {

    private final String spanId;

    public ValidationException(String message) {
        this(ErrorCode.VALIDATION, message, null);
    }

    public ValidationException(String message, String spanId) {
        this(ErrorCode.VALIDATION, message, spanId);
    }

    protected ValidationException(ErrorCode code, String message, String spanId) {
        super(code, message);
        this.spanId = spanId;
    }

    /**
     * The offending span, or {@code null} when the problem is not tied to one.
     */
    public String getSpanId() {
        return spanId;
    }
}
