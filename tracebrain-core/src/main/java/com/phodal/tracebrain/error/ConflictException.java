package com.phodal.tracebrain.error;

/**
 * A span id was submitted again with different content.
 */
public class ConflictException extends TraceBrainException {

    private final String traceId;
    private final String spanId;

    public ConflictException(String traceId, String spanId) {
        super(ErrorCode.CONFLICT,
                "Span '" + spanId + "' already exists in trace '" + traceId + "' with different content");
        this.traceId = traceId;
        this.spanId = spanId;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getSpanId() {
        return spanId;
    }
}
