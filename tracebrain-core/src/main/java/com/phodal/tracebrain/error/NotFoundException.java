package com.phodal.tracebrain.error;

public class NotFoundException extends TraceBrainException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException trace(String traceId) {
        return new NotFoundException("Trace '" + traceId + "' not found");
    }

    public static NotFoundException episode(String episodeId) {
        return new NotFoundException("Episode '" + episodeId + "' not found");
    }

    public static NotFoundException span(String traceId, String spanId) {
        return new NotFoundException("Span '" + spanId + "' not found in trace '" + traceId + "'");
    }
}
