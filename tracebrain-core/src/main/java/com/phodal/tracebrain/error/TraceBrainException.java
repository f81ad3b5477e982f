package com.phodal.tracebrain.error;

/**
 * Base type of every error raised by the TraceBrain engine.
 */
public class TraceBrainException extends RuntimeException {

    private final ErrorCode code;

    public TraceBrainException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TraceBrainException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
