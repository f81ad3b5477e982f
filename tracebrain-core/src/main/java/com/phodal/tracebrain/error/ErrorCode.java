package com.phodal.tracebrain.error;

/**
 * Stable error codes surfaced by the engine.
 * The server maps each code onto a transport status.
 */
public enum ErrorCode {
    VALIDATION,
    DANGLING_PARENT,
    CYCLE_DETECTED,
    CONFLICT,
    NOT_FOUND,
    TRANSLATION_FAILED,
    PROVIDER_ERROR,
    DEADLINE_EXCEEDED,
    STORAGE
}
