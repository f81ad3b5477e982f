package com.phodal.tracebrain.error;

/**
 * A natural-language question could not be turned into a valid structured query.
 */
public class TranslationFailedException extends TraceBrainException {

    public TranslationFailedException(String message) {
        super(ErrorCode.TRANSLATION_FAILED, message);
    }

    public TranslationFailedException(String message, Throwable cause) {
        super(ErrorCode.TRANSLATION_FAILED, message, cause);
    }
}
