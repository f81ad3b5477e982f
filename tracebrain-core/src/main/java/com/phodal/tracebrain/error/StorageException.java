package com.phodal.tracebrain.error;

/**
 * The persistence backend failed to read or commit.
 */
public class StorageException extends TraceBrainException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE, message, cause);
    }
}
