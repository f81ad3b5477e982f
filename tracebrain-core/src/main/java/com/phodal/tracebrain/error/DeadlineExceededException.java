package com.phodal.tracebrain.error;

public class DeadlineExceededException extends TraceBrainException {

    public DeadlineExceededException(String operation) {
        super(ErrorCode.DEADLINE_EXCEEDED, "Deadline exceeded during " + operation);
    }
}
