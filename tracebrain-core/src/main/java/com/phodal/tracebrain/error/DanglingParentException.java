package com.phodal.tracebrain.error;

public class DanglingParentException extends ValidationException {

    private final String parentId;

    public DanglingParentException(String spanId, String parentId) {
        super(ErrorCode.DANGLING_PARENT,
                "Span '" + spanId + "' references unknown parent '" + parentId + "'", spanId);
        this.parentId = parentId;
    }

    public String getParentId() {
        return parentId;
    }
}
