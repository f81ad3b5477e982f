package com.phodal.tracebrain.error;

import java.util.List;

public class CycleDetectedException extends ValidationException {

    private final List<String> cycle;

    public CycleDetectedException(String spanId, List<String> cycle) {
        super(ErrorCode.CYCLE_DETECTED,
                "Parent chain of span '" + spanId + "' forms a cycle: " + String.join(" -> ", cycle), spanId);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
