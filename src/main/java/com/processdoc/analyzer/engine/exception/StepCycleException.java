package com.processdoc.analyzer.engine.exception;

import java.util.List;

/**
 * Parent references among the given steps form a loop, so no root can reach them.
 */
public class StepCycleException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> stepIds;

    public StepCycleException(List<String> stepIds) {
        super("Parent references form a cycle between steps " + String.join(", ", stepIds));
        this.stepIds = List.copyOf(stepIds);
    }

    public List<String> getStepIds() {
        return stepIds;
    }
}
