package com.stepwise.model;

/**
 * Best-effort description of the change between two steps. Used for hint text only.
 */
public record StepOperation(OperationType operationType, boolean isValid, String description) {

    public static StepOperation of(OperationType operationType, boolean isValid) {
        return new StepOperation(operationType, isValid, operationType.description());
    }
}
