package com.driftwatch.exception;

public class UnsupportedTaskTypeException extends DriftWatchException {
    public UnsupportedTaskTypeException(String taskType) {
        super("UNSUPPORTED_TASK_TYPE",
              "Unsupported task type '" + taskType + "'. Expected regression or classification.");
    }
}
