package com.driftwatch.exception;

public class BaselineConflictException extends DriftWatchException {
    public BaselineConflictException(long projectId, Throwable cause) {
        super("BASELINE_CONFLICT",
              "Baseline for project " + projectId + " was created concurrently but could not be re-read.",
              cause);
    }
}
