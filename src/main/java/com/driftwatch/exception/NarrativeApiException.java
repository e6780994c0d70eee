package com.driftwatch.exception;

public class NarrativeApiException extends DriftWatchException {
    public NarrativeApiException(String message) {
        super("NARRATIVE_API_ERROR", message);
    }
}
