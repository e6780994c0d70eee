package com.driftwatch.exception;

public class NarrativeApiUnavailableException extends DriftWatchException {
    public NarrativeApiUnavailableException(Throwable cause) {
        super("NARRATIVE_API_UNAVAILABLE",
              "Narrative service is unavailable: " + cause.getMessage(), cause);
    }
}
