package com.driftwatch.exception;

public class InvalidIngestionException extends DriftWatchException {
    public InvalidIngestionException(String message) {
        super("INVALID_INGESTION", message);
    }
}
