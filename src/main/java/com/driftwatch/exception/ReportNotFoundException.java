package com.driftwatch.exception;

import java.util.UUID;

public class ReportNotFoundException extends DriftWatchException {
    public ReportNotFoundException(UUID id) {
        super("REPORT_NOT_FOUND", "Drift report not found: " + id);
    }
}
