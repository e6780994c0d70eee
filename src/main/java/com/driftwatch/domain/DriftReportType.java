package com.driftwatch.domain;

public enum DriftReportType {
    FEATURE_STATISTICAL,
    FEATURE_MODEL,
    PREDICTION,
    LLM_TOKEN
}
