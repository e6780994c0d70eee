package com.driftwatch.domain;

public enum RecordKind {
    FEATURE,
    PREDICTION,
    LLM_INTERACTION
}
