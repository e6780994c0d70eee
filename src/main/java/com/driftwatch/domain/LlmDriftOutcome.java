package com.driftwatch.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** Window state and the monitor windows evaluated by one LLM ingestion, in row order. */
@Value
@Builder
public class LlmDriftOutcome {
    boolean baselineReady;
    boolean monitorReady;
    @Singular List<LlmDriftReport> evaluations;

    public boolean isDriftDetected() {
        return evaluations.stream().anyMatch(LlmDriftReport::isDriftDetected);
    }
}
