package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class LlmDriftReport {
    WindowDescriptor baselineWindow;
    WindowDescriptor monitorWindow;
    double baselineAvgTokens;
    double monitorAvgTokens;
    double changePercentage;
    double threshold;
    boolean driftDetected;
    int affectedRows;
    String narrative;
}
