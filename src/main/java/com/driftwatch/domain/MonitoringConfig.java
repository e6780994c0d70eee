package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Effective monitoring configuration of one project: stored overrides merged over
 * the application defaults.
 */
@Value
@Builder(toBuilder = true)
public class MonitoringConfig {
    long projectId;
    int baselineBatchSize;
    int monitorBatchSize;
    WindowPolicyType windowPolicy;
    TaskType taskType;
    int llmBaselineBatchSize;
    int llmMonitorBatchSize;
    double tokenDriftThreshold;
    DriftThresholds thresholds;
    ModelDriftSettings modelSettings;
}
