package com.driftwatch.dto;

import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.ModelDriftSettings;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.TaskType;
import com.driftwatch.domain.WindowPolicyType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProjectConfigResponse {
    long               projectId;
    int                baselineBatchSize;
    int                monitorBatchSize;
    WindowPolicyType   windowPolicy;
    TaskType           taskType;
    int                llmBaselineBatchSize;
    int                llmMonitorBatchSize;
    double             tokenDriftThreshold;
    DriftThresholds    thresholds;
    ModelDriftSettings modelSettings;

    public static ProjectConfigResponse from(MonitoringConfig config) {
        return ProjectConfigResponse.builder()
            .projectId(config.getProjectId())
            .baselineBatchSize(config.getBaselineBatchSize())
            .monitorBatchSize(config.getMonitorBatchSize())
            .windowPolicy(config.getWindowPolicy())
            .taskType(config.getTaskType())
            .llmBaselineBatchSize(config.getLlmBaselineBatchSize())
            .llmMonitorBatchSize(config.getLlmMonitorBatchSize())
            .tokenDriftThreshold(config.getTokenDriftThreshold())
            .thresholds(config.getThresholds())
            .modelSettings(config.getModelSettings())
            .build();
    }
}
