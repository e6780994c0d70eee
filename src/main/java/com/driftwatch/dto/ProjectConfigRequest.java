package com.driftwatch.dto;

import com.driftwatch.domain.TaskType;
import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.entity.ProjectMonitoringConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Partial update of a project's monitoring config. Null fields keep their stored value.
 */
@Value
@Builder
@Jacksonized
public class ProjectConfigRequest {

    @Min(value = 2, message = "baselineBatchSize must be >= 2")
    Integer baselineBatchSize;

    @Min(value = 2, message = "monitorBatchSize must be >= 2")
    Integer monitorBatchSize;

    WindowPolicyType windowPolicy;

    String taskType;

    @Min(value = 1, message = "llmBaselineBatchSize must be >= 1")
    Integer llmBaselineBatchSize;

    @Min(value = 1, message = "llmMonitorBatchSize must be >= 1")
    Integer llmMonitorBatchSize;

    @DecimalMin(value = "0.0", message = "meanThreshold must be >= 0")
    Double meanThreshold;

    @DecimalMin(value = "0.0", message = "medianThreshold must be >= 0")
    Double medianThreshold;

    @DecimalMin(value = "0.0", message = "varianceThreshold must be >= 0")
    Double varianceThreshold;

    @DecimalMin(value = "0.0", message = "ksPValueThreshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "ksPValueThreshold must be between 0 and 1")
    Double ksPValueThreshold;

    @DecimalMin(value = "0.0", message = "ksStatisticThreshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "ksStatisticThreshold must be between 0 and 1")
    Double ksStatisticThreshold;

    @DecimalMin(value = "0.0", message = "psiLowThreshold must be >= 0")
    Double psiLowThreshold;

    @DecimalMin(value = "0.0", message = "psiHighThreshold must be >= 0")
    Double psiHighThreshold;

    @Min(value = 2, message = "minSamples must be >= 2")
    Integer minSamples;

    @Min(value = 1, message = "alertThreshold must be >= 1")
    Integer alertThreshold;

    @DecimalMin(value = "0.0", message = "modelAlertThreshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "modelAlertThreshold must be between 0 and 1")
    Double modelAlertThreshold;

    @DecimalMin(value = "0.0", message = "tokenDriftThreshold must be >= 0")
    Double tokenDriftThreshold;

    public void applyTo(ProjectMonitoringConfig config) {
        if (baselineBatchSize != null) config.setBaselineBatchSize(baselineBatchSize);
        if (monitorBatchSize != null) config.setMonitorBatchSize(monitorBatchSize);
        if (windowPolicy != null) config.setWindowPolicy(windowPolicy);
        if (taskType != null) config.setTaskType(TaskType.parse(taskType));
        if (llmBaselineBatchSize != null) config.setLlmBaselineBatchSize(llmBaselineBatchSize);
        if (llmMonitorBatchSize != null) config.setLlmMonitorBatchSize(llmMonitorBatchSize);
        if (meanThreshold != null) config.setMeanThreshold(meanThreshold);
        if (medianThreshold != null) config.setMedianThreshold(medianThreshold);
        if (varianceThreshold != null) config.setVarianceThreshold(varianceThreshold);
        if (ksPValueThreshold != null) config.setKsPValueThreshold(ksPValueThreshold);
        if (ksStatisticThreshold != null) config.setKsStatisticThreshold(ksStatisticThreshold);
        if (psiLowThreshold != null) config.setPsiLowThreshold(psiLowThreshold);
        if (psiHighThreshold != null) config.setPsiHighThreshold(psiHighThreshold);
        if (minSamples != null) config.setMinSamples(minSamples);
        if (alertThreshold != null) config.setAlertThreshold(alertThreshold);
        if (modelAlertThreshold != null) config.setModelAlertThreshold(modelAlertThreshold);
        if (tokenDriftThreshold != null) config.setTokenDriftThreshold(tokenDriftThreshold);
    }
}
