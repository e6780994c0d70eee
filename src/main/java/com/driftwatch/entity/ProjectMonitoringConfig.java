package com.driftwatch.entity;

import com.driftwatch.domain.TaskType;
import com.driftwatch.domain.WindowPolicyType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Stored per-project monitoring settings. Null threshold columns fall back to the
 * application defaults.
 */
@Entity
@Table(name = "project_monitoring_configs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectMonitoringConfig {

    @Id
    @Column(name = "project_id")
    private Long projectId;

    @Column(name = "baseline_batch_size", nullable = false)
    private int baselineBatchSize;

    @Column(name = "monitor_batch_size", nullable = false)
    private int monitorBatchSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "window_policy", nullable = false, length = 16)
    private WindowPolicyType windowPolicy;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 16)
    private TaskType taskType;

    @Column(name = "llm_baseline_batch_size")
    private Integer llmBaselineBatchSize;

    @Column(name = "llm_monitor_batch_size")
    private Integer llmMonitorBatchSize;

    @Column(name = "mean_threshold")
    private Double meanThreshold;

    @Column(name = "median_threshold")
    private Double medianThreshold;

    @Column(name = "variance_threshold")
    private Double varianceThreshold;

    @Column(name = "ks_pvalue_threshold")
    private Double ksPValueThreshold;

    @Column(name = "ks_statistic_threshold")
    private Double ksStatisticThreshold;

    @Column(name = "psi_low_threshold")
    private Double psiLowThreshold;

    @Column(name = "psi_high_threshold")
    private Double psiHighThreshold;

    @Column(name = "min_samples")
    private Integer minSamples;

    @Column(name = "alert_threshold")
    private Integer alertThreshold;

    @Column(name = "model_alert_threshold")
    private Double modelAlertThreshold;

    @Column(name = "token_drift_threshold")
    private Double tokenDriftThreshold;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
