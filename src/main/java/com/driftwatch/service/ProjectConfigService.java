package com.driftwatch.service;

import com.driftwatch.config.DriftProperties;
import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.ModelDriftSettings;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.dto.ProjectConfigRequest;
import com.driftwatch.dto.ProjectConfigResponse;
import com.driftwatch.entity.ProjectMonitoringConfig;
import com.driftwatch.repository.ProjectMonitoringConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves the effective monitoring configuration of a project. A project without a
 * stored row gets one with the application defaults, unless
 * {@code drift.windows.create-defaults} is off, in which case it is never ready.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectConfigService {

    private final ProjectMonitoringConfigRepository repository;
    private final DriftProperties properties;

    public Optional<MonitoringConfig> resolve(long projectId) {
        Optional<ProjectMonitoringConfig> stored = repository.findById(projectId);
        if (stored.isPresent()) {
            return stored.map(this::merge);
        }
        if (!properties.getWindows().isCreateDefaults()) {
            log.debug("No monitoring config | projectId={}", projectId);
            return Optional.empty();
        }
        return Optional.of(merge(createDefault(projectId)));
    }

    @Transactional(readOnly = true)
    public ProjectConfigResponse get(long projectId) {
        return repository.findById(projectId)
            .map(this::merge)
            .map(ProjectConfigResponse::from)
            .orElseGet(() -> ProjectConfigResponse.from(merge(defaults(projectId))));
    }

    @Transactional
    public ProjectConfigResponse update(long projectId, ProjectConfigRequest request) {
        ProjectMonitoringConfig config = repository.findById(projectId)
            .orElseGet(() -> defaults(projectId));
        request.applyTo(config);
        ProjectMonitoringConfig saved = repository.save(config);
        log.info("Monitoring config saved | projectId={} | policy={} | baseline={} | monitor={} | taskType={}",
                 projectId, saved.getWindowPolicy(), saved.getBaselineBatchSize(),
                 saved.getMonitorBatchSize(), saved.getTaskType());
        return ProjectConfigResponse.from(merge(saved));
    }

    private ProjectMonitoringConfig createDefault(long projectId) {
        try {
            ProjectMonitoringConfig saved = repository.saveAndFlush(defaults(projectId));
            log.info("Default monitoring config created | projectId={}", projectId);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            log.info("Monitoring config created concurrently, re-reading | projectId={}", projectId);
            return repository.findById(projectId).orElseThrow(() -> ex);
        }
    }

    private ProjectMonitoringConfig defaults(long projectId) {
        DriftProperties.Windows windows = properties.getWindows();
        return ProjectMonitoringConfig.builder()
            .projectId(projectId)
            .baselineBatchSize(windows.getBaselineBatchSize())
            .monitorBatchSize(windows.getMonitorBatchSize())
            .windowPolicy(windows.getPolicy())
            .taskType(properties.getPrediction().getTaskType())
            .build();
    }

    MonitoringConfig merge(ProjectMonitoringConfig stored) {
        DriftThresholds defaults = properties.toThresholds();
        DriftThresholds thresholds = defaults.toBuilder()
            .meanThreshold(orDefault(stored.getMeanThreshold(), defaults.getMeanThreshold()))
            .medianThreshold(orDefault(stored.getMedianThreshold(), defaults.getMedianThreshold()))
            .varianceThreshold(orDefault(stored.getVarianceThreshold(), defaults.getVarianceThreshold()))
            .ksPValueThreshold(orDefault(stored.getKsPValueThreshold(), defaults.getKsPValueThreshold()))
            .ksStatisticThreshold(orDefault(stored.getKsStatisticThreshold(), defaults.getKsStatisticThreshold()))
            .psiLowThreshold(orDefault(stored.getPsiLowThreshold(), defaults.getPsiLowThreshold()))
            .psiHighThreshold(orDefault(stored.getPsiHighThreshold(), defaults.getPsiHighThreshold()))
            .minSamples(stored.getMinSamples() != null ? stored.getMinSamples() : defaults.getMinSamples())
            .alertThreshold(stored.getAlertThreshold() != null ? stored.getAlertThreshold() : defaults.getAlertThreshold())
            .build();
        ModelDriftSettings model = properties.toModelSettings();
        if (stored.getModelAlertThreshold() != null) {
            model = model.toBuilder().alertThreshold(stored.getModelAlertThreshold()).build();
        }
        DriftProperties.Llm llm = properties.getLlm();
        return MonitoringConfig.builder()
            .projectId(stored.getProjectId())
            .baselineBatchSize(stored.getBaselineBatchSize())
            .monitorBatchSize(stored.getMonitorBatchSize())
            .windowPolicy(stored.getWindowPolicy())
            .taskType(stored.getTaskType())
            .llmBaselineBatchSize(stored.getLlmBaselineBatchSize() != null
                ? stored.getLlmBaselineBatchSize() : llm.getBaselineBatchSize())
            .llmMonitorBatchSize(stored.getLlmMonitorBatchSize() != null
                ? stored.getLlmMonitorBatchSize() : llm.getMonitorBatchSize())
            .tokenDriftThreshold(orDefault(stored.getTokenDriftThreshold(), llm.getTokenDriftThreshold()))
            .thresholds(thresholds)
            .modelSettings(model)
            .build();
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
