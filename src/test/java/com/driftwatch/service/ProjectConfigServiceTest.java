package com.driftwatch.service;

import com.driftwatch.config.DriftProperties;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.TaskType;
import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.dto.ProjectConfigRequest;
import com.driftwatch.dto.ProjectConfigResponse;
import com.driftwatch.entity.ProjectMonitoringConfig;
import com.driftwatch.exception.UnsupportedTaskTypeException;
import com.driftwatch.repository.ProjectMonitoringConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectConfigServiceTest {

    @Mock ProjectMonitoringConfigRepository repository;

    private final DriftProperties properties = new DriftProperties();
    private ProjectConfigService service;

    @BeforeEach
    void setUp() {
        service = new ProjectConfigService(repository, properties);
    }

    @Test
    void resolve_storedOverrides_winOverDefaults() {
        when(repository.findById(3L)).thenReturn(Optional.of(ProjectMonitoringConfig.builder()
            .projectId(3L)
            .baselineBatchSize(200)
            .monitorBatchSize(80)
            .windowPolicy(WindowPolicyType.ANCHORED)
            .taskType(TaskType.CLASSIFICATION)
            .meanThreshold(0.3)
            .alertThreshold(1)
            .build()));

        MonitoringConfig config = service.resolve(3L).orElseThrow();

        assertThat(config.getBaselineBatchSize()).isEqualTo(200);
        assertThat(config.getWindowPolicy()).isEqualTo(WindowPolicyType.ANCHORED);
        assertThat(config.getThresholds().getMeanThreshold()).isEqualTo(0.3);
        assertThat(config.getThresholds().getAlertThreshold()).isEqualTo(1);
        assertThat(config.getThresholds().getVarianceThreshold()).isEqualTo(0.20);
        assertThat(config.getLlmBaselineBatchSize()).isEqualTo(1000);
        assertThat(config.getTokenDriftThreshold()).isEqualTo(0.15);
    }

    @Test
    void resolve_missing_createsDefaults() {
        when(repository.findById(4L)).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        MonitoringConfig config = service.resolve(4L).orElseThrow();

        assertThat(config.getBaselineBatchSize()).isEqualTo(1000);
        assertThat(config.getMonitorBatchSize()).isEqualTo(500);
        assertThat(config.getWindowPolicy()).isEqualTo(WindowPolicyType.SLIDING);
        assertThat(config.getTaskType()).isEqualTo(TaskType.REGRESSION);
    }

    @Test
    void resolve_concurrentDefault_isReRead() {
        ProjectMonitoringConfig winner = ProjectMonitoringConfig.builder()
            .projectId(5L).baselineBatchSize(300).monitorBatchSize(100)
            .windowPolicy(WindowPolicyType.SLIDING).taskType(TaskType.REGRESSION).build();
        when(repository.findById(5L)).thenReturn(Optional.empty(), Optional.of(winner));
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("pk"));

        assertThat(service.resolve(5L).orElseThrow().getBaselineBatchSize()).isEqualTo(300);
    }

    @Test
    void resolve_defaultsDisabled_isNotReady() {
        properties.getWindows().setCreateDefaults(false);
        when(repository.findById(6L)).thenReturn(Optional.empty());

        assertThat(service.resolve(6L)).isEmpty();
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void update_appliesOnlyGivenFields() {
        when(repository.findById(7L)).thenReturn(Optional.empty());
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ProjectConfigResponse response = service.update(7L, ProjectConfigRequest.builder()
            .windowPolicy(WindowPolicyType.ANCHORED)
            .tokenDriftThreshold(0.3)
            .build());

        assertThat(response.getWindowPolicy()).isEqualTo(WindowPolicyType.ANCHORED);
        assertThat(response.getBaselineBatchSize()).isEqualTo(1000);
    }

    @Test
    void update_unknownTaskType_isRejected() {
        when(repository.findById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.update(8L, ProjectConfigRequest.builder().taskType("ranking").build()))
            .isInstanceOf(UnsupportedTaskTypeException.class);
        verify(repository, never()).save(any());
    }
}
