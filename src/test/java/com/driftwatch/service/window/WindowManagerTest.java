package com.driftwatch.service.window;

import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.domain.WindowStatus;
import com.driftwatch.entity.BaselineWindow;
import com.driftwatch.entity.MonitorWindow;
import com.driftwatch.exception.BaselineConflictException;
import com.driftwatch.repository.BaselineWindowRepository;
import com.driftwatch.repository.MonitorWindowRepository;
import com.driftwatch.service.LlmWindowManager;
import com.driftwatch.service.ProjectConfigService;
import com.driftwatch.service.RowLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WindowManagerTest {

    private static final long PROJECT = 42L;

    @Mock private ProjectConfigService configService;
    @Mock private RowLedgerService ledger;
    @Mock private BaselineWindowRepository baselineRepository;
    @Mock private MonitorWindowRepository monitorRepository;
    @Mock private BaselineStore baselineStore;
    @Mock private LlmWindowManager llmWindowManager;
    @Mock private PlatformTransactionManager transactionManager;

    private WindowManager windowManager;

    private final MonitoringConfig config = MonitoringConfig.builder()
        .projectId(PROJECT)
        .baselineBatchSize(1000)
        .monitorBatchSize(500)
        .windowPolicy(WindowPolicyType.ANCHORED)
        .build();

    @BeforeEach
    void setUp() {
        windowManager = new WindowManager(configService, ledger, baselineRepository, monitorRepository,
            baselineStore, new ProjectLocks(), llmWindowManager,
            List.of(new AnchoredWindowPolicy(), new SlidingWindowPolicy()), transactionManager);
    }

    @Test
    void firstFullBatch_createsBaselineAndMonitor() {
        latest(1200, 0);
        BaselineWindow stored = baseline(1, 1000);
        when(baselineRepository.findByProjectId(PROJECT)).thenReturn(Optional.empty(), Optional.of(stored));
        when(monitorRepository.findByProjectId(PROJECT)).thenReturn(Optional.empty());
        when(monitorRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        WindowStatus status = windowManager.recomputeWindows(PROJECT, config);

        assertThat(status).isEqualTo(new WindowStatus(true, true));
        ArgumentCaptor<BaselineWindow> inserted = ArgumentCaptor.forClass(BaselineWindow.class);
        verify(baselineStore).insert(inserted.capture());
        assertThat(inserted.getValue().range(RecordKind.FEATURE)).contains(new WindowRange(1, 1000));
        assertThat(inserted.getValue().range(RecordKind.PREDICTION)).isEmpty();

        ArgumentCaptor<MonitorWindow> monitor = ArgumentCaptor.forClass(MonitorWindow.class);
        verify(monitorRepository).save(monitor.capture());
        assertThat(monitor.getValue().range(RecordKind.FEATURE)).contains(new WindowRange(1001, 1500));
    }

    @Test
    void tooFewRows_notReadyAndNothingStored() {
        latest(999, 10);
        when(baselineRepository.findByProjectId(PROJECT)).thenReturn(Optional.empty());

        WindowStatus status = windowManager.recomputeWindows(PROJECT, config);

        assertThat(status).isEqualTo(WindowStatus.NOT_READY);
        verifyNoInteractions(baselineStore, monitorRepository);
    }

    @Test
    void concurrentCreation_isResolvedByReRead() {
        latest(1000, 0);
        BaselineWindow winner = baseline(1, 1000);
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(Optional.empty(), Optional.of(winner), Optional.of(winner));
        when(baselineStore.insert(any(BaselineWindow.class)))
            .thenThrow(new DataIntegrityViolationException("uk_baseline_project"));
        when(monitorRepository.findByProjectId(PROJECT)).thenReturn(Optional.empty());
        when(monitorRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        WindowStatus status = windowManager.recomputeWindows(PROJECT, config);

        assertThat(status.baselineReady()).isTrue();
        verify(baselineRepository).save(winner);
    }

    @Test
    void concurrentCreation_withoutWinner_escalates() {
        latest(1000, 0);
        when(baselineRepository.findByProjectId(PROJECT)).thenReturn(Optional.empty());
        when(baselineStore.insert(any(BaselineWindow.class)))
            .thenThrow(new DataIntegrityViolationException("uk_baseline_project"));

        assertThatThrownBy(() -> windowManager.recomputeWindows(PROJECT, config))
            .isInstanceOf(BaselineConflictException.class)
            .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void existingBaseline_growsAndResetsMonitor() {
        latest(2000, 0);
        BaselineWindow stored = baseline(1, 1000);
        MonitorWindow monitor = MonitorWindow.forProject(PROJECT);
        monitor.assign(RecordKind.FEATURE, Optional.of(new WindowRange(1001, 1500)));
        when(baselineRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(stored));
        when(monitorRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(monitor));
        when(monitorRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        windowManager.recomputeWindows(PROJECT, config);

        assertThat(stored.range(RecordKind.FEATURE)).contains(new WindowRange(1, 2000));
        assertThat(monitor.range(RecordKind.FEATURE)).contains(new WindowRange(2001, 2500));
        verifyNoInteractions(baselineStore);
    }

    @Test
    void missingConfig_isNotReady() {
        when(configService.resolve(PROJECT)).thenReturn(Optional.empty());

        assertThat(windowManager.recomputeWindows(PROJECT)).isEqualTo(WindowStatus.NOT_READY);
        verifyNoInteractions(ledger);
    }

    @Test
    void llmWindows_areDelegated() {
        when(llmWindowManager.baselineRange(PROJECT)).thenReturn(Optional.of(new WindowRange(1, 10)));

        assertThat(windowManager.getBaselineWindow(PROJECT, RecordKind.LLM_INTERACTION))
            .contains(new WindowRange(1, 10));
        verifyNoInteractions(baselineRepository);
    }

    private void latest(long features, long predictions) {
        when(ledger.latestRowId(PROJECT, RecordKind.FEATURE)).thenReturn(features);
        when(ledger.latestRowId(PROJECT, RecordKind.PREDICTION)).thenReturn(predictions);
    }

    private static BaselineWindow baseline(long start, long end) {
        BaselineWindow window = BaselineWindow.forProject(PROJECT);
        window.assign(RecordKind.FEATURE, Optional.of(new WindowRange(start, end)));
        return window;
    }
}
