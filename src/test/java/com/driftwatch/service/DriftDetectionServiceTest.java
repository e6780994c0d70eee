package com.driftwatch.service;

import com.driftwatch.config.DriftProperties;
import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.ModelDriftSettings;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.domain.WindowStatus;
import com.driftwatch.dto.IngestionResponse;
import com.driftwatch.exception.BatchSizeExceededException;
import com.driftwatch.service.window.WindowManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftDetectionServiceTest {

    @Mock RowLedgerService ledger;
    @Mock WindowManager windowManager;
    @Mock ProjectConfigService configService;
    @Mock StatisticalDriftDetector statisticalDetector;
    @Mock ModelBasedDriftDetector modelDetector;
    @Mock PredictionDriftMonitor predictionMonitor;
    @Mock LlmTokenDriftDetector llmDetector;
    @Mock DriftNarrativeService narrativeService;
    @Mock DriftReportService reportService;
    @Spy DriftProperties properties = new DriftProperties();
    @InjectMocks DriftDetectionService service;

    private final List<Map<String, FieldValue>> rows = List.of(
        Map.of("amount", FieldValue.of(1.0)), Map.of("amount", FieldValue.of(2.0)));

    private final MonitoringConfig config = MonitoringConfig.builder()
        .projectId(1L)
        .baselineBatchSize(100)
        .monitorBatchSize(50)
        .thresholds(DriftThresholds.defaults())
        .modelSettings(ModelDriftSettings.defaults())
        .build();

    @BeforeEach
    void setUp() {
        properties.setMaxBatchSize(5);
    }

    @Test
    void ingest_oversizedBatch_isRejectedBeforeStoring() {
        List<FieldValue> predictions = List.of(FieldValue.of(1), FieldValue.of(2), FieldValue.of(3),
            FieldValue.of(4), FieldValue.of(5), FieldValue.of(6));

        assertThatThrownBy(() -> service.ingestPredictions(1L, predictions, null))
            .isInstanceOf(BatchSizeExceededException.class)
            .hasMessageContaining("6");
        verifyNoInteractions(ledger);
    }

    @Test
    void ingest_detectionFailure_keepsIngestion() {
        when(ledger.appendFeatures(eq(1L), anyList(), isNull()))
            .thenReturn(new WindowRange(151, 152));
        when(configService.resolve(1L)).thenReturn(Optional.of(config));
        when(windowManager.recomputeWindows(1L, config)).thenReturn(new WindowStatus(true, true));
        when(windowManager.getBaselineData(1L)).thenThrow(new IllegalStateException("ledger unreadable"));

        IngestionResponse response = service.ingestFeatures(1L, rows, null);

        assertThat(response.getRowsIngested()).isEqualTo(2);
        assertThat(response.getFirstRowId()).isEqualTo(151);
        assertThat(response.isDriftEvaluated()).isFalse();
        assertThat(response.getOverallDrift()).isNull();
        verifyNoInteractions(reportService);
    }

    @Test
    void ingest_withoutConfig_onlyStoresRows() {
        when(ledger.appendFeatures(eq(1L), anyList(), isNull()))
            .thenReturn(new WindowRange(1, 2));
        when(configService.resolve(1L)).thenReturn(Optional.empty());

        IngestionResponse response = service.ingestFeatures(1L, rows, null);

        assertThat(response.isBaselineReady()).isFalse();
        verifyNoInteractions(windowManager);
    }

    @Test
    void ingest_baselineOnly_skipsDetection() {
        when(ledger.appendFeatures(eq(1L), anyList(), isNull()))
            .thenReturn(new WindowRange(99, 100));
        when(configService.resolve(1L)).thenReturn(Optional.of(config));
        when(windowManager.recomputeWindows(1L, config)).thenReturn(new WindowStatus(true, false));

        IngestionResponse response = service.ingestFeatures(1L, rows, null);

        assertThat(response.isBaselineReady()).isTrue();
        assertThat(response.isMonitorReady()).isFalse();
        verify(windowManager, never()).getBaselineData(anyLong());
        verifyNoInteractions(statisticalDetector, modelDetector);
    }
}
