package com.driftwatch.service;

import com.driftwatch.config.DriftProperties;
import com.driftwatch.domain.DriftReport;
import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.LlmDriftOutcome;
import com.driftwatch.domain.ModelDriftReport;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.PredictionDriftReport;
import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.domain.WindowStatus;
import com.driftwatch.dto.IngestionResponse;
import com.driftwatch.dto.LlmInteractionRequest;
import com.driftwatch.exception.BatchSizeExceededException;
import com.driftwatch.service.window.WindowManager;
import com.driftwatch.service.window.WindowSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ingestion entry point. Rows are committed first; window recomputation and drift
 * detection follow synchronously. A detection failure is logged and does not undo
 * the ingestion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftDetectionService {

    private final RowLedgerService ledger;
    private final WindowManager windowManager;
    private final ProjectConfigService configService;
    private final StatisticalDriftDetector statisticalDetector;
    private final ModelBasedDriftDetector modelDetector;
    private final PredictionDriftMonitor predictionMonitor;
    private final LlmTokenDriftDetector llmDetector;
    private final DriftNarrativeService narrativeService;
    private final DriftReportService reportService;
    private final DriftProperties properties;

    public IngestionResponse ingestFeatures(long projectId, List<Map<String, FieldValue>> rows, Instant batchTimestamp) {
        checkBatchSize(rows.size());
        WindowRange appended = ledger.appendFeatures(projectId, rows, batchTimestamp);
        IngestionResponse.IngestionResponseBuilder response = response(projectId, RecordKind.FEATURE, appended);

        Optional<MonitoringConfig> config = configService.resolve(projectId);
        if (config.isEmpty()) {
            return response.build();
        }
        WindowStatus status = windowManager.recomputeWindows(projectId, config.get());
        response.baselineReady(status.baselineReady()).monitorReady(status.monitorReady());
        if (status.baselineReady() && status.monitorReady()) {
            detectFeatureDrift(projectId, config.get())
                .ifPresent(r -> response.driftEvaluated(true).overallDrift(r.isOverallDrift()));
        }
        return response.build();
    }

    public IngestionResponse ingestPredictions(long projectId, List<FieldValue> predictions, Instant batchTimestamp) {
        checkBatchSize(predictions.size());
        WindowRange appended = ledger.appendPredictions(projectId, predictions, batchTimestamp);
        IngestionResponse.IngestionResponseBuilder response = response(projectId, RecordKind.PREDICTION, appended);

        Optional<MonitoringConfig> config = configService.resolve(projectId);
        if (config.isEmpty()) {
            return response.build();
        }
        WindowStatus status = windowManager.recomputeWindows(projectId, config.get());
        response.baselineReady(status.baselineReady()).monitorReady(status.monitorReady());
        if (status.baselineReady() && status.monitorReady()) {
            detectPredictionDrift(projectId, config.get())
                .ifPresent(r -> response.driftEvaluated(true).overallDrift(r.isOverallDrift()));
        }
        return response.build();
    }

    public IngestionResponse ingestLlmInteractions(long projectId, List<LlmInteractionRequest> interactions,
                                                   Instant batchTimestamp) {
        checkBatchSize(interactions.size());
        WindowRange appended = ledger.appendInteractions(projectId, interactions, batchTimestamp);
        IngestionResponse.IngestionResponseBuilder response = response(projectId, RecordKind.LLM_INTERACTION, appended);

        Optional<MonitoringConfig> config = configService.resolve(projectId);
        if (config.isEmpty()) {
            return response.build();
        }
        try {
            LlmDriftOutcome outcome = llmDetector.processBoundaries(projectId, config.get());
            response.baselineReady(outcome.isBaselineReady()).monitorReady(outcome.isMonitorReady());
            if (!outcome.getEvaluations().isEmpty()) {
                response.driftEvaluated(true).overallDrift(outcome.isDriftDetected());
            }
        } catch (RuntimeException ex) {
            log.error("LLM drift detection abandoned | projectId={} | reason={}", projectId, ex.getMessage(), ex);
        }
        return response.build();
    }

    Optional<DriftReport> detectFeatureDrift(long projectId, MonitoringConfig config) {
        try {
            Optional<WindowSnapshot> baseline = windowManager.getBaselineData(projectId);
            Optional<WindowSnapshot> monitor = windowManager.getMonitorData(projectId);
            int minSamples = config.getThresholds().getMinSamples();
            if (baseline.isEmpty() || monitor.isEmpty()
                    || baseline.get().featureRows().size() < minSamples
                    || monitor.get().featureRows().size() < minSamples) {
                log.info("Feature drift skipped | projectId={} | baselineRows={} | monitorRows={} | minSamples={}",
                         projectId, baseline.map(s -> s.featureRows().size()).orElse(0),
                         monitor.map(s -> s.featureRows().size()).orElse(0), minSamples);
                return Optional.empty();
            }
            WindowSnapshot base = baseline.get();
            WindowSnapshot curr = monitor.get();

            DriftReport statistical = statisticalDetector.runStatisticalDrift(
                base.featureRows(), curr.featureRows(), config.getThresholds(),
                base.featureDescriptor(), curr.featureDescriptor());
            ModelDriftReport model = modelDetector.runModelBasedDrift(
                base.featureRows(), curr.featureRows(), config.getModelSettings(),
                base.featureDescriptor(), curr.featureDescriptor()).orElse(null);
            DriftReport narrated = statistical.toBuilder()
                .narrative(narrativeService.narrateFeatureDrift(statistical))
                .build();

            reportService.saveFeatureReports(projectId, narrated, model);
            return Optional.of(narrated);
        } catch (RuntimeException ex) {
            log.error("Feature drift detection abandoned | projectId={} | reason={}", projectId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    Optional<PredictionDriftReport> detectPredictionDrift(long projectId, MonitoringConfig config) {
        try {
            Optional<WindowSnapshot> baseline = windowManager.getBaselineData(projectId);
            Optional<WindowSnapshot> monitor = windowManager.getMonitorData(projectId);
            int minSamples = config.getThresholds().getMinSamples();
            if (baseline.isEmpty() || monitor.isEmpty()
                    || baseline.get().predictionRows().size() < minSamples
                    || monitor.get().predictionRows().size() < minSamples) {
                log.info("Prediction drift skipped | projectId={} | baselineRows={} | monitorRows={} | minSamples={}",
                         projectId, baseline.map(s -> s.predictionRows().size()).orElse(0),
                         monitor.map(s -> s.predictionRows().size()).orElse(0), minSamples);
                return Optional.empty();
            }
            WindowSnapshot base = baseline.get();
            WindowSnapshot curr = monitor.get();

            PredictionDriftReport report = predictionMonitor.runPredictionDrift(
                base.predictionRows(), curr.predictionRows(), config.getTaskType(), config.getThresholds(),
                base.predictionDescriptor(), curr.predictionDescriptor());
            PredictionDriftReport narrated = report.toBuilder()
                .narrative(narrativeService.narratePredictionDrift(report))
                .build();

            reportService.savePredictionReport(projectId, narrated);
            return Optional.of(narrated);
        } catch (RuntimeException ex) {
            log.error("Prediction drift detection abandoned | projectId={} | reason={}", projectId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    private void checkBatchSize(int size) {
        if (size > properties.getMaxBatchSize()) {
            throw new BatchSizeExceededException(size, properties.getMaxBatchSize());
        }
    }

    private static IngestionResponse.IngestionResponseBuilder response(long projectId, RecordKind kind,
                                                                       WindowRange appended) {
        return IngestionResponse.builder()
            .projectId(projectId)
            .kind(kind)
            .rowsIngested(appended.length())
            .firstRowId(appended.startRow())
            .lastRowId(appended.endRow())
            .driftEvaluated(false);
    }
}
