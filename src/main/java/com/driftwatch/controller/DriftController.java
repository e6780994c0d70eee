package com.driftwatch.controller;

import com.driftwatch.config.DriftProperties;
import com.driftwatch.domain.DriftReport;
import com.driftwatch.domain.DriftReportType;
import com.driftwatch.domain.ModelDriftReport;
import com.driftwatch.domain.PredictionDriftReport;
import com.driftwatch.dto.DriftReportResponse;
import com.driftwatch.dto.ModelDriftRequest;
import com.driftwatch.dto.PredictionDriftRequest;
import com.driftwatch.dto.StatisticalDriftRequest;
import com.driftwatch.service.DriftReportService;
import com.driftwatch.service.ModelBasedDriftDetector;
import com.driftwatch.service.PredictionDriftMonitor;
import com.driftwatch.service.StatisticalDriftDetector;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Report history per project and ad-hoc drift runs on caller-supplied rows. Ad-hoc
 * results are returned only, never stored.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DriftController {

    private final DriftReportService reportService;
    private final StatisticalDriftDetector statisticalDetector;
    private final ModelBasedDriftDetector modelDetector;
    private final PredictionDriftMonitor predictionMonitor;
    private final DriftProperties properties;

    @GetMapping("/projects/{projectId}/drift/features")
    public ResponseEntity<Page<DriftReportResponse>> featureHistory(
            @PathVariable @Min(1) long projectId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return history(projectId, DriftReportType.FEATURE_STATISTICAL, page, size);
    }

    @GetMapping("/projects/{projectId}/drift/model")
    public ResponseEntity<Page<DriftReportResponse>> modelHistory(
            @PathVariable @Min(1) long projectId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return history(projectId, DriftReportType.FEATURE_MODEL, page, size);
    }

    @GetMapping("/projects/{projectId}/drift/predictions")
    public ResponseEntity<Page<DriftReportResponse>> predictionHistory(
            @PathVariable @Min(1) long projectId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return history(projectId, DriftReportType.PREDICTION, page, size);
    }

    @GetMapping("/projects/{projectId}/drift/llm")
    public ResponseEntity<Page<DriftReportResponse>> llmHistory(
            @PathVariable @Min(1) long projectId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return history(projectId, DriftReportType.LLM_TOKEN, page, size);
    }

    @GetMapping("/drift/reports/{id}")
    public ResponseEntity<DriftReportResponse> report(@PathVariable UUID id) {
        return ResponseEntity.ok(reportService.get(id));
    }

    @PostMapping("/drift/statistical")
    public ResponseEntity<DriftReport> statistical(@Valid @RequestBody StatisticalDriftRequest request) {
        log.info("POST /drift/statistical | baseline={} | current={}",
                 request.getBaselineRows().size(), request.getCurrentRows().size());
        return ResponseEntity.ok(statisticalDetector.runStatisticalDrift(
            request.getBaselineRows(), request.getCurrentRows(),
            request.getThresholds() != null ? request.getThresholds() : properties.toThresholds()));
    }

    @PostMapping("/drift/model-based")
    public ResponseEntity<ModelDriftReport> modelBased(@Valid @RequestBody ModelDriftRequest request) {
        log.info("POST /drift/model-based | baseline={} | current={}",
                 request.getBaselineRows().size(), request.getCurrentRows().size());
        return modelDetector.runModelBasedDrift(
                request.getBaselineRows(), request.getCurrentRows(),
                request.getSettings() != null ? request.getSettings() : properties.toModelSettings())
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/drift/predictions")
    public ResponseEntity<PredictionDriftReport> predictions(@Valid @RequestBody PredictionDriftRequest request) {
        log.info("POST /drift/predictions | taskType={} | baseline={} | current={}",
                 request.getTaskType(), request.getBaseline().size(), request.getCurrent().size());
        return ResponseEntity.ok(predictionMonitor.runPredictionDrift(
            request.getBaseline(), request.getCurrent(), request.getTaskType(),
            request.getThresholds() != null ? request.getThresholds() : properties.toThresholds()));
    }

    private ResponseEntity<Page<DriftReportResponse>> history(long projectId, DriftReportType type,
                                                              int page, int size) {
        return ResponseEntity.ok(reportService.history(projectId, type, PageRequest.of(page, size)));
    }
}
