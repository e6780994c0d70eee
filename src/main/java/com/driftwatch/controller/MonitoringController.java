package com.driftwatch.controller;

import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowStatus;
import com.driftwatch.dto.FeatureBatchRequest;
import com.driftwatch.dto.IngestionResponse;
import com.driftwatch.dto.LlmInteractionBatchRequest;
import com.driftwatch.dto.PredictionBatchRequest;
import com.driftwatch.dto.ProjectConfigRequest;
import com.driftwatch.dto.ProjectConfigResponse;
import com.driftwatch.dto.WindowsResponse;
import com.driftwatch.service.DriftDetectionService;
import com.driftwatch.service.ProjectConfigService;
import com.driftwatch.service.window.WindowManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/projects/{projectId}")
@RequiredArgsConstructor
public class MonitoringController {

    private final DriftDetectionService detectionService;
    private final WindowManager windowManager;
    private final ProjectConfigService configService;

    @PostMapping("/features")
    public ResponseEntity<IngestionResponse> ingestFeatures(
            @PathVariable @Min(1) long projectId,
            @Valid @RequestBody FeatureBatchRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /projects/{}/features | rows={} | requestId={}", projectId, request.getRows().size(), requestId);
        IngestionResponse response = detectionService.ingestFeatures(
            projectId, request.getRows(), request.getBatchTimestamp());
        return ResponseEntity.status(HttpStatus.CREATED).header("X-Request-ID", requestId).body(response);
    }

    @PostMapping("/predictions")
    public ResponseEntity<IngestionResponse> ingestPredictions(
            @PathVariable @Min(1) long projectId,
            @Valid @RequestBody PredictionBatchRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /projects/{}/predictions | rows={} | requestId={}",
                 projectId, request.getPredictions().size(), requestId);
        IngestionResponse response = detectionService.ingestPredictions(
            projectId, request.getPredictions(), request.getBatchTimestamp());
        return ResponseEntity.status(HttpStatus.CREATED).header("X-Request-ID", requestId).body(response);
    }

    @PostMapping("/llm-interactions")
    public ResponseEntity<IngestionResponse> ingestLlmInteractions(
            @PathVariable @Min(1) long projectId,
            @Valid @RequestBody LlmInteractionBatchRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /projects/{}/llm-interactions | rows={} | requestId={}",
                 projectId, request.getInteractions().size(), requestId);
        IngestionResponse response = detectionService.ingestLlmInteractions(
            projectId, request.getInteractions(), request.getBatchTimestamp());
        return ResponseEntity.status(HttpStatus.CREATED).header("X-Request-ID", requestId).body(response);
    }

    @GetMapping("/windows")
    public ResponseEntity<WindowsResponse> windows(@PathVariable @Min(1) long projectId) {
        return ResponseEntity.ok(WindowsResponse.builder()
            .projectId(projectId)
            .featureBaseline(windowManager.getBaselineWindow(projectId, RecordKind.FEATURE).orElse(null))
            .featureMonitor(windowManager.getMonitorWindow(projectId, RecordKind.FEATURE).orElse(null))
            .predictionBaseline(windowManager.getBaselineWindow(projectId, RecordKind.PREDICTION).orElse(null))
            .predictionMonitor(windowManager.getMonitorWindow(projectId, RecordKind.PREDICTION).orElse(null))
            .llmBaseline(windowManager.getBaselineWindow(projectId, RecordKind.LLM_INTERACTION).orElse(null))
            .llmMonitor(windowManager.getMonitorWindow(projectId, RecordKind.LLM_INTERACTION).orElse(null))
            .build());
    }

    @PostMapping("/windows/recompute")
    public ResponseEntity<WindowStatus> recompute(@PathVariable @Min(1) long projectId) {
        log.info("POST /projects/{}/windows/recompute", projectId);
        return ResponseEntity.ok(windowManager.recomputeWindows(projectId));
    }

    @GetMapping("/config")
    public ResponseEntity<ProjectConfigResponse> config(@PathVariable @Min(1) long projectId) {
        return ResponseEntity.ok(configService.get(projectId));
    }

    @PutMapping("/config")
    public ResponseEntity<ProjectConfigResponse> updateConfig(
            @PathVariable @Min(1) long projectId, @Valid @RequestBody ProjectConfigRequest request) {
        log.info("PUT /projects/{}/config | policy={} | taskType={}",
                 projectId, request.getWindowPolicy(), request.getTaskType());
        return ResponseEntity.ok(configService.update(projectId, request));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
