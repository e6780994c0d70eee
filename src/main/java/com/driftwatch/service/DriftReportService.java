package com.driftwatch.service;

import com.driftwatch.domain.DriftReport;
import com.driftwatch.domain.DriftReportType;
import com.driftwatch.domain.LlmDriftReport;
import com.driftwatch.domain.ModelDriftReport;
import com.driftwatch.domain.PredictionDriftReport;
import com.driftwatch.domain.WindowDescriptor;
import com.driftwatch.dto.DriftReportResponse;
import com.driftwatch.entity.DriftReportRecord;
import com.driftwatch.exception.ReportNotFoundException;
import com.driftwatch.repository.DriftReportRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only report history. Reports of one detection run are saved together or
 * not at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftReportService {

    private final DriftReportRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional
    public List<DriftReportRecord> saveFeatureReports(long projectId, DriftReport statistical, ModelDriftReport model) {
        List<DriftReportRecord> records = new ArrayList<>(2);
        records.add(record(projectId, DriftReportType.FEATURE_STATISTICAL, statistical.isOverallDrift(),
            statistical.getDriftScore(), statistical.getBaselineWindow(), statistical.getCurrentWindow(),
            statistical.getNarrative(), statistical));
        if (model != null) {
            records.add(record(projectId, DriftReportType.FEATURE_MODEL, model.isAlert(),
                model.getDriftScore(), model.getBaselineWindow(), model.getCurrentWindow(), null, model));
        }
        List<DriftReportRecord> saved = repository.saveAll(records);
        log.info("Feature drift reports saved | projectId={} | reports={} | drift={} | score={}",
                 projectId, saved.size(), statistical.isOverallDrift(), statistical.getDriftScore());
        return saved;
    }

    @Transactional
    public DriftReportRecord savePredictionReport(long projectId, PredictionDriftReport report) {
        DriftReportRecord saved = repository.save(record(projectId, DriftReportType.PREDICTION,
            report.isOverallDrift(), null, report.getBaselineWindow(), report.getCurrentWindow(),
            report.getNarrative(), report));
        log.info("Prediction drift report saved | id={} | projectId={} | taskType={} | drift={}",
                 saved.getId(), projectId, report.getTaskType(), report.isOverallDrift());
        return saved;
    }

    @Transactional
    public DriftReportRecord saveLlmReport(long projectId, LlmDriftReport report) {
        DriftReportRecord saved = repository.save(record(projectId, DriftReportType.LLM_TOKEN,
            report.isDriftDetected(), report.getChangePercentage() / 100.0,
            report.getBaselineWindow(), report.getMonitorWindow(), report.getNarrative(), report));
        log.info("LLM drift report saved | id={} | projectId={} | change={}%",
                 saved.getId(), projectId, report.getChangePercentage());
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<DriftReportResponse> history(long projectId, DriftReportType type, Pageable pageable) {
        return repository.findByProjectIdAndReportTypeOrderByCreatedAtDesc(projectId, type, pageable)
            .map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public DriftReportResponse get(UUID id) {
        return repository.findById(id)
            .map(this::toResponse)
            .orElseThrow(() -> new ReportNotFoundException(id));
    }

    private DriftReportRecord record(long projectId, DriftReportType type, boolean drift, Double score,
                                     WindowDescriptor baseline, WindowDescriptor current,
                                     String narrative, Object report) {
        return DriftReportRecord.builder()
            .projectId(projectId)
            .reportType(type)
            .overallDrift(drift)
            .driftScore(score)
            .baselineStartRow(baseline != null ? baseline.getStartRow() : null)
            .baselineEndRow(baseline != null ? baseline.getEndRow() : null)
            .currentStartRow(current != null ? current.getStartRow() : null)
            .currentEndRow(current != null ? current.getEndRow() : null)
            .narrative(narrative)
            .reportJson(write(report))
            .build();
    }

    private String write(Object report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Drift report could not be serialized", ex);
        }
    }

    private DriftReportResponse toResponse(DriftReportRecord r) {
        JsonNode body;
        try {
            body = objectMapper.readTree(r.getReportJson());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored drift report " + r.getId() + " is not valid JSON", ex);
        }
        return DriftReportResponse.builder()
            .id(r.getId())
            .projectId(r.getProjectId())
            .reportType(r.getReportType())
            .overallDrift(r.isOverallDrift())
            .driftScore(r.getDriftScore())
            .baselineStartRow(r.getBaselineStartRow())
            .baselineEndRow(r.getBaselineEndRow())
            .currentStartRow(r.getCurrentStartRow())
            .currentEndRow(r.getCurrentEndRow())
            .narrative(r.getNarrative())
            .createdAt(r.getCreatedAt())
            .report(body)
            .build();
    }
}
