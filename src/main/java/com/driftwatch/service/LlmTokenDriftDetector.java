package com.driftwatch.service;

import com.driftwatch.domain.LlmDriftOutcome;
import com.driftwatch.domain.LlmDriftReport;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowDescriptor;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.entity.LlmInteractionRow;
import com.driftwatch.entity.LlmWindow;
import com.driftwatch.service.window.ProjectLocks;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Compares the average response token length of the LLM monitor window with the
 * baseline average. A completed monitor window is evaluated once: drifted rows are
 * tagged, the report is saved when drift is found, and the window moves on to the
 * next batch either way.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmTokenDriftDetector {

    private final LlmWindowManager windowManager;
    private final RowLedgerService ledger;
    private final DriftNarrativeService narrativeService;
    private final DriftReportService reportService;
    private final ProjectLocks projectLocks;
    private final PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @PostConstruct
    void init() {
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /** Token drift over the current LLM windows; empty while either window or its rows are missing. */
    public Optional<LlmDriftReport> runLlmTokenDrift(long projectId, MonitoringConfig config) {
        Optional<LlmWindow> baseline = windowManager.baseline(projectId);
        Optional<LlmWindow> monitor = windowManager.monitor(projectId);
        if (baseline.isEmpty() || monitor.isEmpty()) {
            return Optional.empty();
        }
        Double baselineAvg = baseline.get().getAvgTokenLength();
        if (baselineAvg == null || baselineAvg <= 0.0) {
            log.info("LLM drift not ready, zero baseline average | projectId={}", projectId);
            return Optional.empty();
        }
        WindowRange monitorRange = monitor.get().range();
        List<LlmInteractionRow> rows = ledger.llmRows(projectId, monitorRange);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        double monitorAvg = rows.stream().mapToInt(LlmInteractionRow::getResponseTokenLength).average().orElse(0.0);
        double change = Math.abs(baselineAvg - monitorAvg) / baselineAvg;
        boolean drift = change > config.getTokenDriftThreshold();

        WindowRange retrieved = new WindowRange(rows.get(0).getRowId(), rows.get(rows.size() - 1).getRowId());
        LlmDriftReport report = LlmDriftReport.builder()
            .baselineWindow(WindowDescriptor.of(baseline.get().range(), (int) baseline.get().range().length(), null))
            .monitorWindow(WindowDescriptor.of(retrieved, rows.size(), rows.get(rows.size() - 1).getCreatedAt()))
            .baselineAvgTokens(baselineAvg)
            .monitorAvgTokens(monitorAvg)
            .changePercentage(change * 100.0)
            .threshold(config.getTokenDriftThreshold())
            .driftDetected(drift)
            .build();
        log.info("LLM token drift computed | projectId={} | baselineAvg={} | monitorAvg={} | change={} | drift={}",
                 projectId, baselineAvg, monitorAvg, change, drift);
        return Optional.of(report);
    }

    /**
     * Replays the window boundaries the ledger has passed since the last call, in row
     * order. A monitor window ending at or before the next baseline boundary is
     * evaluated first, so every window completed inside one batch is evaluated.
     */
    public LlmDriftOutcome processBoundaries(long projectId, MonitoringConfig config) {
        return projectLocks.withLock(projectId, () -> {
            long latest = ledger.latestRowId(projectId, RecordKind.LLM_INTERACTION);
            LlmDriftOutcome.LlmDriftOutcomeBuilder outcome = LlmDriftOutcome.builder();
            while (true) {
                long baselineEnd = windowManager.nextBaselineEnd(projectId, config);
                Optional<LlmWindow> monitor = windowManager.monitor(projectId);
                if (monitor.isPresent() && monitor.get().getEndRow() <= latest
                        && monitor.get().getEndRow() <= baselineEnd) {
                    evaluateMonitorWindow(projectId, config).ifPresent(outcome::evaluation);
                } else if (baselineEnd <= latest) {
                    windowManager.advanceBaseline(projectId, config);
                } else {
                    break;
                }
            }
            return outcome
                .baselineReady(windowManager.baseline(projectId).isPresent())
                .monitorReady(windowManager.monitor(projectId).isPresent())
                .build();
        });
    }

    /**
     * Evaluates the current monitor window and advances it. Drifted rows are tagged and
     * the report saved; the report is returned whenever one could be computed.
     */
    Optional<LlmDriftReport> evaluateMonitorWindow(long projectId, MonitoringConfig config) {
        Optional<LlmDriftReport> report = runLlmTokenDrift(projectId, config)
            .map(r -> r.isDriftDetected()
                ? r.toBuilder().narrative(narrativeService.narrateLlmDrift(r)).build()
                : r);

        return transactionTemplate.execute(status -> {
            LlmWindow window = windowManager.monitor(projectId).orElseThrow();
            WindowRange evaluated = window.range();
            Optional<LlmDriftReport> result = report;
            if (report.isPresent() && report.get().isDriftDetected()) {
                int tagged = ledger.markDriftAffected(projectId, evaluated);
                LlmDriftReport affected = report.get().toBuilder().affectedRows(tagged).build();
                reportService.saveLlmReport(projectId, affected);
                result = Optional.of(affected);
            }
            windowManager.consumeMonitor(window, config.getLlmMonitorBatchSize());
            return result;
        });
    }
}
