package com.driftwatch.service;

import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.entity.LlmWindow;
import com.driftwatch.exception.BaselineConflictException;
import com.driftwatch.repository.LlmWindowRepository;
import com.driftwatch.service.window.BaselineStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * LLM baseline and monitor windows. The baseline is anchored at row 1 and grows by
 * whole batches; the monitor window is consumed batch by batch and never overlaps a
 * window that was already evaluated. Boundary handling in row order is driven by
 * {@link LlmTokenDriftDetector#processBoundaries}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmWindowManager {

    private final LlmWindowRepository repository;
    private final RowLedgerService ledger;
    private final BaselineStore baselineStore;
    private final PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @PostConstruct
    void init() {
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public Optional<LlmWindow> baseline(long projectId) {
        return repository.findByProjectIdAndRole(projectId, LlmWindow.Role.BASELINE);
    }

    public Optional<LlmWindow> monitor(long projectId) {
        return repository.findByProjectIdAndRole(projectId, LlmWindow.Role.MONITOR);
    }

    public Optional<WindowRange> baselineRange(long projectId) {
        return baseline(projectId).map(LlmWindow::range);
    }

    public Optional<WindowRange> monitorRange(long projectId) {
        return monitor(projectId).map(LlmWindow::range);
    }

    /** Ledger row id at which the baseline is next created or extended. */
    public long nextBaselineEnd(long projectId, MonitoringConfig config) {
        return baseline(projectId)
            .map(b -> b.getEndRow() + config.getLlmBaselineBatchSize())
            .orElse((long) config.getLlmBaselineBatchSize());
    }

    /**
     * Creates the baseline or extends it by one batch, then places the monitor window on
     * the batch right after it. Callers hold the project lock and have checked that the
     * ledger reached {@link #nextBaselineEnd}.
     */
    public WindowRange advanceBaseline(long projectId, MonitoringConfig config) {
        int baselineSize = config.getLlmBaselineBatchSize();
        int monitorSize = config.getLlmMonitorBatchSize();
        if (baseline(projectId).isEmpty()) {
            createBaseline(projectId, baselineSize);
            return transactionTemplate.execute(status -> monitor(projectId)
                .map(LlmWindow::range)
                .orElseGet(() -> placeMonitor(projectId, monitorSize)));
        }
        return transactionTemplate.execute(status -> {
            extendBaseline(projectId, baselineSize);
            return placeMonitor(projectId, monitorSize);
        });
    }

    /** Moves the monitor window to the batch right after the one just evaluated. */
    public WindowRange consumeMonitor(LlmWindow monitor, int monitorBatchSize) {
        WindowRange next = new WindowRange(monitor.getEndRow() + 1, monitor.getEndRow() + monitorBatchSize);
        monitor.moveTo(next);
        monitor.setAvgTokenLength(null);
        repository.save(monitor);
        log.info("LLM monitor window advanced | projectId={} | window={}", monitor.getProjectId(), next);
        return next;
    }

    private void createBaseline(long projectId, int baselineSize) {
        WindowRange range = new WindowRange(1, baselineSize);
        LlmWindow baseline = LlmWindow.builder()
            .projectId(projectId)
            .role(LlmWindow.Role.BASELINE)
            .startRow(range.startRow())
            .endRow(range.endRow())
            .avgTokenLength(ledger.averageTokenLength(projectId, range))
            .build();
        try {
            baselineStore.insert(baseline);
            log.info("LLM baseline created | projectId={} | window={} | avgTokens={}",
                     projectId, range, baseline.getAvgTokenLength());
        } catch (DataIntegrityViolationException ex) {
            log.info("LLM baseline created concurrently, re-reading | projectId={}", projectId);
            if (baseline(projectId).isEmpty()) {
                throw new BaselineConflictException(projectId, ex);
            }
        }
    }

    private void extendBaseline(long projectId, int baselineSize) {
        LlmWindow baseline = baseline(projectId).orElseThrow(() -> new BaselineConflictException(projectId, null));
        WindowRange added = new WindowRange(baseline.getEndRow() + 1, baseline.getEndRow() + baselineSize);
        baseline.setEndRow(added.endRow());
        baseline.setAvgTokenLength(ledger.averageTokenLength(projectId, added));
        repository.save(baseline);
        log.info("LLM baseline extended | projectId={} | window={} | avgTokens={}",
                 projectId, baseline.range(), baseline.getAvgTokenLength());
    }

    private WindowRange placeMonitor(long projectId, int monitorSize) {
        LlmWindow baseline = baseline(projectId).orElseThrow(() -> new BaselineConflictException(projectId, null));
        WindowRange range = new WindowRange(baseline.getEndRow() + 1, baseline.getEndRow() + monitorSize);
        LlmWindow monitor = monitor(projectId).orElseGet(() -> LlmWindow.builder()
            .projectId(projectId)
            .role(LlmWindow.Role.MONITOR)
            .build());
        monitor.moveTo(range);
        monitor.setAvgTokenLength(null);
        repository.save(monitor);
        log.info("LLM monitor window set | projectId={} | window={}", projectId, range);
        return range;
    }
}
