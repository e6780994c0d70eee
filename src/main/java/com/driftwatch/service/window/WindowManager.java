package com.driftwatch.service.window;

import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.MonitoringConfig;
import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.domain.WindowStatus;
import com.driftwatch.entity.BaselineWindow;
import com.driftwatch.entity.FeatureRow;
import com.driftwatch.entity.MonitorWindow;
import com.driftwatch.entity.PredictionRow;
import com.driftwatch.entity.RowWindow;
import com.driftwatch.exception.BaselineConflictException;
import com.driftwatch.repository.BaselineWindowRepository;
import com.driftwatch.repository.MonitorWindowRepository;
import com.driftwatch.service.LlmWindowManager;
import com.driftwatch.service.ProjectConfigService;
import com.driftwatch.service.RowLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the feature and prediction baseline/monitor ranges of each project in line with
 * the ledger, following the project's window policy.
 *
 * <p>Updates run under the project lock and commit before the lock is released. The first
 * baseline insert goes through {@link BaselineStore} so that a concurrent creator in
 * another process is detected by the unique project key and resolved by re-reading.
 */
@Slf4j
@Service
public class WindowManager {

    private static final List<RecordKind> ROW_KINDS = List.of(RecordKind.FEATURE, RecordKind.PREDICTION);

    private final ProjectConfigService configService;
    private final RowLedgerService ledger;
    private final BaselineWindowRepository baselineRepository;
    private final MonitorWindowRepository monitorRepository;
    private final BaselineStore baselineStore;
    private final ProjectLocks projectLocks;
    private final LlmWindowManager llmWindowManager;
    private final TransactionTemplate transactionTemplate;
    private final Map<WindowPolicyType, WindowPolicy> policies = new EnumMap<>(WindowPolicyType.class);

    public WindowManager(ProjectConfigService configService,
                         RowLedgerService ledger,
                         BaselineWindowRepository baselineRepository,
                         MonitorWindowRepository monitorRepository,
                         BaselineStore baselineStore,
                         ProjectLocks projectLocks,
                         LlmWindowManager llmWindowManager,
                         List<WindowPolicy> policies,
                         PlatformTransactionManager transactionManager) {
        this.configService = configService;
        this.ledger = ledger;
        this.baselineRepository = baselineRepository;
        this.monitorRepository = monitorRepository;
        this.baselineStore = baselineStore;
        this.projectLocks = projectLocks;
        this.llmWindowManager = llmWindowManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        policies.forEach(p -> this.policies.put(p.type(), p));
    }

    public WindowStatus recomputeWindows(long projectId) {
        Optional<MonitoringConfig> config = configService.resolve(projectId);
        if (config.isEmpty()) {
            return WindowStatus.NOT_READY;
        }
        return recomputeWindows(projectId, config.get());
    }

    public WindowStatus recomputeWindows(long projectId, MonitoringConfig config) {
        WindowPolicy policy = policies.get(config.getWindowPolicy());
        return projectLocks.withLock(projectId, () -> {
            Map<RecordKind, Long> latest = new EnumMap<>(RecordKind.class);
            ROW_KINDS.forEach(kind -> latest.put(kind, ledger.latestRowId(projectId, kind)));

            if (baselineRepository.findByProjectId(projectId).isEmpty()
                    && !createBaseline(projectId, config, policy, latest)) {
                return WindowStatus.NOT_READY;
            }
            return transactionTemplate.execute(status -> advance(projectId, config, policy, latest));
        });
    }

    public Optional<WindowRange> getBaselineWindow(long projectId, RecordKind kind) {
        if (kind == RecordKind.LLM_INTERACTION) {
            return llmWindowManager.baselineRange(projectId);
        }
        return baselineRepository.findByProjectId(projectId).flatMap(b -> b.range(kind));
    }

    public Optional<WindowRange> getMonitorWindow(long projectId, RecordKind kind) {
        if (kind == RecordKind.LLM_INTERACTION) {
            return llmWindowManager.monitorRange(projectId);
        }
        return monitorRepository.findByProjectId(projectId).flatMap(m -> m.range(kind));
    }

    public Optional<WindowSnapshot> getBaselineData(long projectId) {
        return baselineRepository.findByProjectId(projectId).map(b -> snapshot(projectId, b));
    }

    public Optional<WindowSnapshot> getMonitorData(long projectId) {
        return monitorRepository.findByProjectId(projectId)
            .filter(m -> !m.isEmpty())
            .map(m -> snapshot(projectId, m));
    }

    private boolean createBaseline(long projectId, MonitoringConfig config, WindowPolicy policy,
                                   Map<RecordKind, Long> latest) {
        BaselineWindow baseline = BaselineWindow.forProject(projectId);
        for (RecordKind kind : ROW_KINDS) {
            baseline.assign(kind, policy.baseline(null, latest.get(kind), config.getBaselineBatchSize()));
        }
        if (baseline.isEmpty()) {
            log.debug("Baseline not ready | projectId={} | features={} | predictions={} | required={}",
                      projectId, latest.get(RecordKind.FEATURE), latest.get(RecordKind.PREDICTION),
                      config.getBaselineBatchSize());
            return false;
        }
        try {
            baselineStore.insert(baseline);
            log.info("Baseline created | projectId={} | policy={} | features={}..{} | predictions={}..{}",
                     projectId, policy.type(),
                     baseline.getFeatureStartRow(), baseline.getFeatureEndRow(),
                     baseline.getPredictionStartRow(), baseline.getPredictionEndRow());
        } catch (DataIntegrityViolationException ex) {
            log.info("Baseline created concurrently, re-reading | projectId={}", projectId);
            if (baselineRepository.findByProjectId(projectId).isEmpty()) {
                throw new BaselineConflictException(projectId, ex);
            }
        }
        return true;
    }

    private WindowStatus advance(long projectId, MonitoringConfig config, WindowPolicy policy,
                                 Map<RecordKind, Long> latest) {
        BaselineWindow baseline = baselineRepository.findByProjectId(projectId)
            .orElseThrow(() -> new BaselineConflictException(projectId, null));
        MonitorWindow monitor = monitorRepository.findByProjectId(projectId)
            .orElseGet(() -> MonitorWindow.forProject(projectId));

        for (RecordKind kind : ROW_KINDS) {
            long latestRow = latest.get(kind);
            WindowRange stored = baseline.range(kind).orElse(null);
            Optional<WindowRange> next = policy.baseline(stored, latestRow, config.getBaselineBatchSize());
            boolean moved = next.isPresent() && !next.get().equals(stored);
            if (moved) {
                baseline.assign(kind, next);
                log.info("Baseline moved | projectId={} | kind={} | from={} | to={}",
                         projectId, kind, stored, next.get());
            }
            if (next.isEmpty()) {
                monitor.assign(kind, Optional.empty());
                continue;
            }
            WindowRange storedMonitor = monitor.range(kind).orElse(null);
            Optional<WindowRange> nextMonitor = policy.monitor(
                next.get(), storedMonitor, moved, latestRow, config.getMonitorBatchSize());
            if (!nextMonitor.equals(Optional.ofNullable(storedMonitor))) {
                monitor.assign(kind, nextMonitor);
                log.info("Monitor window set | projectId={} | kind={} | window={}",
                         projectId, kind, nextMonitor.map(WindowRange::toString).orElse("none"));
            }
        }

        baselineRepository.save(baseline);
        MonitorWindow savedMonitor = monitor.isEmpty() && monitor.getId() == null
            ? monitor
            : monitorRepository.save(monitor);
        return new WindowStatus(!baseline.isEmpty(), !savedMonitor.isEmpty());
    }

    private WindowSnapshot snapshot(long projectId, RowWindow window) {
        List<FeatureRow> features = window.range(RecordKind.FEATURE)
            .map(r -> ledger.featureRows(projectId, r))
            .orElse(List.of());
        List<PredictionRow> predictions = window.range(RecordKind.PREDICTION)
            .map(r -> ledger.predictionRows(projectId, r))
            .orElse(List.of());

        Optional<WindowRange> featureRange = features.isEmpty() ? Optional.empty()
            : Optional.of(new WindowRange(features.get(0).getRowId(), features.get(features.size() - 1).getRowId()));
        Optional<WindowRange> predictionRange = predictions.isEmpty() ? Optional.empty()
            : Optional.of(new WindowRange(predictions.get(0).getRowId(),
                                          predictions.get(predictions.size() - 1).getRowId()));
        Instant featureTimestamp = features.isEmpty() ? null : features.get(features.size() - 1).getCreatedAt();
        Instant predictionTimestamp = predictions.isEmpty() ? null
            : predictions.get(predictions.size() - 1).getCreatedAt();

        List<Map<String, FieldValue>> featurePayloads = features.stream().map(FeatureRow::getPayload).toList();
        List<FieldValue> predictionPayloads = predictions.stream().map(PredictionRow::getPrediction).toList();
        return new WindowSnapshot(featureRange, featurePayloads, featureTimestamp,
                                  predictionRange, predictionPayloads, predictionTimestamp);
    }
}
