package com.driftwatch.service;

import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.dto.LlmInteractionRequest;
import com.driftwatch.entity.FeatureRow;
import com.driftwatch.entity.LlmInteractionRow;
import com.driftwatch.entity.PredictionRow;
import com.driftwatch.exception.InvalidIngestionException;
import com.driftwatch.repository.FeatureRowRepository;
import com.driftwatch.repository.LlmInteractionRowRepository;
import com.driftwatch.repository.PredictionRowRepository;
import com.driftwatch.service.window.ProjectLocks;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Append-only row storage. Row ids are assigned per project and kind as
 * {@code max(row_id) + 1, + 2, ...} under the project lock, so concurrent batches for
 * one project never interleave.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowLedgerService {

    private final FeatureRowRepository featureRepository;
    private final PredictionRowRepository predictionRepository;
    private final LlmInteractionRowRepository llmRepository;
    private final ProjectLocks projectLocks;
    private final TokenCounter tokenCounter;
    private final PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @PostConstruct
    void init() {
        transactionTemplate = new TransactionTemplate(transactionManager);
        tokenCounter.acquire();
    }

    @PreDestroy
    void shutdown() {
        tokenCounter.release();
    }

    /** Appends feature rows and returns the range of row ids assigned. */
    public WindowRange appendFeatures(long projectId, List<Map<String, FieldValue>> rows, Instant batchTimestamp) {
        requireRows(rows, RecordKind.FEATURE);
        return append(projectId, batchTimestamp, createdAt -> writeFeatures(projectId, rows, createdAt));
    }

    /** Appends predictions; a null prediction is stored as missing. */
    public WindowRange appendPredictions(long projectId, List<FieldValue> rows, Instant batchTimestamp) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidIngestionException("Batch must contain at least one row");
        }
        return append(projectId, batchTimestamp, createdAt -> writePredictions(projectId, rows, createdAt));
    }

    /** Appends LLM interactions, counting response tokens as each row is stored. */
    public WindowRange appendInteractions(long projectId, List<LlmInteractionRequest> rows, Instant batchTimestamp) {
        requireRows(rows, RecordKind.LLM_INTERACTION);
        return append(projectId, batchTimestamp, createdAt -> writeInteractions(projectId, rows, createdAt));
    }

    public long latestRowId(long projectId, RecordKind kind) {
        return switch (kind) {
            case FEATURE -> featureRepository.findMaxRowId(projectId);
            case PREDICTION -> predictionRepository.findMaxRowId(projectId);
            case LLM_INTERACTION -> llmRepository.findMaxRowId(projectId);
        };
    }

    public List<FeatureRow> featureRows(long projectId, WindowRange range) {
        return featureRepository.findByProjectIdAndRowIdBetweenOrderByRowIdAsc(
            projectId, range.startRow(), range.endRow());
    }

    public List<PredictionRow> predictionRows(long projectId, WindowRange range) {
        return predictionRepository.findByProjectIdAndRowIdBetweenOrderByRowIdAsc(
            projectId, range.startRow(), range.endRow());
    }

    public List<LlmInteractionRow> llmRows(long projectId, WindowRange range) {
        return llmRepository.findByProjectIdAndRowIdBetweenOrderByRowIdAsc(
            projectId, range.startRow(), range.endRow());
    }

    public double averageTokenLength(long projectId, WindowRange range) {
        Double avg = llmRepository.averageTokenLength(projectId, range.startRow(), range.endRow());
        return avg != null ? avg : 0.0;
    }

    public int markDriftAffected(long projectId, WindowRange range) {
        return llmRepository.markDriftAffected(projectId, range.startRow(), range.endRow());
    }

    private WindowRange writeFeatures(long projectId, List<Map<String, FieldValue>> rows, Instant createdAt) {
        long next = featureRepository.findMaxRowId(projectId) + 1;
        List<FeatureRow> entities = new ArrayList<>(rows.size());
        for (Map<String, FieldValue> payload : rows) {
            Map<String, FieldValue> copy = new LinkedHashMap<>();
            payload.forEach((k, v) -> copy.put(k, v == null ? FieldValue.missing() : v));
            entities.add(FeatureRow.builder()
                .projectId(projectId)
                .rowId(next++)
                .payload(copy)
                .createdAt(createdAt)
                .build());
        }
        featureRepository.saveAll(entities);
        return logged(projectId, RecordKind.FEATURE, entities.get(0).getRowId(), next - 1);
    }

    private WindowRange writePredictions(long projectId, List<FieldValue> rows, Instant createdAt) {
        long next = predictionRepository.findMaxRowId(projectId) + 1;
        List<PredictionRow> entities = new ArrayList<>(rows.size());
        for (FieldValue value : rows) {
            entities.add(PredictionRow.builder()
                .projectId(projectId)
                .rowId(next++)
                .prediction(value != null ? value : FieldValue.missing())
                .createdAt(createdAt)
                .build());
        }
        predictionRepository.saveAll(entities);
        return logged(projectId, RecordKind.PREDICTION, entities.get(0).getRowId(), next - 1);
    }

    private WindowRange writeInteractions(long projectId, List<LlmInteractionRequest> rows, Instant createdAt) {
        long next = llmRepository.findMaxRowId(projectId) + 1;
        List<LlmInteractionRow> entities = new ArrayList<>(rows.size());
        for (LlmInteractionRequest interaction : rows) {
            entities.add(LlmInteractionRow.builder()
                .projectId(projectId)
                .rowId(next++)
                .inputText(interaction.getInputText())
                .responseText(interaction.getResponseText())
                .responseTokenLength(tokenCounter.count(interaction.getResponseText()))
                .createdAt(createdAt)
                .build());
        }
        llmRepository.saveAll(entities);
        return logged(projectId, RecordKind.LLM_INTERACTION, entities.get(0).getRowId(), next - 1);
    }

    private static WindowRange logged(long projectId, RecordKind kind, long first, long last) {
        log.info("Rows appended | projectId={} | kind={} | rows={}..{}", projectId, kind, first, last);
        return new WindowRange(first, last);
    }

    private WindowRange append(long projectId, Instant batchTimestamp, Function<Instant, WindowRange> writer) {
        Instant createdAt = batchTimestamp != null ? batchTimestamp : Instant.now();
        return projectLocks.withLock(projectId, () -> transactionTemplate.execute(status -> writer.apply(createdAt)));
    }

    private static void requireRows(List<?> rows, RecordKind kind) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidIngestionException("Batch must contain at least one row");
        }
        if (rows.stream().anyMatch(Objects::isNull)) {
            throw new InvalidIngestionException("Null rows cannot be stored as " + kind);
        }
    }
}
