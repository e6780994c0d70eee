package com.driftwatch.service;

import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.WindowRange;
import com.driftwatch.dto.LlmInteractionRequest;
import com.driftwatch.entity.LlmInteractionRow;
import com.driftwatch.entity.PredictionRow;
import com.driftwatch.exception.InvalidIngestionException;
import com.driftwatch.repository.FeatureRowRepository;
import com.driftwatch.repository.LlmInteractionRowRepository;
import com.driftwatch.repository.PredictionRowRepository;
import com.driftwatch.service.window.ProjectLocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RowLedgerServiceTest {

    private static final Instant BATCH_TIME = Instant.parse("2024-05-01T10:00:00Z");

    @Mock private FeatureRowRepository featureRepository;
    @Mock private PredictionRowRepository predictionRepository;
    @Mock private LlmInteractionRowRepository llmRepository;
    @Mock private TokenCounter tokenCounter;
    @Mock private PlatformTransactionManager transactionManager;

    @Captor private ArgumentCaptor<List<PredictionRow>> predictionCaptor;
    @Captor private ArgumentCaptor<List<LlmInteractionRow>> interactionCaptor;

    private RowLedgerService ledger;

    @BeforeEach
    void setUp() {
        ledger = new RowLedgerService(featureRepository, predictionRepository, llmRepository,
            new ProjectLocks(), tokenCounter, transactionManager);
        ledger.init();
    }

    @Test
    void appendPredictions_continuesRowIdsAndStoresNullAsMissing() {
        when(predictionRepository.findMaxRowId(3L)).thenReturn(40L);

        WindowRange range = ledger.appendPredictions(3L, Arrays.asList(FieldValue.of(1.5), null), BATCH_TIME);

        assertThat(range).isEqualTo(new WindowRange(41, 42));
        verify(predictionRepository).saveAll(predictionCaptor.capture());
        List<PredictionRow> saved = predictionCaptor.getValue();
        assertThat(saved).extracting(PredictionRow::getRowId).containsExactly(41L, 42L);
        assertThat(saved.get(1).getPrediction()).isEqualTo(FieldValue.missing());
        assertThat(saved.get(0).getCreatedAt()).isEqualTo(BATCH_TIME);
    }

    @Test
    void appendInteractions_countsResponseTokens() {
        when(llmRepository.findMaxRowId(3L)).thenReturn(0L);
        when(tokenCounter.count("Fine thanks")).thenReturn(2);

        WindowRange range = ledger.appendInteractions(3L,
            List.of(LlmInteractionRequest.builder().inputText("How are you?").responseText("Fine thanks").build()),
            BATCH_TIME);

        assertThat(range).isEqualTo(new WindowRange(1, 1));
        verify(llmRepository).saveAll(interactionCaptor.capture());
        assertThat(interactionCaptor.getValue().get(0).getResponseTokenLength()).isEqualTo(2);
    }

    @Test
    void appendFeatures_nullRow_isRejectedBeforeStoring() {
        List<Map<String, FieldValue>> rows = Arrays.asList(Map.of("amount", FieldValue.of(1.0)), null);

        assertThatThrownBy(() -> ledger.appendFeatures(3L, rows, BATCH_TIME))
            .isInstanceOf(InvalidIngestionException.class)
            .hasMessageContaining("FEATURE");
        verifyNoInteractions(featureRepository, transactionManager);
    }

    @Test
    void emptyBatch_isRejected() {
        assertThatThrownBy(() -> ledger.appendPredictions(3L, List.of(), BATCH_TIME))
            .isInstanceOf(InvalidIngestionException.class);
        verifyNoInteractions(predictionRepository);
    }
}
