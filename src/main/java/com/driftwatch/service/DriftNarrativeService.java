package com.driftwatch.service;

import com.driftwatch.client.NarrativeApiClient;
import com.driftwatch.domain.DriftReport;
import com.driftwatch.domain.DriftReportType;
import com.driftwatch.domain.LlmDriftReport;
import com.driftwatch.domain.PredictionDriftReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Produces the narrative attached to each persisted report. The external text service
 * is optional; when it is disabled or fails, a templated summary is returned instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftNarrativeService {

    private static final String SYSTEM_PROMPT =
        "You are a machine learning monitoring assistant. Explain drift analysis results "
        + "for an engineering audience in a short, factual paragraph. Mention which signals "
        + "fired and what should be reviewed next.";

    private final NarrativeApiClient client;
    private final ObjectMapper objectMapper;

    @Value("${narrative.api.enabled:false}")
    private boolean enabled;

    @Value("${narrative.api.block-timeout-seconds:30}")
    private int blockTimeoutSeconds;

    public String narrateFeatureDrift(DriftReport report) {
        return narrate(DriftReportType.FEATURE_STATISTICAL, report, () -> featureFallback(report));
    }

    public String narratePredictionDrift(PredictionDriftReport report) {
        return narrate(DriftReportType.PREDICTION, report, () -> predictionFallback(report));
    }

    public String narrateLlmDrift(LlmDriftReport report) {
        return narrate(DriftReportType.LLM_TOKEN, report, () -> llmFallback(report));
    }

    String narrate(DriftReportType kind, Object report, Supplier<String> fallback) {
        if (!enabled) {
            return fallback.get();
        }
        try {
            String serialized = objectMapper.writeValueAsString(report);
            String prompt = "Drift report type: " + kind + "\n\n" + serialized;
            String text = client.complete(SYSTEM_PROMPT, prompt)
                .block(Duration.ofSeconds(blockTimeoutSeconds));
            if (text == null || text.isBlank()) {
                log.warn("Narrative empty, using template | kind={}", kind);
                return fallback.get();
            }
            return text;
        } catch (JsonProcessingException ex) {
            log.warn("Narrative skipped, report not serializable | kind={} | reason={}", kind, ex.getMessage());
            return fallback.get();
        } catch (RuntimeException ex) {
            log.warn("Narrative service failed, using template | kind={} | reason={}", kind, ex.getMessage());
            return fallback.get();
        }
    }

    static String featureFallback(DriftReport report) {
        int driftedFeatures = report.getAlerts() == null ? 0 : report.getAlerts().size();
        return String.format(Locale.ROOT,
            "Data Drift Analysis: Detected %d features with drift signals. Overall drift score: %.2f%%. "
                + "Baseline window: %s. Current window: %s. "
                + "Review the drift_tests and feature_stats for detailed information.",
            driftedFeatures, report.getDriftScore() * 100.0,
            report.getBaselineWindow() == null ? "n/a" : report.getBaselineWindow().label(),
            report.getCurrentWindow() == null ? "n/a" : report.getCurrentWindow().label());
    }

    static String predictionFallback(PredictionDriftReport report) {
        if (report.isSkipped()) {
            return String.format(Locale.ROOT,
                "Prediction Drift Analysis (%s): not enough samples to test (baseline %d, current %d).",
                report.getTaskType(), report.getBaselineSamples(), report.getCurrentSamples());
        }
        return String.format(Locale.ROOT,
            "Prediction Drift Analysis (%s): %d drift signals fired, overall drift %s. "
                + "Baseline samples: %d. Current samples: %d. Alerts: %s.",
            report.getTaskType(), report.getSignalCount(), report.isOverallDrift() ? "detected" : "not detected",
            report.getBaselineSamples(), report.getCurrentSamples(),
            report.getAlerts() == null || report.getAlerts().isEmpty() ? "none" : String.join(", ", report.getAlerts()));
    }

    static String llmFallback(LlmDriftReport report) {
        return String.format(Locale.ROOT,
            "Token length changed by %.2f%%. Baseline: %.2f tokens, Current: %.2f tokens.",
            report.getChangePercentage(), report.getBaselineAvgTokens(), report.getMonitorAvgTokens());
    }
}
