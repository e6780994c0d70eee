package com.driftwatch.service;

import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.PredictionDriftReport;
import com.driftwatch.domain.TaskType;
import com.driftwatch.exception.UnsupportedTaskTypeException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class PredictionDriftMonitorTest {

    private final PredictionDriftMonitor monitor = new PredictionDriftMonitor();
    private final DriftThresholds thresholds = DriftThresholds.defaults();

    @Nested
    class Regression {

        @Test
        void shiftedOutputs_raiseAlert() {
            Random random = new Random(11);
            PredictionDriftReport report = monitor.runPredictionDrift(
                gaussian(random, 500, 10, 1), gaussian(random, 500, 13, 1.5), "regression", thresholds);

            assertThat(report.getTaskType()).isEqualTo(TaskType.REGRESSION);
            assertThat(report.isSkipped()).isFalse();
            assertThat(report.getMeanShift().isDriftDetected()).isTrue();
            assertThat(report.getVarianceShift().isDriftDetected()).isTrue();
            assertThat(report.getKsTest().isDriftDetected()).isTrue();
            assertThat(report.getQuantileShifts()).containsKeys("q25", "q50", "q75", "q95");
            assertThat(report.getAlerts()).containsExactly(PredictionDriftMonitor.REGRESSION_ALERT);
            assertThat(report.isOverallDrift()).isTrue();
        }

        @Test
        void featureAlertThreshold_doesNotChangeOutputRule() {
            Random random = new Random(11);
            PredictionDriftReport report = monitor.runPredictionDrift(
                gaussian(random, 500, 10, 1), gaussian(random, 500, 13, 1.5), "regression",
                thresholds.toBuilder().alertThreshold(5).build());

            assertThat(report.getAlerts()).containsExactly(PredictionDriftMonitor.REGRESSION_ALERT);
        }

        @Test
        void stableOutputs_noAlert() {
            Random random = new Random(12);
            PredictionDriftReport report = monitor.runPredictionDrift(
                gaussian(random, 1000, 10, 1), gaussian(random, 1000, 10, 1), "regression", thresholds);

            assertThat(report.getKsTest().getStatistic()).isLessThan(0.1);
            assertThat(report.getAlerts()).isEmpty();
            assertThat(report.isOverallDrift()).isFalse();
        }

        @Test
        void blankTaskType_defaultsToRegression() {
            Random random = new Random(13);
            PredictionDriftReport report = monitor.runPredictionDrift(
                gaussian(random, 100, 5, 1), gaussian(random, 100, 5, 1), " ", thresholds);

            assertThat(report.getTaskType()).isEqualTo(TaskType.REGRESSION);
        }

        @Test
        void belowMinimumSamples_isSkipped() {
            Random random = new Random(14);
            PredictionDriftReport report = monitor.runPredictionDrift(
                gaussian(random, 49, 5, 1), gaussian(random, 500, 50, 1), "regression", thresholds);

            assertThat(report.isSkipped()).isTrue();
            assertThat(report.isOverallDrift()).isFalse();
            assertThat(report.getMeanShift()).isNull();
            assertThat(report.getBaselineSamples()).isEqualTo(49);
        }

        @Test
        void missingPredictions_areIgnored() {
            Random random = new Random(15);
            List<FieldValue> current = new ArrayList<>(gaussian(random, 60, 5, 1));
            current.add(FieldValue.missing());
            current.add(FieldValue.of(Double.NaN));

            PredictionDriftReport report = monitor.runPredictionDrift(
                gaussian(random, 60, 5, 1), current, "regression", thresholds);

            assertThat(report.getCurrentSamples()).isEqualTo(60);
        }
    }

    @Nested
    class Classification {

        @Test
        void integerLabels_ratioShiftAndKsRaiseAlert() {
            PredictionDriftReport report = monitor.runPredictionDrift(
                labels(FieldValue.of(0), 70, FieldValue.of(1), 30),
                labels(FieldValue.of(0), 30, FieldValue.of(1), 70),
                "classification", thresholds);

            assertThat(report.getBaselineClassProportions()).containsEntry("0", 0.7).containsEntry("1", 0.3);
            assertThat(report.getClassRatioShifts().get("0").isDriftDetected()).isTrue();
            assertThat(report.getKsTest().getStatistic()).isCloseTo(0.4, within(1e-9));
            assertThat(report.getKsTest().isDriftDetected()).isTrue();
            assertThat(report.getAlerts()).containsExactly(PredictionDriftMonitor.CLASSIFICATION_ALERT);
            assertThat(report.isOverallDrift()).isTrue();
        }

        @Test
        void textLabels_leaveKsUncomputed() {
            PredictionDriftReport report = monitor.runPredictionDrift(
                labels(FieldValue.of("cat"), 70, FieldValue.of("dog"), 30),
                labels(FieldValue.of("cat"), 30, FieldValue.of("dog"), 70),
                "CLASSIFICATION", thresholds);

            assertThat(report.getKsTest().getStatistic()).isNull();
            assertThat(report.getKsTest().getPValue()).isNull();
            assertThat(report.getKsTest().isDriftDetected()).isFalse();
            assertThat(report.getClassRatioShifts().get("cat").isDriftDetected()).isTrue();
            assertThat(report.getSignalCount()).isEqualTo(1);
            assertThat(report.isOverallDrift()).isFalse();
        }

        @Test
        void unseenBaselineClass_countsAsZeroShare() {
            List<FieldValue> current = labels(FieldValue.of("a"), 60, FieldValue.of("c"), 40);
            PredictionDriftReport report = monitor.runPredictionDrift(
                labels(FieldValue.of("a"), 60, FieldValue.of("b"), 40), current, "classification", thresholds);

            assertThat(report.getClassRatioShifts().get("b").getCurrentValue()).isZero();
            assertThat(report.getClassRatioShifts()).doesNotContainKey("c");
        }
    }

    @Test
    void unknownTaskType_isRejected() {
        assertThatThrownBy(() -> monitor.runPredictionDrift(List.of(), List.of(), "ranking", thresholds))
            .isInstanceOf(UnsupportedTaskTypeException.class)
            .hasMessageContaining("ranking");
    }

    private static List<FieldValue> gaussian(Random random, int n, double mean, double std) {
        List<FieldValue> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            values.add(FieldValue.of(mean + std * random.nextGaussian()));
        }
        return values;
    }

    private static List<FieldValue> labels(FieldValue first, int firstCount, FieldValue second, int secondCount) {
        List<FieldValue> values = new ArrayList<>();
        for (int i = 0; i < firstCount; i++) {
            values.add(first);
        }
        for (int i = 0; i < secondCount; i++) {
            values.add(second);
        }
        return values;
    }
}
