package com.driftwatch.service;

import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.KsTest;
import com.driftwatch.domain.PredictionDriftReport;
import com.driftwatch.domain.PsiTest;
import com.driftwatch.domain.ShiftTest;
import com.driftwatch.domain.TaskType;
import com.driftwatch.domain.WindowDescriptor;
import com.driftwatch.exception.UnsupportedTaskTypeException;
import com.driftwatch.service.stats.DriftStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Drift checks on scalar model outputs. Regression outputs get the shift tests,
 * quantile shifts, KS and PSI; classification outputs get class-ratio shifts, KS on
 * integer labels and PSI over mapped class proportions.
 */
@Slf4j
@Service
public class PredictionDriftMonitor {

    static final String REGRESSION_ALERT = "regression_output_drift";
    static final String CLASSIFICATION_ALERT = "classification_output_drift";
    // fixed for prediction outputs; the per-column alert threshold only applies to features
    static final int ALERT_SIGNALS = 2;

    public PredictionDriftReport runPredictionDrift(List<FieldValue> baseline, List<FieldValue> current,
                                                    String taskType, DriftThresholds thresholds) {
        return runPredictionDrift(baseline, current, TaskType.parse(taskType), thresholds,
            WindowDescriptor.adHoc(baseline.size()), WindowDescriptor.adHoc(current.size()));
    }

    public PredictionDriftReport runPredictionDrift(List<FieldValue> baseline, List<FieldValue> current,
                                                    TaskType taskType, DriftThresholds thresholds,
                                                    WindowDescriptor baselineWindow,
                                                    WindowDescriptor currentWindow) {
        if (taskType == null) {
            throw new UnsupportedTaskTypeException("null");
        }
        PredictionDriftReport report = switch (taskType) {
            case REGRESSION -> regression(baseline, current, thresholds);
            case CLASSIFICATION -> classification(baseline, current, thresholds);
        };
        log.info("Prediction drift computed | taskType={} | skipped={} | signals={} | drift={}",
                 taskType, report.isSkipped(), report.getSignalCount(), report.isOverallDrift());
        return report.toBuilder()
            .baselineWindow(baselineWindow)
            .currentWindow(currentWindow)
            .build();
    }

    private PredictionDriftReport regression(List<FieldValue> baseline, List<FieldValue> current,
                                             DriftThresholds thresholds) {
        double[] base = numbers(baseline);
        double[] curr = numbers(current);
        if (belowGate(base.length, curr.length, thresholds)) {
            return skipped(TaskType.REGRESSION, base.length, curr.length);
        }

        ShiftTest meanShift = DriftStatistics.shiftTest(
            DriftStatistics.mean(base), DriftStatistics.mean(curr), thresholds.getMeanThreshold());
        ShiftTest medianShift = DriftStatistics.shiftTest(
            DriftStatistics.median(base), DriftStatistics.median(curr), thresholds.getMedianThreshold());
        ShiftTest varianceShift = DriftStatistics.shiftTest(
            DriftStatistics.variance(base, false), DriftStatistics.variance(curr, false),
            thresholds.getVarianceThreshold());

        Map<String, ShiftTest> quantileShifts = new LinkedHashMap<>();
        for (double q : thresholds.getPredictionQuantiles()) {
            ShiftTest shift = DriftStatistics.shiftTest(
                DriftStatistics.quantile(base, q), DriftStatistics.quantile(curr, q),
                thresholds.getVarianceThreshold());
            if (shift != null) {
                quantileShifts.put(DriftStatistics.quantileKey(q), shift);
            }
        }

        KsTest ks = DriftStatistics.ksByStatistic(base, curr, thresholds.getKsStatisticThreshold());
        PsiTest psi = DriftStatistics.psiTest(base, curr, thresholds.getPsiBins(),
            thresholds.getPsiLowThreshold(), thresholds.getPsiHighThreshold());

        int signals = count(meanShift) + count(medianShift) + count(varianceShift)
            + (psi.isHigh() ? 1 : 0) + (ks.isDriftDetected() ? 1 : 0);
        List<String> alerts = new ArrayList<>();
        if (signals >= ALERT_SIGNALS) {
            alerts.add(REGRESSION_ALERT);
        }

        return PredictionDriftReport.builder()
            .taskType(TaskType.REGRESSION)
            .baselineSamples(base.length)
            .currentSamples(curr.length)
            .meanShift(meanShift)
            .medianShift(medianShift)
            .varianceShift(varianceShift)
            .quantileShifts(quantileShifts)
            .ksTest(ks)
            .psi(psi)
            .signalCount(signals)
            .alerts(alerts)
            .overallDrift(!alerts.isEmpty())
            .build();
    }

    private PredictionDriftReport classification(List<FieldValue> baseline, List<FieldValue> current,
                                                 DriftThresholds thresholds) {
        List<String> base = labels(baseline);
        List<String> curr = labels(current);
        if (belowGate(base.size(), curr.size(), thresholds)) {
            return skipped(TaskType.CLASSIFICATION, base.size(), curr.size());
        }

        Map<String, Double> baseShare = proportions(base);
        Map<String, Double> currShare = proportions(curr);

        Map<String, ShiftTest> classShifts = new LinkedHashMap<>();
        boolean anyClassDrift = false;
        for (Map.Entry<String, Double> e : baseShare.entrySet()) {
            ShiftTest shift = DriftStatistics.shiftTest(
                e.getValue(), currShare.getOrDefault(e.getKey(), 0.0), thresholds.getMeanThreshold());
            if (shift != null) {
                classShifts.put(e.getKey(), shift);
                anyClassDrift |= shift.isDriftDetected();
            }
        }

        KsTest ks = integerLabelKs(base, curr, thresholds.getKsStatisticThreshold());
        PsiTest psi = DriftStatistics.psiTest(mapped(base, baseShare), mapped(curr, currShare),
            thresholds.getPsiBins(), thresholds.getPsiLowThreshold(), thresholds.getPsiHighThreshold());

        int signals = (anyClassDrift ? 1 : 0) + (psi.isHigh() ? 1 : 0) + (ks.isDriftDetected() ? 1 : 0);
        List<String> alerts = new ArrayList<>();
        if (signals >= ALERT_SIGNALS) {
            alerts.add(CLASSIFICATION_ALERT);
        }

        return PredictionDriftReport.builder()
            .taskType(TaskType.CLASSIFICATION)
            .baselineSamples(base.size())
            .currentSamples(curr.size())
            .baselineClassProportions(baseShare)
            .currentClassProportions(currShare)
            .classRatioShifts(classShifts)
            .ksTest(ks)
            .psi(psi)
            .signalCount(signals)
            .alerts(alerts)
            .overallDrift(!alerts.isEmpty())
            .build();
    }

    // labels that are not whole numbers leave KS uncomputed
    private KsTest integerLabelKs(List<String> base, List<String> curr, double threshold) {
        double[] baseCodes = new double[base.size()];
        double[] currCodes = new double[curr.size()];
        try {
            for (int i = 0; i < base.size(); i++) {
                baseCodes[i] = Long.parseLong(base.get(i));
            }
            for (int i = 0; i < curr.size(); i++) {
                currCodes[i] = Long.parseLong(curr.get(i));
            }
        } catch (NumberFormatException ex) {
            log.debug("KS not computed on non-integer class labels: {}", ex.getMessage());
            return KsTest.notComputed(threshold);
        }
        return DriftStatistics.ksByStatistic(baseCodes, currCodes, threshold);
    }

    private static boolean belowGate(int baseCount, int currCount, DriftThresholds thresholds) {
        int minSamples = Math.max(2, thresholds.getMinSamples());
        return baseCount < minSamples || currCount < minSamples;
    }

    private static PredictionDriftReport skipped(TaskType taskType, int baseCount, int currCount) {
        return PredictionDriftReport.builder()
            .taskType(taskType)
            .baselineSamples(baseCount)
            .currentSamples(currCount)
            .skipped(true)
            .alerts(List.of())
            .overallDrift(false)
            .build();
    }

    private static double[] numbers(List<FieldValue> values) {
        return values.stream()
            .filter(Objects::nonNull)
            .filter(FieldValue::isNumber)
            .mapToDouble(FieldValue::asDouble)
            .toArray();
    }

    private static List<String> labels(List<FieldValue> values) {
        return values.stream()
            .filter(Objects::nonNull)
            .filter(v -> !v.isMissing())
            .map(FieldValue::asLabel)
            .toList();
    }

    private static Map<String, Double> proportions(List<String> labels) {
        Map<String, Long> counts = new TreeMap<>();
        labels.forEach(l -> counts.merge(l, 1L, Long::sum));
        Map<String, Double> shares = new LinkedHashMap<>();
        counts.forEach((label, n) -> shares.put(label, (double) n / labels.size()));
        return shares;
    }

    private static double[] mapped(List<String> labels, Map<String, Double> shares) {
        return labels.stream().mapToDouble(shares::get).toArray();
    }

    private static int count(ShiftTest test) {
        return test != null && test.isDriftDetected() ? 1 : 0;
    }
}
