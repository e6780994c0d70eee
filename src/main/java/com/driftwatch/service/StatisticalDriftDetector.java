package com.driftwatch.service;

import com.driftwatch.domain.ColumnDriftTests;
import com.driftwatch.domain.DriftReport;
import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.FeatureFrame;
import com.driftwatch.domain.FeatureStatistics;
import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.KsTest;
import com.driftwatch.domain.PsiTest;
import com.driftwatch.domain.ShiftTest;
import com.driftwatch.domain.WindowDescriptor;
import com.driftwatch.exception.WindowShapeMismatchException;
import com.driftwatch.service.stats.DriftStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the per-column test battery over the numeric feature columns of two windows.
 *
 * <p>A column is tested only when both sides hold at least {@code minSamples}
 * non-missing values; otherwise it keeps its descriptive statistics and gets no
 * test entry. The drift score is the share of tested columns that alerted.
 */
@Slf4j
@Service
public class StatisticalDriftDetector {

    public DriftReport runStatisticalDrift(List<Map<String, FieldValue>> baselineRows,
                                           List<Map<String, FieldValue>> currentRows,
                                           DriftThresholds thresholds) {
        return runStatisticalDrift(baselineRows, currentRows, thresholds,
            WindowDescriptor.adHoc(baselineRows.size()), WindowDescriptor.adHoc(currentRows.size()));
    }

    public DriftReport runStatisticalDrift(List<Map<String, FieldValue>> baselineRows,
                                           List<Map<String, FieldValue>> currentRows,
                                           DriftThresholds thresholds,
                                           WindowDescriptor baselineWindow,
                                           WindowDescriptor currentWindow) {
        FeatureFrame baseline = FeatureFrame.of(baselineRows);
        FeatureFrame current = FeatureFrame.of(currentRows);
        List<String> numericColumns = baseline.numericColumns();
        int minSamples = Math.max(2, thresholds.getMinSamples());

        Map<String, FeatureStatistics> featureStats = new LinkedHashMap<>();
        Map<String, ColumnDriftTests> driftTests = new LinkedHashMap<>();
        List<String> alerts = new ArrayList<>();

        for (String column : numericColumns) {
            if (!current.hasColumn(column)) {
                throw new WindowShapeMismatchException(column);
            }
            double[] base = baseline.values(column);
            double[] curr = current.values(column);
            featureStats.put(column, FeatureStatistics.builder()
                .baseline(DriftStatistics.describe(base, baseline.missingCount(column), thresholds.getColumnQuantiles()))
                .current(DriftStatistics.describe(curr, current.missingCount(column), thresholds.getColumnQuantiles()))
                .build());

            if (base.length < minSamples || curr.length < minSamples) {
                log.debug("Column skipped | column={} | baseline={} | current={} | minSamples={}",
                          column, base.length, curr.length, minSamples);
                continue;
            }
            ColumnDriftTests tests = testColumn(base, curr, thresholds);
            driftTests.put(column, tests);
            if (tests.isAlerted()) {
                alerts.add(column);
            }
        }

        int eligible = driftTests.size();
        double driftScore = eligible == 0 ? 0.0 : (double) alerts.size() / eligible;
        log.info("Statistical drift computed | columns={} | tested={} | alerted={} | score={}",
                 numericColumns.size(), eligible, alerts.size(), driftScore);

        return DriftReport.builder()
            .baselineWindow(baselineWindow)
            .currentWindow(currentWindow)
            .featureStats(featureStats)
            .driftTests(driftTests)
            .alerts(alerts)
            .overallDrift(!alerts.isEmpty())
            .driftScore(driftScore)
            .build();
    }

    ColumnDriftTests testColumn(double[] base, double[] curr, DriftThresholds thresholds) {
        ShiftTest meanShift = DriftStatistics.shiftTest(
            DriftStatistics.mean(base), DriftStatistics.mean(curr), thresholds.getMeanThreshold());
        ShiftTest medianShift = DriftStatistics.shiftTest(
            DriftStatistics.median(base), DriftStatistics.median(curr), thresholds.getMedianThreshold());
        ShiftTest varianceShift = DriftStatistics.shiftTest(
            DriftStatistics.variance(base, true), DriftStatistics.variance(curr, true),
            thresholds.getVarianceThreshold());
        KsTest ks = DriftStatistics.ksByPValue(base, curr, thresholds.getKsPValueThreshold());
        PsiTest psi = DriftStatistics.psiTest(base, curr, thresholds.getPsiBins(),
            thresholds.getPsiLowThreshold(), thresholds.getPsiHighThreshold());

        int signals = 0;
        signals += fired(meanShift);
        signals += fired(medianShift);
        signals += fired(varianceShift);
        signals += ks.isDriftDetected() ? 1 : 0;
        signals += psi.isHigh() ? 1 : 0;

        return ColumnDriftTests.builder()
            .meanShift(meanShift)
            .medianShift(medianShift)
            .varianceShift(varianceShift)
            .ksTest(ks)
            .psi(psi)
            .signalCount(signals)
            .alerted(signals >= thresholds.getAlertThreshold())
            .build();
    }

    private static int fired(ShiftTest test) {
        return test != null && test.isDriftDetected() ? 1 : 0;
    }
}
