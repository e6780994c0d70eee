package com.driftwatch.service.stats;

import com.driftwatch.domain.ColumnStatistics;
import com.driftwatch.domain.KsTest;
import com.driftwatch.domain.PsiSeverity;
import com.driftwatch.domain.PsiTest;
import com.driftwatch.domain.ShiftTest;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Stateless statistics shared by the feature battery and the prediction monitor.
 * Quantiles use linear interpolation between order statistics (R-7).
 */
public final class DriftStatistics {

    static final double PSI_FLOOR = 1e-6;

    private DriftStatistics() {
    }

    public static OptionalDouble relativeChange(double current, double baseline) {
        if (baseline == 0.0 || Double.isNaN(baseline) || Double.isNaN(current)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.abs(current - baseline) / Math.abs(baseline));
    }

    /** Relative-change test, or null when the baseline value is zero. */
    public static ShiftTest shiftTest(double baseline, double current, double threshold) {
        OptionalDouble change = relativeChange(current, baseline);
        if (change.isEmpty()) {
            return null;
        }
        return ShiftTest.builder()
            .baselineValue(baseline)
            .currentValue(current)
            .value(change.getAsDouble())
            .threshold(threshold)
            .driftDetected(change.getAsDouble() > threshold)
            .build();
    }

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : new Mean().evaluate(values);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /** Sample variance when {@code biasCorrected}, population variance otherwise. */
    public static double variance(double[] values, boolean biasCorrected) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Variance(biasCorrected).evaluate(values);
    }

    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (q <= 0.0) {
            return Arrays.stream(values).min().getAsDouble();
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(values, Math.min(q, 1.0) * 100.0);
    }

    public static ColumnStatistics describe(double[] values, long missingCount, List<Double> quantiles) {
        if (values.length == 0) {
            return null;
        }
        Map<String, Double> qs = new LinkedHashMap<>();
        for (double q : quantiles) {
            qs.put(quantileKey(q), quantile(values, q));
        }
        return ColumnStatistics.builder()
            .mean(mean(values))
            .median(median(values))
            .std(values.length > 1 ? Math.sqrt(variance(values, true)) : 0.0)
            .quantiles(qs)
            .missingCount(missingCount)
            .totalCount(values.length + missingCount)
            .build();
    }

    public static String quantileKey(double q) {
        return "q" + Math.round(q * 100);
    }

    public static double[] ksStatisticAndPValue(double[] baseline, double[] current) {
        KolmogorovSmirnovTest test = new KolmogorovSmirnovTest();
        double statistic = test.kolmogorovSmirnovStatistic(baseline, current);
        double pValue = test.kolmogorovSmirnovTest(baseline, current);
        return new double[] {statistic, pValue};
    }

    /** KS test flagged on the p-value, as used for feature columns. */
    public static KsTest ksByPValue(double[] baseline, double[] current, double pValueThreshold) {
        double[] result = ksStatisticAndPValue(baseline, current);
        return KsTest.builder()
            .statistic(result[0])
            .pValue(result[1])
            .threshold(pValueThreshold)
            .driftDetected(result[1] < pValueThreshold)
            .build();
    }

    /** KS test flagged on the statistic, as used for prediction outputs. */
    public static KsTest ksByStatistic(double[] baseline, double[] current, double statisticThreshold) {
        double[] result = ksStatisticAndPValue(baseline, current);
        return KsTest.builder()
            .statistic(result[0])
            .pValue(result[1])
            .threshold(statisticThreshold)
            .driftDetected(result[0] > statisticThreshold)
            .build();
    }

    /**
     * Population Stability Index with bins cut at the baseline quantiles. Outer edges
     * extend to infinity and empty bins are floored so the logarithm stays finite.
     */
    public static double psi(double[] baseline, double[] current, int bins) {
        if (baseline.length == 0 || current.length == 0 || bins < 1) {
            return 0.0;
        }
        double[] edges = new double[bins + 1];
        for (int i = 0; i <= bins; i++) {
            edges[i] = quantile(baseline, (double) i / bins);
        }
        edges[0] = Double.NEGATIVE_INFINITY;
        edges[bins] = Double.POSITIVE_INFINITY;

        double[] baseShare = proportions(baseline, edges);
        double[] currShare = proportions(current, edges);
        double psi = 0.0;
        for (int i = 0; i < bins; i++) {
            double b = Math.max(baseShare[i], PSI_FLOOR);
            double c = Math.max(currShare[i], PSI_FLOOR);
            psi += (b - c) * Math.log(b / c);
        }
        return psi;
    }

    public static PsiTest psiTest(double[] baseline, double[] current, int bins,
                                  double lowThreshold, double highThreshold) {
        double value = psi(baseline, current, bins);
        return PsiTest.builder()
            .value(value)
            .severity(PsiSeverity.of(value, lowThreshold, highThreshold))
            .lowThreshold(lowThreshold)
            .highThreshold(highThreshold)
            .build();
    }

    // a value equal to an edge lands in the bin to the right of it; the last bin is closed
    private static double[] proportions(double[] values, double[] edges) {
        int bins = edges.length - 1;
        double[] counts = new double[bins];
        for (double v : values) {
            int edgesAtOrBelow = upperBound(edges, v);
            int bin = Math.min(Math.max(edgesAtOrBelow - 1, 0), bins - 1);
            counts[bin]++;
        }
        for (int i = 0; i < bins; i++) {
            counts[i] /= values.length;
        }
        return counts;
    }

    private static int upperBound(double[] sorted, double v) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= v) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
