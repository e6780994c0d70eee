package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Thresholds applied by the statistical battery and the prediction monitor.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DriftThresholds {

    @Builder.Default double meanThreshold = 0.10;
    @Builder.Default double medianThreshold = 0.10;
    @Builder.Default double varianceThreshold = 0.20;
    @Builder.Default double ksPValueThreshold = 0.05;
    @Builder.Default double ksStatisticThreshold = 0.10;
    @Builder.Default double psiLowThreshold = 0.10;
    @Builder.Default double psiHighThreshold = 0.25;
    @Builder.Default int psiBins = 10;
    @Builder.Default int minSamples = 50;
    @Builder.Default int alertThreshold = 2;
    @Builder.Default List<Double> columnQuantiles = List.of(0.25, 0.5, 0.75);
    @Builder.Default List<Double> predictionQuantiles = List.of(0.25, 0.5, 0.75, 0.95);

    public static DriftThresholds defaults() {
        return DriftThresholds.builder().build();
    }
}
