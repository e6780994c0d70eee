package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Result of one statistical drift run over the feature columns of two windows.
 * Columns below the sample gate appear in {@code featureStats} only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DriftReport {
    WindowDescriptor baselineWindow;
    WindowDescriptor currentWindow;
    Map<String, FeatureStatistics> featureStats;
    Map<String, ColumnDriftTests> driftTests;
    List<String> alerts;
    boolean overallDrift;
    double driftScore;
    String narrative;
}
