package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Domain-classifier drift result. The drift score is the held-out accuracy of a
 * classifier trained to separate baseline rows from current rows.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelDriftReport {
    double driftScore;
    boolean alert;
    double alertThreshold;
    int baselineSamples;
    int currentSamples;
    int trainSamples;
    int testSamples;
    String modelType;
    List<String> featureColumns;
    WindowDescriptor baselineWindow;
    WindowDescriptor currentWindow;
}
