package com.driftwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PredictionDriftReport {
    TaskType taskType;
    WindowDescriptor baselineWindow;
    WindowDescriptor currentWindow;
    int baselineSamples;
    int currentSamples;
    boolean skipped;

    ShiftTest meanShift;
    ShiftTest medianShift;
    ShiftTest varianceShift;
    Map<String, ShiftTest> quantileShifts;

    Map<String, Double> baselineClassProportions;
    Map<String, Double> currentClassProportions;
    Map<String, ShiftTest> classRatioShifts;

    KsTest ksTest;
    PsiTest psi;
    int signalCount;
    List<String> alerts;
    boolean overallDrift;
    String narrative;
}
