package com.driftwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Test outcomes of one feature column. A shift test is absent when its baseline
 * value was zero.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnDriftTests {
    ShiftTest meanShift;
    ShiftTest medianShift;
    ShiftTest varianceShift;
    KsTest ksTest;
    PsiTest psi;
    int signalCount;
    boolean alerted;
}
