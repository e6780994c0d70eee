package com.driftwatch.dto;

import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.FieldValue;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class StatisticalDriftRequest {

    @NotEmpty(message = "baselineRows must not be empty")
    List<Map<String, FieldValue>> baselineRows;

    @NotEmpty(message = "currentRows must not be empty")
    List<Map<String, FieldValue>> currentRows;

    /** Optional; application defaults apply when omitted. */
    DriftThresholds thresholds;
}
