package com.driftwatch.dto;

import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.FieldValue;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PredictionDriftRequest {

    @NotEmpty(message = "baseline must not be empty")
    List<FieldValue> baseline;

    @NotEmpty(message = "current must not be empty")
    List<FieldValue> current;

    /** regression (default) or classification. */
    String taskType;

    DriftThresholds thresholds;
}
