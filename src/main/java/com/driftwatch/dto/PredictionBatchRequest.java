package com.driftwatch.dto;

import com.driftwatch.domain.FieldValue;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class PredictionBatchRequest {

    @NotEmpty(message = "predictions must contain at least one value")
    List<FieldValue> predictions;

    Instant batchTimestamp;
}
