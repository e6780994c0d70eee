package com.driftwatch.dto;

import com.driftwatch.domain.FieldValue;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class FeatureBatchRequest {

    @NotEmpty(message = "rows must contain at least one feature row")
    List<Map<String, FieldValue>> rows;

    /** Creation time stamped on every row; defaults to the time of ingestion. */
    Instant batchTimestamp;
}
