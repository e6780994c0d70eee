package com.driftwatch.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class LlmInteractionBatchRequest {

    @NotEmpty(message = "interactions must contain at least one entry")
    List<@Valid LlmInteractionRequest> interactions;

    Instant batchTimestamp;
}
