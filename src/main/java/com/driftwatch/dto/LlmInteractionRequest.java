package com.driftwatch.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LlmInteractionRequest {

    String inputText;

    @NotNull(message = "responseText is required")
    String responseText;
}
