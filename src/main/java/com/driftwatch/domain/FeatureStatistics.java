package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FeatureStatistics {
    ColumnStatistics baseline;
    ColumnStatistics current;
}
