package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ColumnStatistics {
    double mean;
    double median;
    double std;
    Map<String, Double> quantiles;
    long missingCount;
    long totalCount;
}
