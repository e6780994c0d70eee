package com.driftwatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Two-sample Kolmogorov-Smirnov outcome. Statistic and p-value are null when the
 * test could not run on the supplied values.
 */
@Value
@Builder
@Jacksonized
public class KsTest {
    Double statistic;
    // Jackson derives "pvalue" from getPValue, so the getter carries the name too
    @JsonProperty("pValue")
    @Getter(onMethod_ = @JsonProperty("pValue"))
    Double pValue;
    double threshold;
    boolean driftDetected;

    public static KsTest notComputed(double threshold) {
        return KsTest.builder().threshold(threshold).driftDetected(false).build();
    }
}
