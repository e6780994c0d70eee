package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelDriftSettings {

    @Builder.Default double alertThreshold = 0.50;
    @Builder.Default int ensembleSize = 200;
    @Builder.Default double testFraction = 0.2;
    @Builder.Default int seed = 42;

    public static ModelDriftSettings defaults() {
        return ModelDriftSettings.builder().build();
    }
}
