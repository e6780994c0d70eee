package com.driftwatch.dto;

import com.driftwatch.domain.WindowRange;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WindowsResponse {
    long        projectId;
    WindowRange featureBaseline;
    WindowRange featureMonitor;
    WindowRange predictionBaseline;
    WindowRange predictionMonitor;
    WindowRange llmBaseline;
    WindowRange llmMonitor;
}
