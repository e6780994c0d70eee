package com.driftwatch.dto;

import com.driftwatch.domain.DriftReportType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftReportResponse {
    UUID            id;
    long            projectId;
    DriftReportType reportType;
    boolean         overallDrift;
    Double          driftScore;
    Long            baselineStartRow;
    Long            baselineEndRow;
    Long            currentStartRow;
    Long            currentEndRow;
    String          narrative;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant         createdAt;
    JsonNode        report;
}
