package com.driftwatch.dto;

import com.driftwatch.domain.RecordKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResponse {
    long       projectId;
    RecordKind kind;
    long       rowsIngested;
    long       firstRowId;
    long       lastRowId;
    boolean    baselineReady;
    boolean    monitorReady;
    boolean    driftEvaluated;
    Boolean    overallDrift;
}
