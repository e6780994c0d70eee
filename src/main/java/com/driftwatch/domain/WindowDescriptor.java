package com.driftwatch.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class WindowDescriptor {
    Long startRow;
    Long endRow;
    int rowCount;
    Instant sourceTimestamp;

    public static WindowDescriptor of(WindowRange range, int rowCount, Instant sourceTimestamp) {
        return WindowDescriptor.builder()
            .startRow(range != null ? range.startRow() : null)
            .endRow(range != null ? range.endRow() : null)
            .rowCount(rowCount)
            .sourceTimestamp(sourceTimestamp)
            .build();
    }

    public static WindowDescriptor adHoc(int rowCount) {
        return WindowDescriptor.builder().rowCount(rowCount).build();
    }

    public String label() {
        if (startRow == null || endRow == null) {
            return rowCount + " rows";
        }
        return "rows " + startRow + " to " + endRow;
    }
}
