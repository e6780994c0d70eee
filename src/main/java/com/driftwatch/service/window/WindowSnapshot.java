package com.driftwatch.service.window;

import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.WindowDescriptor;
import com.driftwatch.domain.WindowRange;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows of one window as read from the ledger. Ranges are the bounds of the rows
 * actually retrieved and timestamps are the creation time of the last row.
 */
public record WindowSnapshot(
    Optional<WindowRange> featureRange,
    List<Map<String, FieldValue>> featureRows,
    Instant featureTimestamp,
    Optional<WindowRange> predictionRange,
    List<FieldValue> predictionRows,
    Instant predictionTimestamp
) {

    public WindowDescriptor featureDescriptor() {
        return WindowDescriptor.of(featureRange.orElse(null), featureRows.size(), featureTimestamp);
    }

    public WindowDescriptor predictionDescriptor() {
        return WindowDescriptor.of(predictionRange.orElse(null), predictionRows.size(), predictionTimestamp);
    }
}
