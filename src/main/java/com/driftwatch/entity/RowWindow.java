package com.driftwatch.entity;

import com.driftwatch.domain.RecordKind;
import com.driftwatch.domain.WindowRange;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * Feature and prediction row ranges of one project. Each pair is independent and
 * stored as {@code (0, 0)} while unset.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class RowWindow {

    @Column(name = "feature_start_row", nullable = false)
    private long featureStartRow;

    @Column(name = "feature_end_row", nullable = false)
    private long featureEndRow;

    @Column(name = "prediction_start_row", nullable = false)
    private long predictionStartRow;

    @Column(name = "prediction_end_row", nullable = false)
    private long predictionEndRow;

    @Version
    private long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Optional<WindowRange> range(RecordKind kind) {
        return switch (kind) {
            case FEATURE -> WindowRange.fromStored(featureStartRow, featureEndRow);
            case PREDICTION -> WindowRange.fromStored(predictionStartRow, predictionEndRow);
            case LLM_INTERACTION -> throw new IllegalArgumentException("LLM windows are stored separately");
        };
    }

    public void assign(RecordKind kind, Optional<WindowRange> range) {
        long start = range.map(WindowRange::startRow).orElse(0L);
        long end = range.map(WindowRange::endRow).orElse(0L);
        switch (kind) {
            case FEATURE -> {
                featureStartRow = start;
                featureEndRow = end;
            }
            case PREDICTION -> {
                predictionStartRow = start;
                predictionEndRow = end;
            }
            case LLM_INTERACTION -> throw new IllegalArgumentException("LLM windows are stored separately");
        }
    }

    public boolean isEmpty() {
        return range(RecordKind.FEATURE).isEmpty() && range(RecordKind.PREDICTION).isEmpty();
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
