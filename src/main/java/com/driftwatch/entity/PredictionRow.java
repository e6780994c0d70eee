package com.driftwatch.entity;

import com.driftwatch.domain.FieldValue;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "prediction_rows",
    uniqueConstraints = @UniqueConstraint(name = "uk_prediction_row", columnNames = {"project_id", "row_id"}),
    indexes = @Index(name = "idx_prediction_project_row", columnList = "project_id, row_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    @Column(name = "row_id", nullable = false, updatable = false)
    private long rowId;

    @Convert(converter = FieldValueConverter.class)
    @Column(name = "prediction", nullable = false, updatable = false, length = 4096)
    private FieldValue prediction;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
