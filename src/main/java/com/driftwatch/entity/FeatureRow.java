package com.driftwatch.entity;

import com.driftwatch.domain.FieldValue;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(
    name = "feature_rows",
    uniqueConstraints = @UniqueConstraint(name = "uk_feature_row", columnNames = {"project_id", "row_id"}),
    indexes = @Index(name = "idx_feature_project_row", columnList = "project_id, row_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeatureRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    @Column(name = "row_id", nullable = false, updatable = false)
    private long rowId;

    @Convert(converter = FeaturePayloadConverter.class)
    @Column(name = "payload", nullable = false, updatable = false, length = 1_000_000)
    private Map<String, FieldValue> payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
