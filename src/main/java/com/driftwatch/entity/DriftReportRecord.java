package com.driftwatch.entity;

import com.driftwatch.domain.DriftReportType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only history of drift runs. The full report is kept as JSON alongside the
 * summary columns used for listing.
 */
@Entity
@Table(
    name = "drift_reports",
    indexes = {
        @Index(name = "idx_report_project_type", columnList = "project_id, report_type"),
        @Index(name = "idx_report_created",      columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftReportRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "report_type", nullable = false, updatable = false, length = 32)
    private DriftReportType reportType;

    @Column(name = "overall_drift", nullable = false, updatable = false)
    private boolean overallDrift;

    @Column(name = "drift_score", updatable = false)
    private Double driftScore;

    @Column(name = "baseline_start_row", updatable = false)
    private Long baselineStartRow;

    @Column(name = "baseline_end_row", updatable = false)
    private Long baselineEndRow;

    @Column(name = "current_start_row", updatable = false)
    private Long currentStartRow;

    @Column(name = "current_end_row", updatable = false)
    private Long currentEndRow;

    @Column(name = "narrative", length = 20_000, updatable = false)
    private String narrative;

    @Column(name = "report_json", nullable = false, length = 1_000_000, updatable = false)
    private String reportJson;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
