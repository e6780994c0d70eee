package com.driftwatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "llm_interaction_rows",
    uniqueConstraints = @UniqueConstraint(name = "uk_llm_row", columnNames = {"project_id", "row_id"}),
    indexes = @Index(name = "idx_llm_project_row", columnList = "project_id, row_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LlmInteractionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    @Column(name = "row_id", nullable = false, updatable = false)
    private long rowId;

    @Column(name = "input_text", length = 1_000_000, updatable = false)
    private String inputText;

    @Column(name = "response_text", length = 1_000_000, updatable = false)
    private String responseText;

    @Column(name = "response_token_length", nullable = false, updatable = false)
    private int responseTokenLength;

    @Column(name = "drift_affected", nullable = false)
    private boolean driftAffected;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
