package com.driftwatch.entity;

import com.driftwatch.domain.WindowRange;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * LLM baseline or monitor window with the average response token length measured
 * over it.
 */
@Entity
@Table(
    name = "llm_windows",
    uniqueConstraints = @UniqueConstraint(name = "uk_llm_window", columnNames = {"project_id", "role"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LlmWindow {

    public enum Role { BASELINE, MONITOR }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private Role role;

    @Column(name = "start_row", nullable = false)
    private long startRow;

    @Column(name = "end_row", nullable = false)
    private long endRow;

    @Column(name = "avg_token_length")
    private Double avgTokenLength;

    @Version
    private long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WindowRange range() {
        return new WindowRange(startRow, endRow);
    }

    public void moveTo(WindowRange range) {
        this.startRow = range.startRow();
        this.endRow = range.endRow();
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
