package com.driftwatch.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
    name = "baseline_windows",
    uniqueConstraints = @UniqueConstraint(name = "uk_baseline_project", columnNames = "project_id")
)
@Getter
@Setter
@NoArgsConstructor
public class BaselineWindow extends RowWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    public static BaselineWindow forProject(long projectId) {
        BaselineWindow window = new BaselineWindow();
        window.setProjectId(projectId);
        return window;
    }
}
