package com.driftwatch.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
    name = "monitor_windows",
    uniqueConstraints = @UniqueConstraint(name = "uk_monitor_project", columnNames = "project_id")
)
@Getter
@Setter
@NoArgsConstructor
public class MonitorWindow extends RowWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private long projectId;

    public static MonitorWindow forProject(long projectId) {
        MonitorWindow window = new MonitorWindow();
        window.setProjectId(projectId);
        return window;
    }
}
