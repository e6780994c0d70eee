package com.driftwatch.repository;

import com.driftwatch.entity.ProjectMonitoringConfig;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectMonitoringConfigRepository extends JpaRepository<ProjectMonitoringConfig, Long> {
}
