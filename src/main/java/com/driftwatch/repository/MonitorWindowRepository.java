package com.driftwatch.repository;

import com.driftwatch.entity.MonitorWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MonitorWindowRepository extends JpaRepository<MonitorWindow, Long> {

    Optional<MonitorWindow> findByProjectId(long projectId);
}
