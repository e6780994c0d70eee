package com.driftwatch.repository;

import com.driftwatch.entity.BaselineWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BaselineWindowRepository extends JpaRepository<BaselineWindow, Long> {

    Optional<BaselineWindow> findByProjectId(long projectId);
}
