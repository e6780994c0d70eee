package com.driftwatch.repository;

import com.driftwatch.entity.LlmWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface LlmWindowRepository extends JpaRepository<LlmWindow, Long> {

    Optional<LlmWindow> findByProjectIdAndRole(long projectId, LlmWindow.Role role);
}
