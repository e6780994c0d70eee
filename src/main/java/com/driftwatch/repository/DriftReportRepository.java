package com.driftwatch.repository;

import com.driftwatch.domain.DriftReportType;
import com.driftwatch.entity.DriftReportRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface DriftReportRepository extends JpaRepository<DriftReportRecord, UUID> {

    Page<DriftReportRecord> findByProjectIdAndReportTypeOrderByCreatedAtDesc(
        long projectId, DriftReportType reportType, Pageable pageable);

    long countByProjectIdAndReportType(long projectId, DriftReportType reportType);
}
