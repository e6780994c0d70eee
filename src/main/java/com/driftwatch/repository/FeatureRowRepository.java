package com.driftwatch.repository;

import com.driftwatch.entity.FeatureRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface FeatureRowRepository extends JpaRepository<FeatureRow, Long> {

    @Query("SELECT COALESCE(MAX(r.rowId), 0) FROM FeatureRow r WHERE r.projectId = :projectId")
    long findMaxRowId(@Param("projectId") long projectId);

    List<FeatureRow> findByProjectIdAndRowIdBetweenOrderByRowIdAsc(long projectId, long fromRow, long toRow);
}
