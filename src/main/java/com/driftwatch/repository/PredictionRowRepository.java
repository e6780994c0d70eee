package com.driftwatch.repository;

import com.driftwatch.entity.PredictionRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PredictionRowRepository extends JpaRepository<PredictionRow, Long> {

    @Query("SELECT COALESCE(MAX(r.rowId), 0) FROM PredictionRow r WHERE r.projectId = :projectId")
    long findMaxRowId(@Param("projectId") long projectId);

    List<PredictionRow> findByProjectIdAndRowIdBetweenOrderByRowIdAsc(long projectId, long fromRow, long toRow);
}
